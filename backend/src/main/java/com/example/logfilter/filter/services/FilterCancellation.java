package com.example.logfilter.filter.services;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal for a running filter. Checked before every pull
 * from the source; once set it stays set.
 */
public final class FilterCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static FilterCancellation none() {
        return new FilterCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
