package com.example.logfilter.filter.strategy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.ConcurrentLruCache;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Bounded, thread-safe cache of compiled case-insensitive patterns keyed by
 * their source text. Least recently used entries are evicted first.
 */
@Slf4j
public class RegexPatternCache {

    public static final int DEFAULT_CAPACITY = 50;

    private final ConcurrentLruCache<String, Pattern> cache;

    public RegexPatternCache() {
        this(DEFAULT_CAPACITY);
    }

    public RegexPatternCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Regex cache capacity must be positive, got " + capacity);
        }
        this.cache = new ConcurrentLruCache<>(capacity, RegexPatternCache::compile);
    }

    /**
     * @throws PatternSyntaxException if the pattern does not compile; nothing is cached then
     */
    public Pattern get(String regex) {
        return cache.get(regex);
    }

    public boolean isValid(String regex) {
        if (regex == null) {
            return false;
        }
        try {
            get(regex);
            return true;
        } catch (PatternSyntaxException e) {
            log.debug("Rejected regex '{}': {}", regex, e.getDescription());
            return false;
        }
    }

    public boolean contains(String regex) {
        return cache.contains(regex);
    }

    public int size() {
        return cache.size();
    }

    public int capacity() {
        return cache.capacity();
    }

    public void clear() {
        cache.clear();
    }

    private static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
