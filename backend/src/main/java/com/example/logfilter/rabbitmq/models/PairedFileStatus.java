package com.example.logfilter.rabbitmq.models;

public enum PairedFileStatus {
    /** Only one of the two files exists. */
    PARTIAL,
    /** Main file and headers file both exist. */
    COMPLETE,
    /** Main file embeds message, sentTime and headers; a headers file may also exist. */
    UNIFIED_JSON,
    /** Input could not be paired at all. */
    FAILED
}
