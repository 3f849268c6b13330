package com.skanga.sqlgate.context;

/**
 * Severity of a message on the output channel.
 */
public enum OutputLevel {
    INFO,
    WARNING,
    ERROR
}
