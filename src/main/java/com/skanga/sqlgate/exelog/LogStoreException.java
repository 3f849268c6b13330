package com.skanga.sqlgate.exelog;

/**
 * Raised by an {@link ExecutionLogStore} when the backing store cannot be prepared, written or read.
 */
public class LogStoreException extends Exception {
    public LogStoreException(String message) {
        super(message);
    }

    public LogStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
