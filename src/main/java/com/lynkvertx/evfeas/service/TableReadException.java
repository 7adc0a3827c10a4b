package com.lynkvertx.evfeas.service;

/**
 * Thrown when an uploaded file cannot be decoded into a table.
 */
public class TableReadException extends RuntimeException {

    public TableReadException(String message) {
        super(message);
    }

    public TableReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
