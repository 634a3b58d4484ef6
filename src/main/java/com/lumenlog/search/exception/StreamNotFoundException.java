package com.lumenlog.search.exception;

/**
 * Thrown when a stream named in the FROM clause has no schema
 */
public class StreamNotFoundException extends SearchException {

    public StreamNotFoundException(String message) {
        super(message);
    }

    public StreamNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
