package com.lumenlog.search.exception;

/**
 * Thrown when the schema registry, file catalog or byte cache fails
 */
public class UpstreamIoException extends SearchException {

    public UpstreamIoException(String message) {
        super(message);
    }

    public UpstreamIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
