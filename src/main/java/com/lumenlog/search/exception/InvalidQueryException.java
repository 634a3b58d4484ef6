package com.lumenlog.search.exception;

/**
 * Thrown when the SQL text cannot be parsed or is not a supported query shape
 */
public class InvalidQueryException extends SearchException {

    public InvalidQueryException(String message) {
        super(message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
