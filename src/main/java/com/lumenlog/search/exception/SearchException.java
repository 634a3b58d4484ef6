package com.lumenlog.search.exception;

/**
 * Base class for all failures raised by the search core
 */
public class SearchException extends RuntimeException {

    public SearchException(String message) {
        super(message);
    }

    public SearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
