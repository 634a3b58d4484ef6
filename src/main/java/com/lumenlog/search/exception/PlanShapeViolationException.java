package com.lumenlog.search.exception;

/**
 * Thrown when a serialized plan does not contain exactly one placeholder scan
 */
public class PlanShapeViolationException extends SearchException {

    public PlanShapeViolationException(String message) {
        super(message);
    }

    public PlanShapeViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
