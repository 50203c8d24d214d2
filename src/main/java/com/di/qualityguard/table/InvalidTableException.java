package com.di.qualityguard.table;

/**
 * Thrown when a table cannot be analysed at all: no columns, duplicate column names,
 * columns of unequal length, or an upload that is not parseable CSV.
 *
 * <p>Raised before any profiling starts. Caught by
 * {@link com.di.qualityguard.exception.GlobalExceptionHandler} and returned as 400 Bad Request.
 */
public class InvalidTableException extends RuntimeException {

    public InvalidTableException(String message) {
        super(message);
    }

    public InvalidTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
