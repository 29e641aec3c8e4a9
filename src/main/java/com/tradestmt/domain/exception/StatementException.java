package com.tradestmt.domain.exception;

/**
 * Base class for failures the operator has to act on
 */
public class StatementException extends RuntimeException {

    public StatementException(String message) {
        super(message);
    }

    public StatementException(String message, Throwable cause) {
        super(message, cause);
    }
}
