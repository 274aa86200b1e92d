package com.schedq;

/**
 * Raised when a job, trigger or schedule is declared with missing or contradictory settings.
 * Always thrown at definition time, never while a job runs.
 */
public class InvalidJobDefinitionException extends IllegalArgumentException {

    public InvalidJobDefinitionException(String message) {
        super(message);
    }

    public InvalidJobDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
