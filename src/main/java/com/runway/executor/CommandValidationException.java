package com.runway.executor;

/**
 * A command was routed to a strategy that does not support its kind. This is a
 * programming-contract violation, raised before any process starts.
 */
public class CommandValidationException extends RuntimeException {

    public CommandValidationException(String message) {
        super(message);
    }
}
