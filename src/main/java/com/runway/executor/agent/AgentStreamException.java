package com.runway.executor.agent;

/**
 * The agent stream could not be started or ended abnormally.
 */
public class AgentStreamException extends RuntimeException {

    public AgentStreamException(String message) {
        super(message);
    }

    public AgentStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
