package com.runway.bridge;

/**
 * Raised when the callback bridge cannot bind its listener or is used out of order.
 */
public class CallbackBridgeException extends RuntimeException {

    public CallbackBridgeException(String message) {
        super(message);
    }

    public CallbackBridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
