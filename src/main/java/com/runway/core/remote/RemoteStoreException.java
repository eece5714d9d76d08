package com.runway.core.remote;

/**
 * Thrown when the remote store cannot be reached or answers with a non-2xx status.
 */
public class RemoteStoreException extends RuntimeException {

    private final int statusCode;

    public RemoteStoreException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public RemoteStoreException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status, or -1 for transport failures. */
    public int getStatusCode() {
        return statusCode;
    }
}
