package com.rulesync.rulesync.api;

/**
 * Signals that a remote listing could not be produced at all.
 */
public class RemoteServiceException extends RuntimeException {

    public RemoteServiceException(String message) {
        super(message);
    }

    public RemoteServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
