package com.deviceapi.exception;

/**
 * Thrown when the transport is built or used before both a connection and credentials are set.
 */
public class PreconditionFailedException extends DeviceApiException {

    public PreconditionFailedException(String message) {
        super(message);
    }
}
