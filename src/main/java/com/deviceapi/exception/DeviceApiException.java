package com.deviceapi.exception;

/**
 * Base runtime exception for errors raised by the device API client itself.
 * <p>
 * Transport-level failures reported by the underlying WebClient are not wrapped in this type;
 * they reach the caller unchanged.
 */
public class DeviceApiException extends RuntimeException {

    /**
     * Constructs a new DeviceApiException with the specified detail message.
     *
     * @param message The detail message.
     */
    public DeviceApiException(String message) {
        super(message);
    }

    /**
     * Constructs a new DeviceApiException with the specified detail message and cause.
     *
     * @param message The detail message.
     * @param cause   The cause, or {@code null} if it is unknown.
     */
    public DeviceApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
