package com.deviceapi.exception;

/**
 * Thrown when a connection or credentials value passed to the client is absent or malformed.
 * The client's state is left untouched when this is raised.
 */
public class InvalidArgumentException extends DeviceApiException {

    public InvalidArgumentException(String message) {
        super(message);
    }

    /**
     * Fails with an {@link InvalidArgumentException} naming the argument if {@code value} is null.
     *
     * @param value The value to check.
     * @param name  The argument name used in the message.
     * @param <T>   The value type.
     * @return The value, if present.
     */
    public static <T> T requirePresent(T value, String name) {
        if (value == null) {
            throw new InvalidArgumentException(name + " must not be null");
        }
        return value;
    }

    /**
     * Fails with an {@link InvalidArgumentException} if {@code value} is null or blank.
     *
     * @param value The value to check.
     * @param name  The argument name used in the message.
     * @return The value, if present and not blank.
     */
    public static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new InvalidArgumentException(name + " must not be blank");
        }
        return value;
    }
}
