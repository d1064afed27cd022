package com.deviceapi.exception;

/**
 * Signals that a device response body could not be decoded into the requested type.
 * <p>
 * Only raised by the typed getters when the client runs with
 * {@link com.deviceapi.model.DecodePolicy#STRICT}; the lenient policy reports the same
 * condition as an empty result.
 */
public class ResponseDecodeException extends DeviceApiException {

    private final String path;

    public ResponseDecodeException(String path, Class<?> type, Throwable cause) {
        super("Could not decode response from " + path + " as " + type.getSimpleName(), cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
