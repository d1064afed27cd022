package com.deviceapi.model;

/**
 * Controls how the typed getters treat a response body that is not valid JSON for the
 * requested type.
 */
public enum DecodePolicy {

    /**
     * A malformed body is reported the same way as a missing body: the result is empty.
     */
    LENIENT,

    /**
     * A malformed body fails the result with a
     * {@link com.deviceapi.exception.ResponseDecodeException}.
     */
    STRICT
}
