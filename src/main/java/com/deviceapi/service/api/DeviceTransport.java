package com.deviceapi.service.api;

import reactor.core.publisher.Mono;

/**
 * An HTTP transport bound to one device connection and one set of credentials.
 */
public interface DeviceTransport {

    /**
     * Issues a GET request for the given API path.
     *
     * @param path The absolute API path, e.g. {@code /api/os/info}.
     * @return The response body, or an empty {@link Mono} when the device answers without one.
     *         Network failures and non-success status codes are signalled as errors.
     */
    Mono<String> get(String path);
}
