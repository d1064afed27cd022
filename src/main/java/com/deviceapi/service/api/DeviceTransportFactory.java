package com.deviceapi.service.api;

import com.deviceapi.model.Connection;
import com.deviceapi.model.Credentials;

/**
 * Creates a {@link DeviceTransport} for a connection and credentials pair.
 */
@FunctionalInterface
public interface DeviceTransportFactory {

    /**
     * @param connection  The device endpoint, never null.
     * @param credentials The credentials to apply to every request, never null.
     * @return A transport bound to both.
     */
    DeviceTransport create(Connection connection, Credentials credentials);
}
