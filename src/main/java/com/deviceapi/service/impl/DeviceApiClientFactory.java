package com.deviceapi.service.impl;

import com.deviceapi.model.Connection;
import com.deviceapi.model.Credentials;
import com.deviceapi.model.DecodePolicy;
import com.deviceapi.service.api.DeviceTransportFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Hands out {@link DeviceApiClient} instances that share the application's transport factory,
 * JSON mapper and decode policy.
 * <p>
 * Prefer {@link #open(Connection, Credentials)} over mutating a shared client: every call returns
 * a new client bound to exactly the pair it was given.
 */
@Service
public class DeviceApiClientFactory {

    private final DeviceTransportFactory transportFactory;
    private final ObjectMapper objectMapper;
    private final DecodePolicy decodePolicy;

    public DeviceApiClientFactory(DeviceTransportFactory transportFactory,
                                  ObjectMapper objectMapper,
                                  @Value("${device.api.decode-policy:LENIENT}") DecodePolicy decodePolicy) {
        this.transportFactory = transportFactory;
        this.objectMapper = objectMapper;
        this.decodePolicy = decodePolicy;
    }

    /**
     * @return A new client with no connection or credentials.
     */
    public DeviceApiClient create() {
        return new DeviceApiClient(transportFactory, objectMapper, decodePolicy);
    }

    /**
     * @param connection  The device endpoint.
     * @param credentials The authentication material for that endpoint.
     * @return A new client, ready to fetch.
     * @throws com.deviceapi.exception.InvalidArgumentException if either argument is null.
     */
    public DeviceApiClient open(Connection connection, Credentials credentials) {
        return new DeviceApiClient(transportFactory, objectMapper, decodePolicy, connection, credentials);
    }
}
