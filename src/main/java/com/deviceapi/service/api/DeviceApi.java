package com.deviceapi.service.api;

import com.deviceapi.dto.response.AppXPackages;
import com.deviceapi.dto.response.IpConfig;
import com.deviceapi.dto.response.MachineName;
import com.deviceapi.dto.response.SoftwareInfo;
import com.deviceapi.model.Connection;
import com.deviceapi.model.Credentials;
import reactor.core.publisher.Mono;

/**
 * An interface defining the read operations offered by a device's management API.
 * <p>
 * Every operation is a single GET against a fixed path. The returned {@link Mono} is lazy,
 * completes empty when the device sends no usable body, and errors when the request itself
 * fails.
 */
public interface DeviceApi {

    /**
     * Sets the connection and credentials together and rebuilds the transport.
     *
     * @param connection  The device endpoint.
     * @param credentials The authentication material for that endpoint.
     * @throws com.deviceapi.exception.InvalidArgumentException if either argument is null.
     */
    void initialize(Connection connection, Credentials credentials);

    Connection getConnection();

    /**
     * Replaces the connection and rebuilds the transport.
     *
     * @param connection The new device endpoint.
     * @throws com.deviceapi.exception.InvalidArgumentException    if {@code connection} is null.
     * @throws com.deviceapi.exception.PreconditionFailedException if no credentials have been set yet.
     */
    void setConnection(Connection connection);

    Credentials getCredentials();

    /**
     * Replaces the credentials and rebuilds the transport.
     *
     * @param credentials The new authentication material.
     * @throws com.deviceapi.exception.InvalidArgumentException    if {@code credentials} is null.
     * @throws com.deviceapi.exception.PreconditionFailedException if no connection has been set yet.
     */
    void setCredentials(Credentials credentials);

    /**
     * @return The device's machine name.
     */
    Mono<MachineName> getMachineName();

    /**
     * @return Operating system details of the device.
     */
    Mono<SoftwareInfo> getSoftwareInfo();

    /**
     * @return The device's network adapter configuration.
     */
    Mono<IpConfig> getIpConfig();

    /**
     * @return The AppX packages installed on the device.
     */
    Mono<AppXPackages> getInstalledPackages();
}
