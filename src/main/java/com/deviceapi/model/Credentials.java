package com.deviceapi.model;

import org.springframework.http.HttpHeaders;

/**
 * Authentication material used to authorize requests against a device.
 * <p>
 * The transport applies the credentials to every outgoing request. Replacing a client's
 * credentials forces its transport to be rebuilt.
 */
public sealed interface Credentials permits BasicCredentials, TokenCredentials {

    /**
     * Writes the authorization for these credentials onto the given request headers.
     *
     * @param headers The outgoing request headers.
     */
    void applyTo(HttpHeaders headers);
}
