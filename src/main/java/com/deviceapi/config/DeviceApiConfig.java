package com.deviceapi.config;

import com.deviceapi.model.BasicCredentials;
import com.deviceapi.model.Connection;
import com.deviceapi.model.Credentials;
import com.deviceapi.model.TokenCredentials;
import com.deviceapi.service.impl.DeviceApiClient;
import com.deviceapi.service.impl.DeviceApiClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers a ready-to-use {@link DeviceApiClient} when a device URL is configured.
 * <p>
 * Properties:
 * <ul>
 *   <li>{@code device.api.url} - the Device Portal address, e.g. {@code http://192.168.1.20:8080}.</li>
 *   <li>{@code device.api.username} / {@code device.api.password} - Basic authentication.</li>
 *   <li>{@code device.api.token} - bearer token; takes precedence over username and password.</li>
 * </ul>
 */
@Configuration
@Slf4j
public class DeviceApiConfig {

    @Bean
    @ConditionalOnProperty(prefix = "device.api", name = "url")
    public DeviceApiClient deviceApiClient(DeviceApiClientFactory clientFactory,
                                           @Value("${device.api.url}") String url,
                                           @Value("${device.api.username:}") String username,
                                           @Value("${device.api.password:}") String password,
                                           @Value("${device.api.token:}") String token) {
        Connection connection = Connection.parse(url);
        Credentials credentials = resolveCredentials(username, password, token);
        log.info("Configuring device client for {}", connection.baseUrl());
        return clientFactory.open(connection, credentials);
    }

    /**
     * Picks the credential type from the configured values.
     *
     * @return {@link TokenCredentials} if a token is set, otherwise {@link BasicCredentials}.
     * @throws com.deviceapi.exception.InvalidArgumentException if neither a token nor a username is set.
     */
    static Credentials resolveCredentials(String username, String password, String token) {
        if (token != null && !token.isBlank()) {
            return new TokenCredentials(token);
        }
        return new BasicCredentials(username, password == null ? "" : password);
    }
}
