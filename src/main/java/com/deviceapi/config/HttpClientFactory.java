package com.deviceapi.config;

import com.deviceapi.service.api.DeviceTransportFactory;
import com.deviceapi.service.impl.WebClientDeviceTransport;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * A Spring configuration class responsible for the HTTP side of the device client.
 * <p>
 * Device transports are short-lived compared to the application: one is built every time a
 * client's connection or credentials change. This factory captures the Spring-managed
 * {@link WebClient.Builder} so each transport starts from the same codecs and filters.
 * Requests are attempted once; there is no retry filter.
 */
@Configuration
public class HttpClientFactory {

    /**
     * Creates the factory that turns a connection and credentials pair into a WebClient-backed
     * transport.
     *
     * @param webClientBuilder The builder provided by Spring Boot's WebClient auto-configuration.
     * @return A {@link DeviceTransportFactory} producing {@link WebClientDeviceTransport}s.
     */
    @Bean
    public DeviceTransportFactory deviceTransportFactory(WebClient.Builder webClientBuilder) {
        return (connection, credentials) -> new WebClientDeviceTransport(webClientBuilder, connection, credentials);
    }
}
