package com.deviceapi.service.impl;

import com.deviceapi.model.Connection;
import com.deviceapi.model.Credentials;
import com.deviceapi.service.api.DeviceTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * A {@link DeviceTransport} backed by a Spring {@link WebClient}.
 * <p>
 * Each instance owns its own WebClient, derived from the shared builder, with the device base URL
 * and the authorization header baked in. Changing either requires a new transport.
 */
@Slf4j
public class WebClientDeviceTransport implements DeviceTransport {

    private final WebClient webClient;
    private final String baseUrl;

    /**
     * @param webClientBuilder The Spring-configured builder. It is cloned, never mutated.
     * @param connection       The device endpoint.
     * @param credentials      Applied as a default header to every request.
     */
    public WebClientDeviceTransport(WebClient.Builder webClientBuilder, Connection connection, Credentials credentials) {
        this.baseUrl = connection.baseUrl();
        this.webClient = webClientBuilder.clone()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeaders(credentials::applyTo)
                .build();
    }

    @Override
    public Mono<String> get(String path) {
        return webClient.get()
                .uri(path)
                .retrieve()
                .bodyToMono(String.class)
                .doOnSubscribe(subscription -> log.debug("GET {}{}", baseUrl, path))
                .doOnError(e -> log.debug("GET {}{} failed: {}", baseUrl, path, e.getMessage()));
    }
}
