package com.deviceapi.model;

import com.deviceapi.exception.InvalidArgumentException;
import org.springframework.http.HttpHeaders;

/**
 * A pre-issued access token sent as {@code Authorization: Bearer <token>}.
 *
 * @param token The token value, never blank.
 */
public record TokenCredentials(String token) implements Credentials {

    public TokenCredentials {
        InvalidArgumentException.requireText(token, "token");
    }

    @Override
    public void applyTo(HttpHeaders headers) {
        headers.setBearerAuth(token);
    }

    @Override
    public String toString() {
        return "TokenCredentials[token=****]";
    }
}
