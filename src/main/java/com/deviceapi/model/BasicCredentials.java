package com.deviceapi.model;

import com.deviceapi.exception.InvalidArgumentException;
import org.springframework.http.HttpHeaders;

/**
 * Username and password sent as HTTP Basic authentication, the scheme the Device Portal uses
 * by default.
 *
 * @param username The Device Portal user name, never blank.
 * @param password The password, never null.
 */
public record BasicCredentials(String username, String password) implements Credentials {

    public BasicCredentials {
        InvalidArgumentException.requireText(username, "username");
        InvalidArgumentException.requirePresent(password, "password");
    }

    @Override
    public void applyTo(HttpHeaders headers) {
        headers.setBasicAuth(username, password);
    }

    @Override
    public String toString() {
        return "BasicCredentials[username=" + username + ", password=****]";
    }
}
