package com.deviceapi.model;

import com.deviceapi.exception.InvalidArgumentException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * The endpoint address of a target device.
 * <p>
 * Values are validated on construction, so any {@code Connection} that exists can be turned into
 * a base URL. Replacing a client's connection forces its transport to be rebuilt.
 *
 * @param scheme Either {@code http} or {@code https}, stored in lower case.
 * @param host   The device host name or IP address.
 * @param port   The Device Portal port, between 1 and 65535.
 */
public record Connection(String scheme, String host, int port) {

    public static final String HTTP = "http";
    public static final String HTTPS = "https";
    public static final int DEFAULT_HTTP_PORT = 8080;
    public static final int DEFAULT_HTTPS_PORT = 443;

    public Connection {
        InvalidArgumentException.requireText(scheme, "scheme");
        InvalidArgumentException.requireText(host, "host");
        scheme = scheme.toLowerCase(Locale.ROOT);
        if (!HTTP.equals(scheme) && !HTTPS.equals(scheme)) {
            throw new InvalidArgumentException("Unsupported scheme '" + scheme + "', expected http or https");
        }
        if (port < 1 || port > 65535) {
            throw new InvalidArgumentException("Port out of range: " + port);
        }
        host = host.trim();
    }

    /**
     * Creates a plain HTTP connection on the default Device Portal port.
     *
     * @param host The device host name or IP address.
     * @return A new connection.
     */
    public static Connection of(String host) {
        return new Connection(HTTP, host, DEFAULT_HTTP_PORT);
    }

    /**
     * Parses a connection from a URL such as {@code https://10.0.0.5:8443}. A missing scheme is
     * treated as {@code http}; a missing port falls back to the scheme's default.
     *
     * @param url The device URL.
     * @return A new connection.
     * @throws InvalidArgumentException if the URL is blank or cannot be parsed.
     */
    public static Connection parse(String url) {
        InvalidArgumentException.requireText(url, "url");
        String candidate = url.trim();
        if (!candidate.contains("://")) {
            candidate = HTTP + "://" + candidate;
        }
        URI uri;
        try {
            uri = new URI(candidate);
        } catch (URISyntaxException e) {
            throw new InvalidArgumentException("Malformed device URL '" + url + "': " + e.getReason());
        }
        if (uri.getHost() == null) {
            throw new InvalidArgumentException("Device URL '" + url + "' has no host");
        }
        String scheme = uri.getScheme() == null ? HTTP : uri.getScheme();
        int port = uri.getPort();
        if (port == -1) {
            port = HTTPS.equalsIgnoreCase(scheme) ? DEFAULT_HTTPS_PORT : DEFAULT_HTTP_PORT;
        }
        return new Connection(scheme, uri.getHost(), port);
    }

    /**
     * @return The base URL every API path is appended to, without a trailing slash.
     */
    public String baseUrl() {
        return scheme + "://" + host + ":" + port;
    }
}
