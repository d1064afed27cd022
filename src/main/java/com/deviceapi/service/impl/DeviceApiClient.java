package com.deviceapi.service.impl;

import com.deviceapi.dto.response.AppXPackages;
import com.deviceapi.dto.response.IpConfig;
import com.deviceapi.dto.response.MachineName;
import com.deviceapi.dto.response.SoftwareInfo;
import com.deviceapi.exception.InvalidArgumentException;
import com.deviceapi.exception.PreconditionFailedException;
import com.deviceapi.exception.ResponseDecodeException;
import com.deviceapi.model.Connection;
import com.deviceapi.model.Credentials;
import com.deviceapi.model.DecodePolicy;
import com.deviceapi.model.DecodeResult;
import com.deviceapi.service.api.DeviceApi;
import com.deviceapi.service.api.DeviceTransport;
import com.deviceapi.service.api.DeviceTransportFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Windows IoT Device Portal client implementing {@link DeviceApi}.
 * <p>
 * The client keeps the current {@link Connection} and {@link Credentials} and derives a
 * {@link DeviceTransport} from them. Any change to either one rebuilds the transport. A fetch
 * uses the transport that was current when the fetch method was called, so mutating the client
 * while requests are in flight is safe but unordered: those requests finish against whichever
 * endpoint they started with.
 * <p>
 * Response bodies are decoded on a best-effort basis. A missing body always yields an empty
 * result. A body that cannot be decoded yields an empty result under
 * {@link DecodePolicy#LENIENT} and a {@link ResponseDecodeException} under
 * {@link DecodePolicy#STRICT}. Use {@link #fetchResult(String, Class)} to tell the two cases
 * apart regardless of policy.
 */
@Slf4j
public class DeviceApiClient implements DeviceApi {

    static final String INSTALLED_PACKAGES_PATH = "/api/appx/packagemanager/packages";
    static final String IP_CONFIG_PATH = "/api/networking/ipconfig";
    static final String MACHINE_NAME_PATH = "/api/os/machinename";
    static final String SOFTWARE_INFO_PATH = "/api/os/info";

    private final DeviceTransportFactory transportFactory;
    private final ObjectMapper objectMapper;
    private final DecodePolicy decodePolicy;

    private volatile Connection currentConnection;
    private volatile Credentials currentCredentials;
    private volatile DeviceTransport transport;

    /**
     * Creates an unconfigured client. Call {@link #initialize(Connection, Credentials)} before
     * fetching anything.
     *
     * @param transportFactory Builds the transport whenever the connection or credentials change.
     * @param objectMapper     Decodes response bodies.
     * @param decodePolicy     What to do with bodies that cannot be decoded.
     */
    public DeviceApiClient(DeviceTransportFactory transportFactory, ObjectMapper objectMapper, DecodePolicy decodePolicy) {
        this.transportFactory = InvalidArgumentException.requirePresent(transportFactory, "transportFactory");
        this.objectMapper = InvalidArgumentException.requirePresent(objectMapper, "objectMapper");
        this.decodePolicy = InvalidArgumentException.requirePresent(decodePolicy, "decodePolicy");
    }

    /**
     * Creates a client with default JSON settings and lenient decoding.
     *
     * @param transportFactory Builds the transport whenever the connection or credentials change.
     */
    public DeviceApiClient(DeviceTransportFactory transportFactory) {
        this(transportFactory, defaultObjectMapper(), DecodePolicy.LENIENT);
    }

    /**
     * Creates a client and binds it to the given device right away.
     *
     * @throws InvalidArgumentException if {@code connection} or {@code credentials} is null.
     */
    public DeviceApiClient(DeviceTransportFactory transportFactory, ObjectMapper objectMapper, DecodePolicy decodePolicy,
                           Connection connection, Credentials credentials) {
        this(transportFactory, objectMapper, decodePolicy);
        initialize(connection, credentials);
    }

    /**
     * Builds the mapper used when none is supplied. Property names match case-insensitively,
     * undeclared properties are ignored, and anything after the top-level JSON value is an error.
     * The Spring-managed mapper gets the same settings from {@code application.properties}.
     *
     * @return A new {@link ObjectMapper} configured for Device Portal responses.
     */
    public static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
                .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES, true)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true)
                .build();
    }

    @Override
    public void initialize(Connection connection, Credentials credentials) {
        InvalidArgumentException.requirePresent(connection, "connection");
        InvalidArgumentException.requirePresent(credentials, "credentials");

        this.currentConnection = connection;
        this.currentCredentials = credentials;
        reinitializeTransport();
    }

    @Override
    public Connection getConnection() {
        return currentConnection;
    }

    @Override
    public void setConnection(Connection connection) {
        InvalidArgumentException.requirePresent(connection, "connection");

        this.currentConnection = connection;
        reinitializeTransport();
    }

    @Override
    public Credentials getCredentials() {
        return currentCredentials;
    }

    @Override
    public void setCredentials(Credentials credentials) {
        InvalidArgumentException.requirePresent(credentials, "credentials");

        this.currentCredentials = credentials;
        reinitializeTransport();
    }

    /**
     * @return {@code true} once a transport has been built for a connection and credentials pair.
     */
    public boolean isInitialized() {
        return transport != null;
    }

    public DecodePolicy getDecodePolicy() {
        return decodePolicy;
    }

    /**
     * Rebuilds the transport from the current connection and credentials.
     *
     * @throws PreconditionFailedException if either one has not been set.
     */
    protected void reinitializeTransport() {
        Connection connection = this.currentConnection;
        Credentials credentials = this.currentCredentials;
        if (connection == null) {
            throw new PreconditionFailedException("Set the connection before initializing the transport.");
        }
        if (credentials == null) {
            throw new PreconditionFailedException("Set the credentials before initializing the transport.");
        }

        this.transport = transportFactory.create(connection, credentials);
        log.info("Device transport bound to {} ({})", connection.baseUrl(), credentials.getClass().getSimpleName());
    }

    @Override
    public Mono<MachineName> getMachineName() {
        return fetch(MACHINE_NAME_PATH, MachineName.class);
    }

    @Override
    public Mono<SoftwareInfo> getSoftwareInfo() {
        return fetch(SOFTWARE_INFO_PATH, SoftwareInfo.class);
    }

    @Override
    public Mono<IpConfig> getIpConfig() {
        return fetch(IP_CONFIG_PATH, IpConfig.class);
    }

    @Override
    public Mono<AppXPackages> getInstalledPackages() {
        return fetch(INSTALLED_PACKAGES_PATH, AppXPackages.class);
    }

    /**
     * Fetches the given path and decodes the body, applying this client's {@link DecodePolicy}.
     *
     * @param path The API path.
     * @param type The type to decode the body into.
     * @param <T>  The response type.
     * @return The decoded value, or an empty {@link Mono} if there was nothing usable to decode.
     */
    protected <T> Mono<T> fetch(String path, Class<T> type) {
        return fetchResult(path, type).flatMap(result -> {
            if (decodePolicy == DecodePolicy.STRICT && result instanceof DecodeResult.DecodeError<T> error) {
                return Mono.error(new ResponseDecodeException(path, type, error.cause()));
            }
            return Mono.justOrEmpty(result.value());
        });
    }

    /**
     * Fetches the given path and reports exactly how decoding went.
     * <p>
     * The transport is captured when this method is called. Transport failures, including
     * non-success status codes, are passed through as errors; they are never turned into a
     * {@link DecodeResult}.
     *
     * @param path The API path.
     * @param type The type to decode the body into.
     * @param <T>  The response type.
     * @return A {@link Mono} emitting one {@link DecodeResult}, or erroring with
     *         {@link PreconditionFailedException} if the client has not been initialized.
     */
    public <T> Mono<DecodeResult<T>> fetchResult(String path, Class<T> type) {
        DeviceTransport current = this.transport;
        if (current == null) {
            return Mono.error(new PreconditionFailedException(
                    "Initialize the client with a connection and credentials before requesting " + path));
        }
        return current.get(path)
                .map(body -> decode(path, body, type))
                .defaultIfEmpty(DecodeResult.empty());
    }

    private <T> DecodeResult<T> decode(String path, String body, Class<T> type) {
        if (body.isBlank()) {
            return DecodeResult.empty();
        }
        try {
            T value = objectMapper.readValue(body, type);
            return value == null ? DecodeResult.empty() : DecodeResult.ok(value);
        } catch (JsonProcessingException e) {
            log.warn("Response from {} could not be decoded as {}: {}", path, type.getSimpleName(), e.getOriginalMessage());
            return DecodeResult.decodeError(body, e);
        }
    }
}
