package com.deviceapi.model;

import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of fetching and decoding one device endpoint.
 * <p>
 * Unlike the typed getters, which fold a missing body and a malformed body into the same empty
 * result, this type keeps the two apart.
 *
 * @param <T> The decoded response type.
 */
public sealed interface DecodeResult<T> permits DecodeResult.Ok, DecodeResult.Empty, DecodeResult.DecodeError {

    static <T> DecodeResult<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> DecodeResult<T> empty() {
        return new Empty<>();
    }

    static <T> DecodeResult<T> decodeError(String body, Exception cause) {
        return new DecodeError<>(body, cause);
    }

    /**
     * @return The decoded value, or an empty optional for both {@link Empty} and {@link DecodeError}.
     */
    Optional<T> value();

    /**
     * The body was decoded.
     *
     * @param data The decoded value, never null.
     */
    record Ok<T>(T data) implements DecodeResult<T> {
        public Ok {
            Objects.requireNonNull(data, "data");
        }

        @Override
        public Optional<T> value() {
            return Optional.of(data);
        }
    }

    /**
     * The device answered without a body.
     */
    record Empty<T>() implements DecodeResult<T> {
        @Override
        public Optional<T> value() {
            return Optional.empty();
        }
    }

    /**
     * The device answered with a body that could not be decoded.
     *
     * @param body  The raw body as received.
     * @param cause The decoder's failure.
     */
    record DecodeError<T>(String body, Exception cause) implements DecodeResult<T> {
        @Override
        public Optional<T> value() {
            return Optional.empty();
        }
    }
}
