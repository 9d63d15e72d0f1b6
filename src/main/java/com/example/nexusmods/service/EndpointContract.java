package com.example.nexusmods.service;

import com.example.nexusmods.exception.NexusApiException;
import com.example.nexusmods.exception.UnobservedStatusException;
import com.example.nexusmods.model.ApiMessage;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;

/**
 * The documented status codes of one endpoint and what each of them means.
 * A status that is not in the table is a contract violation, see
 * {@link ResponseDecoder#decode(EndpointContract, RawResponse)}.
 *
 * @param <T> success type of the endpoint
 */
public final class EndpointContract<T> {

    private static final Logger log = LoggerFactory.getLogger(EndpointContract.class);

    /**
     * Turns a response with a known status into a value or an exception.
     */
    @FunctionalInterface
    interface StatusHandler<T> {
        T handle(RawResponse response, ResponseDecoder decoder);
    }

    /**
     * Builds the exception for a well-formed error body.
     */
    @FunctionalInterface
    public interface ErrorFactory {
        NexusApiException create(String endpoint, int status, ApiMessage body);
    }

    private final String endpoint;
    private final Map<Integer, StatusHandler<T>> handlers;

    private EndpointContract(String endpoint, Map<Integer, StatusHandler<T>> handlers) {
        this.endpoint = endpoint;
        this.handlers = Collections.unmodifiableMap(new TreeMap<>(handlers));
    }

    public static <T> Builder<T> forEndpoint(String endpoint) {
        return new Builder<>(endpoint);
    }

    public String endpoint() {
        return endpoint;
    }

    public Set<Integer> documentedStatuses() {
        return handlers.keySet();
    }

    Optional<StatusHandler<T>> handlerFor(int status) {
        return Optional.ofNullable(handlers.get(status));
    }

    @Override
    public String toString() {
        return endpoint + " " + documentedStatuses();
    }

    public static final class Builder<T> {

        private final String endpoint;
        private final Map<Integer, StatusHandler<T>> handlers = new HashMap<>();

        private Builder(String endpoint) {
            this.endpoint = endpoint;
        }

        /**
         * Decode the body of {@code status} as {@code type}.
         */
        public Builder<T> success(int status, Class<T> type) {
            return on(status, (response, decoder) -> decoder.readBody(endpoint, response, type));
        }

        public Builder<T> success(int status, TypeReference<T> type) {
            return on(status, (response, decoder) -> decoder.readBody(endpoint, response, type));
        }

        /**
         * Success whose value does not depend on the body.
         */
        public Builder<T> success(int status, Function<RawResponse, T> value) {
            return on(status, (response, decoder) -> value.apply(response));
        }

        /**
         * Decode the body as an {@link ApiMessage} and throw the exception built from it.
         */
        public Builder<T> error(int status, ErrorFactory factory) {
            return on(status, (response, decoder) -> {
                ApiMessage message = decoder.readBody(endpoint, response, ApiMessage.class);
                throw factory.create(endpoint, response.status(), message);
            });
        }

        /**
         * Documented status that has never been observed; its body format is unknown.
         */
        public Builder<T> unobserved(int status) {
            return on(status, (response, decoder) -> {
                log.warn("{} answered with status {}, which has never been observed before", endpoint, status);
                throw new UnobservedStatusException(endpoint, response.status(), response.body());
            });
        }

        private Builder<T> on(int status, StatusHandler<T> handler) {
            if (handlers.putIfAbsent(status, handler) != null) {
                throw new IllegalStateException(endpoint + " already maps status " + status);
            }
            return this;
        }

        public EndpointContract<T> build() {
            return new EndpointContract<>(endpoint, handlers);
        }
    }
}
