package com.example.nexusmods.service;

import com.example.nexusmods.exception.ContractViolationException;
import com.example.nexusmods.exception.ResponseDecodingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Applies an {@link EndpointContract} to a received response.
 * Stateless apart from the (thread-safe) JSON mapper.
 */
public class ResponseDecoder {

    private static final Logger log = LoggerFactory.getLogger(ResponseDecoder.class);

    private final ObjectMapper jsonMapper;

    public ResponseDecoder() {
        this(JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build());
    }

    public ResponseDecoder(ObjectMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
    }

    /**
     * Interpret {@code response} according to {@code contract}.
     *
     * @return the decoded success value
     * @throws com.example.nexusmods.exception.NexusApiException for a documented error status
     * @throws ResponseDecodingException if the body does not match the shape expected for its status
     * @throws com.example.nexusmods.exception.UnobservedStatusException for a documented but never observed status
     * @throws ContractViolationException for a status the endpoint does not document
     */
    public <T> T decode(EndpointContract<T> contract, RawResponse response) {
        return contract.handlerFor(response.status())
                .orElseThrow(() -> contractViolation(contract, response))
                .handle(response, this);
    }

    <T> T readBody(String endpoint, RawResponse response, Class<T> type) {
        try {
            return requireComplete(endpoint, jsonMapper.readValue(response.body(), type));
        } catch (JsonProcessingException e) {
            throw decodingFailure(endpoint, response, e);
        }
    }

    <T> T readBody(String endpoint, RawResponse response, TypeReference<T> type) {
        try {
            return requireComplete(endpoint, jsonMapper.readValue(response.body(), type));
        } catch (JsonProcessingException e) {
            throw decodingFailure(endpoint, response, e);
        }
    }

    /**
     * A JSON {@code null} body, or a null element of a list or map body, is not a value of any endpoint.
     */
    private static <T> T requireComplete(String endpoint, T value)
            throws MismatchedInputException {
        if (value == null) {
            throw MismatchedInputException.from(null, (Class<?>) null, endpoint + " returned a null body");
        }
        if (value instanceof Collection<?> items && items.stream().anyMatch(Objects::isNull)) {
            throw MismatchedInputException.from(null, (Class<?>) null, endpoint + " returned a list with a null element");
        }
        if (value instanceof Map<?, ?> entries && entries.values().stream().anyMatch(Objects::isNull)) {
            throw MismatchedInputException.from(null, (Class<?>) null, endpoint + " returned a map with a null value");
        }
        return value;
    }

    private ResponseDecodingException decodingFailure(String endpoint, RawResponse response, JsonProcessingException e) {
        log.warn("Malformed {} body from {}: {}", response.status(), endpoint, e.getOriginalMessage());
        return new ResponseDecodingException(endpoint, response.status(), response.body(), e);
    }

    private ContractViolationException contractViolation(EndpointContract<?> contract, RawResponse response) {
        log.error("{} answered with undocumented status {} (documented: {})",
                contract.endpoint(), response.status(), contract.documentedStatuses());
        return new ContractViolationException(contract.endpoint(), response.status(), response.body());
    }
}
