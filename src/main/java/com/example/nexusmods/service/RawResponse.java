package com.example.nexusmods.service;

import org.springframework.http.HttpHeaders;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Status, headers and body of a response, read fully before any decoding.
 */
public record RawResponse(int status, HttpHeaders headers, String body) {

    public RawResponse {
        headers = headers == null ? HttpHeaders.EMPTY : headers;
        body = body == null ? "" : body;
    }

    public static RawResponse of(int status, String body) {
        return new RawResponse(status, HttpHeaders.EMPTY, body);
    }

    static RawResponse read(ClientHttpResponse response) throws IOException {
        HttpHeaders headers = new HttpHeaders();
        headers.addAll(response.getHeaders());
        String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
        return new RawResponse(response.getStatusCode().value(), HttpHeaders.readOnlyHttpHeaders(headers), body);
    }
}
