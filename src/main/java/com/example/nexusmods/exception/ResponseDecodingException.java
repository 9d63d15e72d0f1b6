package com.example.nexusmods.exception;

/**
 * A response body did not have the JSON shape expected for its status code.
 * Holds the raw body for diagnosis.
 */
public class ResponseDecodingException extends RuntimeException {

    private final String endpoint;
    private final int status;
    private final String body;

    public ResponseDecodingException(String endpoint, int status, String body, Throwable cause) {
        super("Could not decode " + status + " response of " + endpoint + ": " + cause.getMessage(), cause);
        this.endpoint = endpoint;
        this.status = status;
        this.body = body;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }
}
