package com.example.nexusmods.exception;

/**
 * A status code the API documents for an endpoint but that has never been seen
 * in practice, so its body format is unknown (422 on most endpoints).
 */
public class UnobservedStatusException extends UnsupportedOperationException {

    private final String endpoint;
    private final int status;
    private final String body;

    public UnobservedStatusException(String endpoint, int status, String body) {
        super("Status " + status + " from " + endpoint + " is documented but not supported yet");
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
