package com.example.nexusmods.exception;

/**
 * The API answered with a status code its documentation does not list for the
 * endpoint. The remote contract has changed under the client; callers should
 * not try to recover from this.
 */
public class ContractViolationException extends IllegalStateException {

    private final String endpoint;
    private final int status;
    private final String body;

    public ContractViolationException(String endpoint, int status, String body) {
        super("Undocumented status " + status + " from " + endpoint);
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
