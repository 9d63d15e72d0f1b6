package com.example.nexusmods.exception;

/**
 * Well-formed error response from the API. Subclasses identify which error
 * body was received; the server's message is kept verbatim.
 */
public abstract class NexusApiException extends RuntimeException {

    private final String endpoint;
    private final int status;
    private final String serverMessage;

    protected NexusApiException(String endpoint, int status, String serverMessage) {
        super(endpoint + " returned " + status + ": " + serverMessage);
        this.endpoint = endpoint;
        this.status = status;
        this.serverMessage = serverMessage;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public int getStatus() {
        return status;
    }

    public String getServerMessage() {
        return serverMessage;
    }
}
