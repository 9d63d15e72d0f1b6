package com.example.nexusmods.exception;

/**
 * The API key was rejected.
 */
public class InvalidApiKeyException extends NexusApiException {

    public InvalidApiKeyException(String endpoint, int status, String serverMessage) {
        super(endpoint, status, serverMessage);
    }
}
