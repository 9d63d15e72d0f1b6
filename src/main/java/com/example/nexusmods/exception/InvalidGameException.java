package com.example.nexusmods.exception;

/**
 * The game domain in the request is unknown. Carries the error code from the body.
 */
public class InvalidGameException extends NexusApiException {

    private final int code;

    public InvalidGameException(String endpoint, int status, String serverMessage, int code) {
        super(endpoint, status, serverMessage);
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
