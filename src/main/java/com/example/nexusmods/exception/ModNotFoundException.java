package com.example.nexusmods.exception;

public class ModNotFoundException extends NexusApiException {

    public ModNotFoundException(String endpoint, int status, String serverMessage) {
        super(endpoint, status, serverMessage);
    }
}
