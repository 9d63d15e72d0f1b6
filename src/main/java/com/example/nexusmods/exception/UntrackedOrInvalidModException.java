package com.example.nexusmods.exception;

/**
 * Untracking failed because the mod is not tracked or does not exist.
 * The API does not say which.
 */
public class UntrackedOrInvalidModException extends NexusApiException {

    public UntrackedOrInvalidModException(String endpoint, int status, String serverMessage) {
        super(endpoint, status, serverMessage);
    }
}
