package com.example.nexusmods.exception;

/**
 * The API refused an endorse or abstain request, e.g. because the user has not
 * downloaded the mod yet or endorsed it too recently.
 */
public class EndorsementRefusedException extends NexusApiException {

    public EndorsementRefusedException(String endpoint, int status, String serverMessage) {
        super(endpoint, status, serverMessage);
    }
}
