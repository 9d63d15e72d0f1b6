package com.example.nexusmods.service;

import com.example.nexusmods.exception.*;
import com.example.nexusmods.model.*;
import com.fasterxml.jackson.core.type.TypeReference;

import java.util.List;
import java.util.Map;

/**
 * Status tables of every endpoint the client calls.
 * <p>
 * The game and file endpoints document 404 for a bad API key and return the
 * API-key error body there, so 404 on those endpoints decodes as
 * {@link InvalidApiKeyException} rather than a not-found error.
 */
final class EndpointContracts {

    private static final int OK = 200;
    private static final int CREATED = 201;
    private static final int UNAUTHORIZED = 401;
    private static final int FORBIDDEN = 403;
    private static final int NOT_FOUND = 404;
    private static final int UNPROCESSABLE = 422;

    private EndpointContracts() {
    }

    // ==================== USER ====================

    static final EndpointContract<UserIdentity> VALIDATE = EndpointContract.<UserIdentity>forEndpoint("GET users/validate")
            .success(OK, UserIdentity.class)
            .error(UNAUTHORIZED, EndpointContracts::invalidApiKey)
            .unobserved(UNPROCESSABLE)
            .build();

    static final EndpointContract<List<ModEntry>> TRACKED_MODS = EndpointContract.<List<ModEntry>>forEndpoint("GET user/tracked_mods")
            .success(OK, new TypeReference<List<ModEntry>>() {
            })
            .error(UNAUTHORIZED, EndpointContracts::invalidApiKey)
            .unobserved(UNPROCESSABLE)
            .build();

    static final EndpointContract<TrackModOutcome.Kind> TRACK_MOD = EndpointContract.<TrackModOutcome.Kind>forEndpoint("POST user/tracked_mods")
            .success(OK, response -> TrackModOutcome.Kind.ALREADY_TRACKING)
            .success(CREATED, response -> TrackModOutcome.Kind.NEWLY_TRACKED)
            .error(UNAUTHORIZED, EndpointContracts::invalidApiKey)
            .error(NOT_FOUND, EndpointContracts::modNotFound)
            .build();

    static final EndpointContract<Void> UNTRACK_MOD = EndpointContract.<Void>forEndpoint("DELETE user/tracked_mods")
            .success(OK, response -> null)
            .error(NOT_FOUND, EndpointContracts::untrackedOrInvalid)
            .build();

    static final EndpointContract<List<Endorsement>> ENDORSEMENTS = EndpointContract.<List<Endorsement>>forEndpoint("GET user/endorsements")
            .success(OK, new TypeReference<List<Endorsement>>() {
            })
            .error(UNAUTHORIZED, EndpointContracts::invalidApiKey)
            .unobserved(UNPROCESSABLE)
            .build();

    // ==================== GAMES ====================

    static final EndpointContract<List<Game>> GAMES = EndpointContract.<List<Game>>forEndpoint("GET games")
            .success(OK, new TypeReference<List<Game>>() {
            })
            .error(NOT_FOUND, EndpointContracts::invalidApiKey)
            .unobserved(UNPROCESSABLE)
            .build();

    static final EndpointContract<Game> GAME = EndpointContract.<Game>forEndpoint("GET games/{domain}")
            .success(OK, Game.class)
            .error(NOT_FOUND, EndpointContracts::invalidApiKey)
            .unobserved(UNPROCESSABLE)
            .build();

    // ==================== FILES ====================

    static final EndpointContract<ModFiles> MOD_FILES = EndpointContract.<ModFiles>forEndpoint("GET games/{domain}/mods/{id}/files")
            .success(OK, ModFiles.class)
            .error(NOT_FOUND, EndpointContracts::invalidApiKey)
            .unobserved(UNPROCESSABLE)
            .build();

    static final EndpointContract<ModFile> MOD_FILE = EndpointContract.<ModFile>forEndpoint("GET games/{domain}/mods/{id}/files/{file_id}")
            .success(OK, ModFile.class)
            .error(NOT_FOUND, EndpointContracts::invalidApiKey)
            .unobserved(UNPROCESSABLE)
            .build();

    // ==================== MODS ====================

    static final EndpointContract<ModInfo> MOD = EndpointContract.<ModInfo>forEndpoint("GET games/{domain}/mods/{id}")
            .success(OK, ModInfo.class)
            .error(UNAUTHORIZED, EndpointContracts::invalidApiKey)
            .error(NOT_FOUND, EndpointContracts::modNotFound)
            .unobserved(UNPROCESSABLE)
            .build();

    static final EndpointContract<List<UpdatedMod>> UPDATED_MODS = EndpointContract.<List<UpdatedMod>>forEndpoint("GET games/{domain}/mods/updated")
            .success(OK, new TypeReference<List<UpdatedMod>>() {
            })
            .error(UNAUTHORIZED, EndpointContracts::invalidApiKey)
            .error(NOT_FOUND, EndpointContracts::invalidGame)
            .unobserved(UNPROCESSABLE)
            .build();

    static final EndpointContract<List<ModInfo>> LATEST_ADDED = modListing("GET games/{domain}/mods/latest_added");

    static final EndpointContract<List<ModInfo>> LATEST_UPDATED = modListing("GET games/{domain}/mods/latest_updated");

    static final EndpointContract<List<ModInfo>> TRENDING = modListing("GET games/{domain}/mods/trending");

    static final EndpointContract<Map<String, List<String>>> CHANGELOGS = EndpointContract.<Map<String, List<String>>>forEndpoint("GET games/{domain}/mods/{id}/changelogs")
            .success(OK, new TypeReference<Map<String, List<String>>>() {
            })
            .error(UNAUTHORIZED, EndpointContracts::invalidApiKey)
            .error(NOT_FOUND, EndpointContracts::modNotFound)
            .unobserved(UNPROCESSABLE)
            .build();

    static final EndpointContract<EndorsementResult> ENDORSE = endorsementChange("POST games/{domain}/mods/{id}/endorse");

    static final EndpointContract<EndorsementResult> ABSTAIN = endorsementChange("POST games/{domain}/mods/{id}/abstain");

    private static EndpointContract<List<ModInfo>> modListing(String endpoint) {
        return EndpointContract.<List<ModInfo>>forEndpoint(endpoint)
                .success(OK, new TypeReference<List<ModInfo>>() {
                })
                .error(UNAUTHORIZED, EndpointContracts::invalidApiKey)
                .error(NOT_FOUND, EndpointContracts::invalidGame)
                .unobserved(UNPROCESSABLE)
                .build();
    }

    private static EndpointContract<EndorsementResult> endorsementChange(String endpoint) {
        return EndpointContract.<EndorsementResult>forEndpoint(endpoint)
                .success(OK, EndorsementResult.class)
                .error(UNAUTHORIZED, EndpointContracts::invalidApiKey)
                .error(FORBIDDEN, EndpointContracts::endorsementRefused)
                .error(NOT_FOUND, EndpointContracts::modNotFound)
                .build();
    }

    // ==================== ERROR BODIES ====================

    private static NexusApiException invalidApiKey(String endpoint, int status, ApiMessage body) {
        return new InvalidApiKeyException(endpoint, status, body.message());
    }

    private static NexusApiException modNotFound(String endpoint, int status, ApiMessage body) {
        return new ModNotFoundException(endpoint, status, body.message());
    }

    private static NexusApiException untrackedOrInvalid(String endpoint, int status, ApiMessage body) {
        return new UntrackedOrInvalidModException(endpoint, status, body.message());
    }

    private static NexusApiException invalidGame(String endpoint, int status, ApiMessage body) {
        int code = body.code() != null ? body.code() : status;
        return new InvalidGameException(endpoint, status, body.message(), code);
    }

    private static NexusApiException endorsementRefused(String endpoint, int status, ApiMessage body) {
        return new EndorsementRefusedException(endpoint, status, body.message());
    }
}
