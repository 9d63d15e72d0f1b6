package com.example.nexusmods.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of the endorse and abstain endpoints.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EndorsementResult(
        @JsonProperty("message") String message,
        @JsonProperty("status") EndorsementStatus status) {

    public EndorsementResult {
        if (status == null) {
            status = EndorsementStatus.NOT_ENDORSED;
        }
    }
}
