package com.example.nexusmods.model;

import com.example.nexusmods.codec.InstantCodec;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.time.Instant;
import java.util.Optional;

/**
 * One element of {@code GET user/endorsements.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Endorsement(
        @JsonProperty("mod_id") ModId modId,
        @JsonProperty("domain_name") String domainName,
        @JsonProperty("date")
        @JsonDeserialize(using = InstantCodec.Deserializer.class)
        @JsonSerialize(using = InstantCodec.IsoSerializer.class) Instant date,
        @JsonProperty("version") String version,
        @JsonProperty("status") EndorsementStatus status) {

    public Endorsement {
        if (status == null) {
            status = EndorsementStatus.NOT_ENDORSED;
        }
    }

    public Optional<String> versionIfKnown() {
        return Optional.ofNullable(version);
    }

    @JsonIgnore
    public boolean isEndorsed() {
        return status == EndorsementStatus.ENDORSED;
    }
}
