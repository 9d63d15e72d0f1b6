package com.example.nexusmods.model;

import com.example.nexusmods.codec.InstantCodec;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UpdatedMod(
        @JsonProperty("mod_id") ModId modId,
        @JsonProperty("latest_file_update")
        @JsonDeserialize(using = InstantCodec.Deserializer.class)
        @JsonSerialize(using = InstantCodec.EpochSecondsSerializer.class) Instant latestFileUpdate,
        @JsonProperty("latest_mod_activity")
        @JsonDeserialize(using = InstantCodec.Deserializer.class)
        @JsonSerialize(using = InstantCodec.EpochSecondsSerializer.class) Instant latestModActivity) {
}
