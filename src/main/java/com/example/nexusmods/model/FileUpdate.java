package com.example.nexusmods.model;

import com.example.nexusmods.codec.InstantCodec;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.time.Instant;

/**
 * Link from a superseded file to the file that replaced it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileUpdate(
        @JsonProperty("old_file_id") long oldFileId,
        @JsonProperty("new_file_id") long newFileId,
        @JsonProperty("old_file_name") String oldFileName,
        @JsonProperty("new_file_name") String newFileName,
        @JsonProperty("uploaded_timestamp")
        @JsonDeserialize(using = InstantCodec.Deserializer.class)
        @JsonSerialize(using = InstantCodec.EpochSecondsSerializer.class) Instant uploadedTimestamp,
        @JsonProperty("uploaded_time")
        @JsonDeserialize(using = InstantCodec.Deserializer.class)
        @JsonSerialize(using = InstantCodec.IsoSerializer.class) Instant uploadedTime) {
}
