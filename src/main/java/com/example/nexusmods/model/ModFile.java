package com.example.nexusmods.model;

import com.example.nexusmods.codec.InstantCodec;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A downloadable file of a mod.
 * <p>
 * {@code id} is an array on the wire ({@code [file_id, game_id]}). The upload
 * moment is sent twice, as epoch seconds and as an ISO-8601 string, and the
 * size three times ({@code size}, {@code size_kb}, {@code size_in_bytes});
 * all of them are kept as sent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModFile(
        @JsonProperty("id") List<Long> ids,
        @JsonProperty("uid") Long uid,
        @JsonProperty("file_id") long fileId,
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("category_id") int categoryId,
        @JsonProperty("category_name") FileCategory category,
        @JsonProperty("is_primary") boolean primary,
        @JsonProperty("size") long size,
        @JsonProperty("file_name") String fileName,
        @JsonProperty("uploaded_timestamp")
        @JsonDeserialize(using = InstantCodec.Deserializer.class)
        @JsonSerialize(using = InstantCodec.EpochSecondsSerializer.class) Instant uploadedTimestamp,
        @JsonProperty("uploaded_time")
        @JsonDeserialize(using = InstantCodec.Deserializer.class)
        @JsonSerialize(using = InstantCodec.IsoSerializer.class) Instant uploadedTime,
        @JsonProperty("mod_version") String modVersion,
        @JsonProperty("external_virus_scan_url") String externalVirusScanUrl,
        @JsonProperty("description") String description,
        @JsonProperty("size_kb") long sizeKb,
        @JsonProperty("size_in_bytes") Long sizeInBytes,
        @JsonProperty("changelog_html") String changelogHtml,
        @JsonProperty("content_preview_link") String contentPreviewLink) {

    public ModFile {
        ids = ids == null ? List.of() : List.copyOf(ids);
    }

    /**
     * First element of the id array, falling back to {@code file_id}.
     */
    public long primaryId() {
        return ids.isEmpty() ? fileId : ids.get(0);
    }

    public Optional<String> descriptionIfPresent() {
        return Optional.ofNullable(description);
    }

    public Optional<String> changelog() {
        return Optional.ofNullable(changelogHtml);
    }

    public Optional<String> virusScanUrl() {
        return Optional.ofNullable(externalVirusScanUrl);
    }
}
