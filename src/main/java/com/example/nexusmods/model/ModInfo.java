package com.example.nexusmods.model;

import com.example.nexusmods.codec.InstantCodec;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.time.Instant;
import java.util.Optional;

/**
 * Mod details from {@code GET games/{domain}/mods/{id}.json} and the
 * latest-added / latest-updated / trending listings.
 * Hidden or removed mods come back with most text fields missing, so the
 * descriptive fields are nullable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModInfo(
        @JsonProperty("mod_id") ModId modId,
        @JsonProperty("game_id") int gameId,
        @JsonProperty("domain_name") String domainName,
        @JsonProperty("name") String name,
        @JsonProperty("summary") String summary,
        @JsonProperty("description") String description,
        @JsonProperty("picture_url") String pictureUrl,
        @JsonProperty("version") String version,
        @JsonProperty("author") String author,
        @JsonProperty("uploaded_by") String uploadedBy,
        @JsonProperty("uploaded_users_profile_url") String uploadedUsersProfileUrl,
        @JsonProperty("category_id") int categoryId,
        @JsonProperty("mod_downloads") long modDownloads,
        @JsonProperty("mod_unique_downloads") long modUniqueDownloads,
        @JsonProperty("endorsement_count") long endorsementCount,
        @JsonProperty("allow_rating") boolean allowRating,
        @JsonProperty("contains_adult_content") boolean containsAdultContent,
        @JsonProperty("status") String status,
        @JsonProperty("available") boolean available,
        @JsonProperty("created_timestamp")
        @JsonDeserialize(using = InstantCodec.Deserializer.class)
        @JsonSerialize(using = InstantCodec.EpochSecondsSerializer.class) Instant createdTimestamp,
        @JsonProperty("created_time")
        @JsonDeserialize(using = InstantCodec.Deserializer.class)
        @JsonSerialize(using = InstantCodec.IsoSerializer.class) Instant createdTime,
        @JsonProperty("updated_timestamp")
        @JsonDeserialize(using = InstantCodec.Deserializer.class)
        @JsonSerialize(using = InstantCodec.EpochSecondsSerializer.class) Instant updatedTimestamp,
        @JsonProperty("updated_time")
        @JsonDeserialize(using = InstantCodec.Deserializer.class)
        @JsonSerialize(using = InstantCodec.IsoSerializer.class) Instant updatedTime,
        @JsonProperty("user") ModUser user,
        @JsonProperty("endorsement") ModEndorsement endorsement) {

    public Optional<ModUser> uploader() {
        return Optional.ofNullable(user);
    }

    /**
     * Endorsement state of the calling user, present only for authenticated requests.
     */
    public Optional<ModEndorsement> userEndorsement() {
        return Optional.ofNullable(endorsement);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ModUser(
            @JsonProperty("member_id") long memberId,
            @JsonProperty("member_group_id") int memberGroupId,
            @JsonProperty("name") String name) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ModEndorsement(
            @JsonProperty("endorse_status") EndorsementStatus endorseStatus,
            @JsonProperty("timestamp")
            @JsonDeserialize(using = InstantCodec.Deserializer.class)
            @JsonSerialize(using = InstantCodec.EpochSecondsSerializer.class) Instant timestamp,
            @JsonProperty("version") String version) {

        public ModEndorsement {
            if (endorseStatus == null) {
                endorseStatus = EndorsementStatus.NOT_ENDORSED;
            }
        }
    }
}
