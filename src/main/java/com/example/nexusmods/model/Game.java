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
 * Game metadata as returned by {@code GET games.json} and
 * {@code GET games/{domain}.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Game(
        @JsonProperty("id") int id,
        @JsonProperty("name") String name,
        @JsonProperty("forum_url") String forumUrl,
        @JsonProperty("nexusmods_url") String nexusmodsUrl,
        @JsonProperty("genre") String genre,
        @JsonProperty("file_count") long fileCount,
        @JsonProperty("downloads") long downloads,
        @JsonProperty("domain_name") String domainName,
        @JsonProperty("approved_date")
        @JsonDeserialize(using = InstantCodec.Deserializer.class)
        @JsonSerialize(using = InstantCodec.EpochSecondsSerializer.class) Instant approvedDate,
        @JsonProperty("file_views") long fileViews,
        @JsonProperty("authors") long authors,
        @JsonProperty("file_endorsements") long fileEndorsements,
        @JsonProperty("mods") long mods,
        @JsonProperty("categories") List<GameCategory> categories) {

    public Game {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    /**
     * Look up the parent of a category among this game's categories.
     * Empty when the category is top-level or its parent id is unknown.
     */
    public Optional<GameCategory> traceParentCategory(GameCategory category) {
        if (!(category.parentCategory() instanceof ParentCategory.Parent parent)) {
            return Optional.empty();
        }
        return categories.stream()
                .filter(candidate -> candidate.categoryId() == parent.categoryId())
                .findFirst();
    }

    public List<GameCategory> rootCategories() {
        return categories.stream()
                .filter(GameCategory::isTopLevel)
                .toList();
    }
}
