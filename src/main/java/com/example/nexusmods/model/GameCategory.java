package com.example.nexusmods.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A mod category of a game. Parents are resolved through
 * {@link Game#traceParentCategory(GameCategory)}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GameCategory(
        @JsonProperty("category_id") int categoryId,
        @JsonProperty("name") String name,
        @JsonProperty(value = "parent_category", required = true) ParentCategory parentCategory) {

    public GameCategory {
        Objects.requireNonNull(parentCategory, "parentCategory");
    }

    @JsonIgnore
    public boolean isTopLevel() {
        return parentCategory instanceof ParentCategory.NoParent;
    }
}
