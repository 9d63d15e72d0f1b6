package com.example.nexusmods.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One element of {@code GET user/tracked_mods.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModEntry(
        @JsonProperty("mod_id") ModId modId,
        @JsonProperty("domain_name") String domainName) {
}
