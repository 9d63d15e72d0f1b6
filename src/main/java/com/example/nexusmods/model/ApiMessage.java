package com.example.nexusmods.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned by the API: a message and, on some endpoints, a numeric code.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiMessage(
        @JsonProperty(value = "message", required = true) String message,
        @JsonProperty("code") Integer code) {
}
