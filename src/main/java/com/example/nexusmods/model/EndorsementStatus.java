package com.example.nexusmods.model;

import com.example.nexusmods.codec.EndorsementStatusCodec;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

/**
 * Endorsement state of a mod for the current user.
 * Only the exact wire tag {@code "Endorsed"} counts as endorsed; any other
 * value ("Undecided", "Abstained", ...) decodes to {@link #NOT_ENDORSED}.
 */
@JsonDeserialize(using = EndorsementStatusCodec.Deserializer.class)
@JsonSerialize(using = EndorsementStatusCodec.Serializer.class)
public enum EndorsementStatus {
    ENDORSED("Endorsed"),
    NOT_ENDORSED("Undecided");

    private final String wireName;

    EndorsementStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
