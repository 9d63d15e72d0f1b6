package com.example.nexusmods.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identifier of a mod on Nexus Mods.
 * <p>
 * Instances are only created while decoding a server response, so a
 * {@code ModId} always refers to a mod the API has already reported.
 */
public final class ModId {

    private final long value;

    ModId(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Mod id must be non-negative: " + value);
        }
        this.value = value;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static ModId fromWire(long value) {
        return new ModId(value);
    }

    @JsonValue
    public long value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ModId other && other.value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
