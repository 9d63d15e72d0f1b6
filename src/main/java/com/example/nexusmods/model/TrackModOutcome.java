package com.example.nexusmods.model;

import java.util.Objects;

/**
 * Successful result of tracking a mod.
 */
public record TrackModOutcome(Kind kind, ModId modId) {

    public enum Kind {
        /** 201: the mod was added to the tracking list. */
        NEWLY_TRACKED,
        /** 200: the mod was already on the tracking list. */
        ALREADY_TRACKING
    }

    public TrackModOutcome {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(modId, "modId");
    }

    public static TrackModOutcome newlyTracked(ModId modId) {
        return new TrackModOutcome(Kind.NEWLY_TRACKED, modId);
    }

    public static TrackModOutcome alreadyTracking(ModId modId) {
        return new TrackModOutcome(Kind.ALREADY_TRACKING, modId);
    }

    public boolean wasAlreadyTracking() {
        return kind == Kind.ALREADY_TRACKING;
    }
}
