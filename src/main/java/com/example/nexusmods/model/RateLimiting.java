package com.example.nexusmods.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Rate-limit counters reported with a single response.
 * A snapshot only; nothing here is updated after construction.
 */
public record RateLimiting(Quota hourly, Quota daily) {

    public RateLimiting {
        Objects.requireNonNull(hourly, "hourly");
        Objects.requireNonNull(daily, "daily");
    }

    public Quota quota(RateLimitWindow window) {
        return switch (window) {
            case HOURLY -> hourly;
            case DAILY -> daily;
        };
    }

    public int limit(RateLimitWindow window) {
        return quota(window).limit();
    }

    public int remaining(RateLimitWindow window) {
        return quota(window).remaining();
    }

    public Instant reset(RateLimitWindow window) {
        return quota(window).reset();
    }

    /**
     * Counters of one window.
     */
    public record Quota(int limit, int remaining, Instant reset) {
        public Quota {
            Objects.requireNonNull(reset, "reset");
        }

        public boolean isExhausted() {
            return remaining <= 0;
        }
    }
}
