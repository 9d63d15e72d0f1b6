package com.example.nexusmods.service;

import com.example.nexusmods.codec.InstantCodec;
import com.example.nexusmods.model.RateLimitWindow;
import com.example.nexusmods.model.RateLimiting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads the {@code X-RL-*} response headers into a {@link RateLimiting} snapshot.
 */
public final class RateLimitHeaders {

    private static final Logger log = LoggerFactory.getLogger(RateLimitHeaders.class);

    public static final String HOURLY_LIMIT = "X-RL-Hourly-Limit";
    public static final String HOURLY_REMAINING = "X-RL-Hourly-Remaining";
    public static final String HOURLY_RESET = "X-RL-Hourly-Reset";
    public static final String DAILY_LIMIT = "X-RL-Daily-Limit";
    public static final String DAILY_REMAINING = "X-RL-Daily-Remaining";
    public static final String DAILY_RESET = "X-RL-Daily-Reset";

    /** e.g. {@code 2024-05-01 13:00:00 +0000} */
    private static final DateTimeFormatter RESET_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss Z", Locale.ROOT);

    private RateLimitHeaders() {
    }

    /**
     * Parse both windows. Empty when any of the six headers is missing or
     * malformed; a partial snapshot is never produced.
     */
    public static Optional<RateLimiting> parse(HttpHeaders headers) {
        String hourlyLimit = headers.getFirst(HOURLY_LIMIT);
        String hourlyRemaining = headers.getFirst(HOURLY_REMAINING);
        String hourlyReset = headers.getFirst(HOURLY_RESET);
        String dailyLimit = headers.getFirst(DAILY_LIMIT);
        String dailyRemaining = headers.getFirst(DAILY_REMAINING);
        String dailyReset = headers.getFirst(DAILY_RESET);

        if (hourlyLimit == null || hourlyRemaining == null || hourlyReset == null
                || dailyLimit == null || dailyRemaining == null || dailyReset == null) {
            return Optional.empty();
        }

        try {
            RateLimiting rateLimits = new RateLimiting(
                    quota(hourlyLimit, hourlyRemaining, hourlyReset),
                    quota(dailyLimit, dailyRemaining, dailyReset));
            log.debug("Rate limits: hourly {}/{}, daily {}/{}",
                    rateLimits.remaining(RateLimitWindow.HOURLY), rateLimits.limit(RateLimitWindow.HOURLY),
                    rateLimits.remaining(RateLimitWindow.DAILY), rateLimits.limit(RateLimitWindow.DAILY));
            return Optional.of(rateLimits);
        } catch (NumberFormatException | DateTimeParseException e) {
            log.warn("Ignoring malformed rate-limit headers: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static RateLimiting.Quota quota(String limit, String remaining, String reset) {
        return new RateLimiting.Quota(
                Integer.parseInt(limit.trim()),
                Integer.parseInt(remaining.trim()),
                parseReset(reset.trim()));
    }

    static Instant parseReset(String value) {
        try {
            return OffsetDateTime.parse(value, RESET_FORMAT).toInstant();
        } catch (DateTimeParseException e) {
            return InstantCodec.fromIso(value);
        }
    }
}
