package com.example.nexusmods.model;

/**
 * The two request quotas the API enforces.
 */
public enum RateLimitWindow {
    HOURLY,
    DAILY
}
