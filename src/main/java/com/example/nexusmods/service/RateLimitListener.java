package com.example.nexusmods.service;

import com.example.nexusmods.model.RateLimiting;

/**
 * Receives the rate-limit snapshot of every response that carries one.
 * Called on the thread that issued the request.
 */
@FunctionalInterface
public interface RateLimitListener {

    RateLimitListener NONE = rateLimits -> {
    };

    void onRateLimits(RateLimiting rateLimits);
}
