/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.service;

import com.geopanel.geocode.config.GeocodeProperties;

import java.time.Duration;
import java.util.Objects;

/**
 * Attempt budget per resolution tier and the fixed pause between failed
 * attempts.
 */
public record RetryPolicy(int attempts, Duration backoff) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofSeconds(2));

    public RetryPolicy {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be at least 1: " + attempts);
        }
        Objects.requireNonNull(backoff, "backoff must not be null");
        if (backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative: " + backoff);
        }
    }

    public static RetryPolicy from(GeocodeProperties.Retry retry) {
        return new RetryPolicy(retry.getAttempts(), retry.getBackoff());
    }
}
