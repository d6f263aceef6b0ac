/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.model;

import java.util.Objects;

/**
 * A resolution outcome together with the resolver state that produced it and
 * the number of provider lookups spent on it.
 */
public record Resolution(ResolutionOutcome outcome, ResolutionState state, int attempts) {

    public Resolution {
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(state, "state must not be null");
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must not be negative");
        }
    }
}
