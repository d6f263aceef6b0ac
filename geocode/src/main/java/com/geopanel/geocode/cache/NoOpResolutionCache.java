/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.cache;

import com.geopanel.geocode.model.ResolutionOutcome;

import java.util.Optional;

/**
 * Cache used when caching is disabled. Every lookup misses.
 */
public class NoOpResolutionCache implements ResolutionCache {

    @Override
    public Optional<ResolutionOutcome> get(String query) {
        return Optional.empty();
    }

    @Override
    public void put(String query, ResolutionOutcome outcome) {
        // nothing retained
    }

    @Override
    public int size() {
        return 0;
    }

    @Override
    public void close() {
    }
}
