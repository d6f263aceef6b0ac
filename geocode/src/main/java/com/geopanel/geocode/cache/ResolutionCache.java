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
 * Persistent mapping from canonical query to a previously computed resolution
 * outcome. Failed outcomes are cached too, so an address known to be
 * unresolvable is not looked up again.
 *
 * <p>Open once per run and close it with try-with-resources; closing flushes
 * pending writes.
 */
public interface ResolutionCache extends AutoCloseable {

    Optional<ResolutionOutcome> get(String query);

    void put(String query, ResolutionOutcome outcome);

    int size();

    /**
     * Flushes pending writes and releases the backing store. Idempotent.
     *
     * @throws GeocodeCacheException if the final flush fails
     */
    @Override
    void close();
}
