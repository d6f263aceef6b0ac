/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.service;

import com.geopanel.geocode.cache.ResolutionCache;
import com.geopanel.geocode.model.Coordinates;
import com.geopanel.geocode.model.Resolution;
import com.geopanel.geocode.model.ResolutionOutcome;
import com.geopanel.geocode.model.ResolutionState;
import com.geopanel.geocode.provider.GeocodeInterruptedException;
import com.geopanel.geocode.provider.GeocodeProviderException;
import com.geopanel.geocode.provider.RateLimitedGeocodeClient;
import com.geopanel.geocode.provider.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves one record to a {@link ResolutionOutcome}, degrading from the full
 * address to the town centroid to failure.
 *
 * <p>Per record:
 * <ol>
 *   <li>virtual records resolve to VIRTUAL without touching the cache or the network;</li>
 *   <li>a cached outcome is returned as-is, including a cached FAILED;</li>
 *   <li>the full query is tried up to {@link RetryPolicy#attempts()} times;</li>
 *   <li>then the town query, with the same budget;</li>
 *   <li>otherwise the record FAILED.</li>
 * </ol>
 * Failed attempts are spaced by {@link RetryPolicy#backoff()}, and so is the
 * switch from the full tier to the town tier. Every computed outcome is written to the cache under the full query. A
 * result is a success when the provider returned one, whatever its coordinate
 * values, so (0, 0) counts as found.
 */
@Slf4j
public class FallbackResolver {

    private final RateLimitedGeocodeClient client;
    private final ResolutionCache cache;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public FallbackResolver(RateLimitedGeocodeClient client, ResolutionCache cache, RetryPolicy retryPolicy) {
        this(client, cache, retryPolicy, Sleeper.SYSTEM);
    }

    public FallbackResolver(RateLimitedGeocodeClient client, ResolutionCache cache, RetryPolicy retryPolicy,
                            Sleeper sleeper) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * @param query     canonical full-address query, also the cache key
     * @param townQuery coarser town and county query
     * @param virtual   whether the record was classified as a virtual provider
     */
    public Resolution resolve(String query, String townQuery, boolean virtual) {
        if (virtual) {
            return new Resolution(ResolutionOutcome.virtual(), ResolutionState.VIRTUAL_SHORT_CIRCUIT, 0);
        }

        Optional<ResolutionOutcome> cached = readCache(query);
        if (cached.isPresent()) {
            log.debug("Cache hit for '{}': {}", query, cached.get().source());
            return new Resolution(cached.get(), ResolutionState.CACHE_HIT, 0);
        }

        TierResult full = attemptTier("full address", query);
        if (full.coordinates().isPresent()) {
            return record(query, ResolutionOutcome.physical(full.coordinates().get()),
                    ResolutionState.ATTEMPT_FULL, full.attempts());
        }

        pause();
        TierResult town = attemptTier("town", townQuery);
        int attempts = full.attempts() + town.attempts();
        if (town.coordinates().isPresent()) {
            return record(query, ResolutionOutcome.townCentroid(town.coordinates().get()),
                    ResolutionState.ATTEMPT_TOWN, attempts);
        }

        log.warn("Could not geocode '{}' after {} attempts", query, attempts);
        return record(query, ResolutionOutcome.failed(), ResolutionState.FAILED, attempts);
    }

    private TierResult attemptTier(String tier, String query) {
        int maxAttempts = retryPolicy.attempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Optional<Coordinates> found = client.lookup(query);
                if (found.isPresent()) {
                    log.debug("Resolved {} query '{}' on attempt {}/{}", tier, query, attempt, maxAttempts);
                    return new TierResult(found, attempt);
                }
                log.debug("No {} result for '{}' (attempt {}/{})", tier, query, attempt, maxAttempts);
            } catch (GeocodeProviderException e) {
                log.warn("{} lookup failed for '{}' (attempt {}/{}): {}",
                        tier, query, attempt, maxAttempts, e.getMessage());
            }
            if (attempt < maxAttempts) {
                pause();
            }
        }
        return new TierResult(Optional.empty(), maxAttempts);
    }

    private void pause() {
        if (retryPolicy.backoff().isZero()) {
            return;
        }
        try {
            sleeper.sleep(retryPolicy.backoff());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GeocodeInterruptedException("Interrupted during geocoding backoff", e);
        }
    }

    private Optional<ResolutionOutcome> readCache(String query) {
        try {
            return cache.get(query);
        } catch (RuntimeException e) {
            log.warn("Geocode cache read failed for '{}', treating as a miss: {}", query, e.getMessage());
            return Optional.empty();
        }
    }

    private Resolution record(String query, ResolutionOutcome outcome, ResolutionState state, int attempts) {
        try {
            cache.put(query, outcome);
        } catch (RuntimeException e) {
            log.warn("Geocode cache write failed for '{}', outcome {} not cached: {}",
                    query, outcome.source(), e.getMessage());
        }
        return new Resolution(outcome, state, attempts);
    }

    private record TierResult(Optional<Coordinates> coordinates, int attempts) {
    }
}
