/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.provider;

import com.geopanel.geocode.model.Coordinates;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single entry point for outbound geocoding lookups. Every call goes through
 * the shared {@link RateGate}. Any provider failure reaches the caller as a
 * {@link GeocodeProviderException} and is never retried here.
 */
@Slf4j
@Component
public class RateLimitedGeocodeClient {

    private final GeocodeProvider provider;
    private final RateGate rateGate;
    private final AtomicLong lookups = new AtomicLong();

    public RateLimitedGeocodeClient(GeocodeProvider provider, RateGate rateGate) {
        this.provider = provider;
        this.rateGate = rateGate;
    }

    /**
     * @param query the free-text query
     * @return the provider's match, or empty if it found nothing
     * @throws GeocodeProviderException if the provider call failed
     */
    public Optional<Coordinates> lookup(String query) {
        return rateGate.call(() -> {
            lookups.incrementAndGet();
            log.debug("Geocoding '{}' via {}", query, provider.getProviderId());
            Optional<Coordinates> result;
            try {
                result = provider.lookup(query);
            } catch (GeocodeProviderException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new GeocodeProviderException("Provider " + provider.getProviderId()
                        + " failed unexpectedly for query '" + query + "': " + e, e);
            }
            return result == null ? Optional.empty() : result;
        });
    }

    /**
     * Number of lookups issued through this client so far.
     */
    public long getLookupCount() {
        return lookups.get();
    }
}
