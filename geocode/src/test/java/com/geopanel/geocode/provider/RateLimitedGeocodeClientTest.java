/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.provider;

import com.geopanel.geocode.model.Coordinates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static com.geopanel.geocode.provider.ScriptedGeocodeProvider.failure;
import static com.geopanel.geocode.provider.ScriptedGeocodeProvider.found;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RateLimitedGeocodeClient.
 */
class RateLimitedGeocodeClientTest {

    private ScriptedGeocodeProvider provider;
    private RateLimitedGeocodeClient client;

    @BeforeEach
    void setUp() {
        provider = new ScriptedGeocodeProvider();
        client = new RateLimitedGeocodeClient(provider, new RateGate(Duration.ZERO));
    }

    @Test
    @DisplayName("Should return the provider's coordinates")
    void shouldReturnProviderResult() {
        provider.script("Nairobi, Nairobi, Kenya", found(-1.2864, 36.8172));

        var result = client.lookup("Nairobi, Nairobi, Kenya");

        assertEquals(Optional.of(new Coordinates(-1.2864, 36.8172)), result);
        assertEquals(1, client.getLookupCount());
    }

    @Test
    @DisplayName("Should return empty when the provider finds nothing")
    void shouldReturnEmptyForNoResult() {
        assertTrue(client.lookup("nowhere, Kenya").isEmpty());
        assertEquals(1, client.getLookupCount());
    }

    @Test
    @DisplayName("Should pass provider failures through without retrying")
    void shouldNotRetryFailures() {
        provider.script("Mombasa, Mombasa, Kenya", failure());

        assertThrows(GeocodeProviderException.class, () -> client.lookup("Mombasa, Mombasa, Kenya"));
        assertEquals(1, provider.callCount("Mombasa, Mombasa, Kenya"));
        assertEquals(1, client.getLookupCount());
    }

    @Test
    @DisplayName("Should treat a null provider answer as no result")
    void shouldTreatNullAsEmpty() {
        var nullClient = new RateLimitedGeocodeClient(new GeocodeProvider() {
            @Override
            public String getProviderId() {
                return "null";
            }

            @Override
            public Optional<Coordinates> lookup(String query) {
                return null;
            }
        }, new RateGate(Duration.ZERO));

        assertTrue(nullClient.lookup("anything").isEmpty());
    }

    @Test
    @DisplayName("Should report an unexpected provider error as a provider exception")
    void shouldWrapUnexpectedProviderErrors() {
        var broken = new IllegalStateException("unexpected payload");
        var brokenClient = new RateLimitedGeocodeClient(new GeocodeProvider() {
            @Override
            public String getProviderId() {
                return "broken";
            }

            @Override
            public Optional<Coordinates> lookup(String query) {
                throw broken;
            }
        }, new RateGate(Duration.ZERO));

        var ex = assertThrows(GeocodeProviderException.class, () -> brokenClient.lookup("Garissa, Garissa, Kenya"));
        assertSame(broken, ex.getCause());
        assertEquals(1, brokenClient.getLookupCount());
    }
}
