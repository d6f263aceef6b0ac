/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.provider;

import com.geopanel.geocode.model.Coordinates;

import java.util.Optional;

/**
 * A remote free-text geocoding service.
 */
public interface GeocodeProvider {

    String getProviderId();

    /**
     * Resolves a free-text query to a single point.
     *
     * @param query the free-text query
     * @return the best match, or empty when the service found nothing
     * @throws GeocodeProviderException on transport, timeout or service errors
     */
    Optional<Coordinates> lookup(String query);
}
