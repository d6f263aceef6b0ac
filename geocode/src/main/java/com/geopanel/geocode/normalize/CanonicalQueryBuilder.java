/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.normalize;

import com.geopanel.geocode.config.GeocodeProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Builds the free-text queries sent to the geocoder. The full query doubles as
 * the resolution cache key.
 */
@Component
public class CanonicalQueryBuilder {

    private final String country;

    @Autowired
    public CanonicalQueryBuilder(GeocodeProperties properties) {
        this(properties.getCountry());
    }

    public CanonicalQueryBuilder(String country) {
        if (country == null || country.isBlank()) {
            throw new IllegalArgumentException("country must not be blank");
        }
        this.country = country.trim();
    }

    /**
     * Full-address query: {@code "{address}, {town}, {county}, {country}"}.
     * Callers pass the normalized address and trimmed town and county.
     */
    public String fullQuery(String normalizedAddress, String town, String county) {
        return String.join(", ", nullToEmpty(normalizedAddress), nullToEmpty(town), nullToEmpty(county), country);
    }

    /**
     * Town-level query: {@code "{town}, {county}, {country}"}.
     */
    public String townQuery(String town, String county) {
        return String.join(", ", nullToEmpty(town), nullToEmpty(county), country);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
