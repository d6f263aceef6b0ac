/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GeoConfidence {
    STREET("STREET"),
    TOWN_CENTROID("TOWN_CENTROID"),
    NOT_APPLICABLE("N/A"),
    FAILED("FAILED");

    private final String label;

    GeoConfidence(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
