/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.model;

/**
 * A WGS84 point as returned by a geocoding provider.
 */
public record Coordinates(double latitude, double longitude) {

    public Coordinates {
        if (Double.isNaN(latitude) || Double.isNaN(longitude)) {
            throw new IllegalArgumentException("Coordinates must not be NaN");
        }
    }
}
