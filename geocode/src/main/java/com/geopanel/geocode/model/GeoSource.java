/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.model;

/**
 * How a record's coordinates were obtained.
 */
public enum GeoSource {
    PHYSICAL,
    TOWN_CENTROID,
    VIRTUAL,
    FAILED
}
