/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.model;

/**
 * An input row enriched with the fields the pipeline derived for it.
 */
public record GeocodedRecord(
        AddressRecord record,
        String normalizedAddress,
        boolean virtual,
        String query,
        Resolution resolution
) {

    public ResolutionOutcome outcome() {
        return resolution.outcome();
    }
}
