/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.service;

import com.geopanel.geocode.model.GeoSource;
import com.geopanel.geocode.model.GeocodedRecord;
import com.geopanel.geocode.model.ResolutionState;

/**
 * Counts collected over one pipeline run.
 *
 * @param total              records processed
 * @param mapped             records that ended with coordinates
 * @param activePhysical     active records placed at their street address
 * @param activeTownCentroid active records placed at their town centroid
 * @param inactive           records whose status is not active
 * @param virtual            records classified as virtual providers
 * @param failed             records that could not be placed
 * @param cacheHits          records answered from the resolution cache
 * @param providerAttempts   provider lookups spent across all records
 */
public record RunSummary(
        int total,
        int mapped,
        int activePhysical,
        int activeTownCentroid,
        int inactive,
        int virtual,
        int failed,
        int cacheHits,
        int providerAttempts
) {

    static final class Accumulator {
        private int total;
        private int mapped;
        private int activePhysical;
        private int activeTownCentroid;
        private int inactive;
        private int virtual;
        private int failed;
        private int cacheHits;
        private int providerAttempts;

        void add(GeocodedRecord geocoded) {
            total++;
            GeoSource source = geocoded.outcome().source();
            boolean active = geocoded.record().isActive();
            if (geocoded.outcome().isLocated()) {
                mapped++;
            }
            if (!active) {
                inactive++;
            } else if (source == GeoSource.PHYSICAL) {
                activePhysical++;
            } else if (source == GeoSource.TOWN_CENTROID) {
                activeTownCentroid++;
            }
            if (source == GeoSource.VIRTUAL) {
                virtual++;
            } else if (source == GeoSource.FAILED) {
                failed++;
            }
            if (geocoded.resolution().state() == ResolutionState.CACHE_HIT) {
                cacheHits++;
            }
            providerAttempts += geocoded.resolution().attempts();
        }

        RunSummary build() {
            return new RunSummary(total, mapped, activePhysical, activeTownCentroid, inactive,
                    virtual, failed, cacheHits, providerAttempts);
        }
    }
}
