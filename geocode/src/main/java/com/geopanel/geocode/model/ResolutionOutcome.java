/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Optional;

/**
 * The final result of geocoding one record. Coordinates are present for
 * {@link GeoSource#PHYSICAL} and {@link GeoSource#TOWN_CENTROID} and absent
 * otherwise; the confidence is derived from the source.
 */
public record ResolutionOutcome(GeoSource source, Coordinates coordinates) {

    private static final ResolutionOutcome VIRTUAL = new ResolutionOutcome(GeoSource.VIRTUAL, null);
    private static final ResolutionOutcome FAILED = new ResolutionOutcome(GeoSource.FAILED, null);

    @JsonCreator
    public ResolutionOutcome(@JsonProperty("source") GeoSource source,
                             @JsonProperty("coordinates") Coordinates coordinates) {
        Objects.requireNonNull(source, "source must not be null");
        boolean located = source == GeoSource.PHYSICAL || source == GeoSource.TOWN_CENTROID;
        if (located && coordinates == null) {
            throw new IllegalArgumentException(source + " outcome requires coordinates");
        }
        if (!located && coordinates != null) {
            throw new IllegalArgumentException(source + " outcome must not carry coordinates");
        }
        this.source = source;
        this.coordinates = coordinates;
    }

    public static ResolutionOutcome physical(Coordinates coordinates) {
        return new ResolutionOutcome(GeoSource.PHYSICAL, coordinates);
    }

    public static ResolutionOutcome townCentroid(Coordinates coordinates) {
        return new ResolutionOutcome(GeoSource.TOWN_CENTROID, coordinates);
    }

    public static ResolutionOutcome virtual() {
        return VIRTUAL;
    }

    public static ResolutionOutcome failed() {
        return FAILED;
    }

    @JsonIgnore
    public GeoConfidence confidence() {
        return switch (source) {
            case PHYSICAL -> GeoConfidence.STREET;
            case TOWN_CENTROID -> GeoConfidence.TOWN_CENTROID;
            case VIRTUAL -> GeoConfidence.NOT_APPLICABLE;
            case FAILED -> GeoConfidence.FAILED;
        };
    }

    @JsonIgnore
    public Optional<Coordinates> location() {
        return Optional.ofNullable(coordinates);
    }

    @JsonIgnore
    public boolean isLocated() {
        return coordinates != null;
    }
}
