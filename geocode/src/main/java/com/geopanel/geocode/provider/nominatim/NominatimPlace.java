/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.provider.nominatim;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * One element of a Nominatim {@code /search} response. Coordinates arrive as
 * decimal strings.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class NominatimPlace {

    @JsonProperty("place_id")
    private Long placeId;

    @JsonProperty("lat")
    private String lat;

    @JsonProperty("lon")
    private String lon;

    @JsonProperty("display_name")
    private String displayName;

    @JsonProperty("addresstype")
    private String addressType;

    private Double importance;
}
