/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.provider.nominatim;

import com.geopanel.geocode.config.GeocodeProperties;
import com.geopanel.geocode.model.Coordinates;
import com.geopanel.geocode.provider.GeocodeProvider;
import com.geopanel.geocode.provider.GeocodeProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Optional;

/**
 * OpenStreetMap Nominatim search. Nominatim's usage policy requires an
 * identifying User-Agent (set on the {@link RestClient}) and at most one
 * request per second (enforced by the caller's rate gate).
 */
@Slf4j
@Component
public class NominatimGeocodeProvider implements GeocodeProvider {

    private final RestClient restClient;
    private final String searchPath;

    public NominatimGeocodeProvider(RestClient geocodeRestClient, GeocodeProperties properties) {
        this.restClient = geocodeRestClient;
        this.searchPath = properties.getProvider().getSearchPath();
    }

    @Override
    public String getProviderId() {
        return "nominatim";
    }

    @Override
    public Optional<Coordinates> lookup(String query) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }

        NominatimPlace[] places;
        try {
            places = restClient.get()
                    .uri(uriBuilder -> uriBuilder.path(searchPath)
                            .queryParam("q", "{query}")
                            .queryParam("format", "jsonv2")
                            .queryParam("limit", 1)
                            .build(query))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        throw new GeocodeProviderException("Nominatim error status " + res.getStatusCode()
                                + " for query '" + query + "'");
                    })
                    .body(NominatimPlace[].class);
        } catch (GeocodeProviderException e) {
            throw e;
        } catch (RestClientException e) {
            throw new GeocodeProviderException("Nominatim request failed for query '" + query + "': "
                    + e.getMessage(), e);
        }

        if (places == null || places.length == 0) {
            log.debug("Nominatim found nothing for '{}'", query);
            return Optional.empty();
        }
        return Optional.of(toCoordinates(places[0], query));
    }

    private Coordinates toCoordinates(NominatimPlace place, String query) {
        if (place == null) {
            throw new GeocodeProviderException("Nominatim returned an empty result entry for query '" + query + "'");
        }
        if (place.getLat() == null || place.getLon() == null) {
            throw new GeocodeProviderException("Nominatim result without coordinates for query '" + query + "'");
        }
        try {
            return new Coordinates(Double.parseDouble(place.getLat()), Double.parseDouble(place.getLon()));
        } catch (IllegalArgumentException e) {
            throw new GeocodeProviderException("Unreadable Nominatim coordinates '" + place.getLat() + "', '"
                    + place.getLon() + "' for query '" + query + "'", e);
        }
    }
}
