/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.config;

import com.geopanel.geocode.provider.RateGate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Wires the outbound HTTP client and the shared rate gate for the geocoding
 * provider.
 */
@Slf4j
@Configuration
public class GeocodeClientConfig {

    @Bean
    public RestClient geocodeRestClient(RestClient.Builder restClientBuilder, GeocodeProperties properties) {
        GeocodeProperties.Provider provider = properties.getProvider();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(provider.getTimeout());
        requestFactory.setReadTimeout(provider.getTimeout());

        log.info("Geocoding provider at {} (timeout {}, user agent '{}')",
                provider.getBaseUrl(), provider.getTimeout(), provider.getUserAgent());

        return restClientBuilder
                .baseUrl(provider.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader("User-Agent", provider.getUserAgent())
                .build();
    }

    @Bean
    public RateGate geocodeRateGate(GeocodeProperties properties) {
        return new RateGate(properties.getProvider().getMinDelay());
    }
}
