/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Settings for the geocoding batch job, bound from the {@code geocode.*} keys.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "geocode")
public class GeocodeProperties {

    private String country = "Kenya";
    private String inputFile = "data/providers.csv";
    private String outputFile = "outputs/providers_geocoded.csv";
    private Provider provider = new Provider();
    private Retry retry = new Retry();
    private Cache cache = new Cache();
    private Runner runner = new Runner();

    @Data
    public static class Provider {
        private String baseUrl = "https://nominatim.openstreetmap.org";
        private String searchPath = "/search";
        private String userAgent = "medical_providers_panel";
        private Duration timeout = Duration.ofSeconds(10);
        private Duration minDelay = Duration.ofSeconds(1);
    }

    @Data
    public static class Retry {
        private int attempts = 3;
        private Duration backoff = Duration.ofSeconds(2);
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        private String path = "outputs/geocode_cache.json";
        /**
         * Number of writes between intermediate flushes; 0 flushes only on close.
         */
        private int flushEvery = 25;
    }

    @Data
    public static class Runner {
        private boolean enabled = true;
    }
}
