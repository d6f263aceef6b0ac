/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Batch job that geocodes a provider panel.
 *
 * <p>Each provider address is normalized and resolved through a rate-limited
 * geocoding service, falling back from the street address to the town
 * centroid. Every outcome, failures included, is kept in a persistent cache
 * so later runs never repeat a lookup.
 */
@SpringBootApplication
public class GeocodeApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeocodeApplication.class, args);
    }
}
