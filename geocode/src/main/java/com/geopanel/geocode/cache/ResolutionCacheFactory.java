/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geopanel.geocode.config.GeocodeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Opens the resolution cache selected by configuration: the JSON file cache,
 * or a no-op cache when {@code geocode.cache.enabled} is false.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResolutionCacheFactory {

    private final GeocodeProperties properties;
    private final ObjectMapper objectMapper;

    public ResolutionCache open() {
        GeocodeProperties.Cache cache = properties.getCache();
        if (!cache.isEnabled()) {
            log.info("Geocode cache disabled, every query will go to the provider");
            return new NoOpResolutionCache();
        }
        return JsonFileResolutionCache.open(Path.of(cache.getPath()), objectMapper, cache.getFlushEvery());
    }
}
