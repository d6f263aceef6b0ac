/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.runner;

import com.geopanel.geocode.cache.ResolutionCache;
import com.geopanel.geocode.cache.ResolutionCacheFactory;
import com.geopanel.geocode.config.GeocodeProperties;
import com.geopanel.geocode.io.CsvRecordSink;
import com.geopanel.geocode.io.CsvRecordSource;
import com.geopanel.geocode.model.AddressRecord;
import com.geopanel.geocode.service.GeocodePipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs the geocoding batch once at startup: read the input, open the cache,
 * geocode every row, write the enriched output.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "geocode.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GeocodeJobRunner implements CommandLineRunner {

    private final GeocodeProperties properties;
    private final GeocodePipeline pipeline;
    private final ResolutionCacheFactory cacheFactory;

    @Override
    public void run(String... args) {
        Path input = Path.of(properties.getInputFile());
        Path output = Path.of(properties.getOutputFile());

        CsvRecordSource source = new CsvRecordSource(input);
        List<AddressRecord> records = source.read();

        try (ResolutionCache cache = cacheFactory.open();
             CsvRecordSink sink = new CsvRecordSink(output, source.getColumns())) {
            pipeline.run(records, cache, sink);
        }

        log.info("Geocoding complete. Output file: {}", output);
    }
}
