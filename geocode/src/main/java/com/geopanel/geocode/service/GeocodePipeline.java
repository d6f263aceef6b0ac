/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.service;

import com.geopanel.geocode.cache.ResolutionCache;
import com.geopanel.geocode.config.GeocodeProperties;
import com.geopanel.geocode.io.RecordSink;
import com.geopanel.geocode.model.AddressRecord;
import com.geopanel.geocode.model.GeocodedRecord;
import com.geopanel.geocode.model.Resolution;
import com.geopanel.geocode.normalize.AddressNormalizer;
import com.geopanel.geocode.normalize.CanonicalQueryBuilder;
import com.geopanel.geocode.normalize.VirtualProviderClassifier;
import com.geopanel.geocode.provider.RateLimitedGeocodeClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Drives one geocoding run: each record is normalized, classified, resolved
 * and forwarded to the sink, in input order. A record that cannot be
 * geocoded ends as FAILED; it never stops the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GeocodePipeline {

    private final AddressNormalizer normalizer;
    private final VirtualProviderClassifier classifier;
    private final CanonicalQueryBuilder queryBuilder;
    private final RateLimitedGeocodeClient client;
    private final GeocodeProperties properties;

    public RunSummary run(List<AddressRecord> records, ResolutionCache cache, RecordSink sink) {
        FallbackResolver resolver = new FallbackResolver(client, cache, RetryPolicy.from(properties.getRetry()));
        RunSummary.Accumulator summary = new RunSummary.Accumulator();

        log.info("Geocoding {} provider records", records.size());
        int processed = 0;
        for (AddressRecord record : records) {
            GeocodedRecord geocoded = geocode(record, resolver);
            sink.accept(geocoded);
            summary.add(geocoded);

            processed++;
            if (processed % 100 == 0) {
                log.info("Geocoded {}/{} records", processed, records.size());
            }
        }

        RunSummary result = summary.build();
        log.info("Providers input: {} | Mapped: {} (Green/Physical: {}, Blue/Centroid: {}, Grey/Inactive: {})",
                result.total(), result.mapped(), result.activePhysical(), result.activeTownCentroid(),
                result.inactive());
        log.info("Virtual: {} | Failed: {} | Cache hits: {} | Provider attempts: {}",
                result.virtual(), result.failed(), result.cacheHits(), result.providerAttempts());
        return result;
    }

    GeocodedRecord geocode(AddressRecord record, FallbackResolver resolver) {
        String address = normalizer.normalize(record.physicalAddress());
        String town = normalizer.cleanField(record.town());
        String county = normalizer.cleanField(record.county());
        boolean virtual = classifier.isVirtual(address);
        String query = queryBuilder.fullQuery(address, town, county);

        Resolution resolution = resolver.resolve(query, queryBuilder.townQuery(town, county), virtual);
        log.debug("{} -> {} ({})", query, resolution.outcome().source(), resolution.state());
        return new GeocodedRecord(record, address, virtual, query, resolution);
    }
}
