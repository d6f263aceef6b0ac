/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.io;

import com.geopanel.geocode.model.GeocodedRecord;

/**
 * Receives geocoded rows in input order.
 */
public interface RecordSink extends AutoCloseable {

    void accept(GeocodedRecord record);

    @Override
    void close();
}
