/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.io;

import com.geopanel.geocode.model.AddressRecord;

import java.util.List;

/**
 * Supplies the input rows of a run. All rows are read before geocoding starts
 * so that unreadable input aborts the run up front.
 */
public interface RecordSource {

    /**
     * @throws RecordSourceException if the input is missing, unreadable or lacks a required column
     */
    List<AddressRecord> read();

    /**
     * Column names in input order. Available after {@link #read()}.
     */
    List<String> getColumns();
}
