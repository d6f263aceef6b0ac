/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One input row. Column order is preserved so that pass-through fields are
 * written back exactly as read.
 */
public record AddressRecord(Map<String, String> fields) {

    public static final String PHYSICAL_ADDRESS = "Physical Address";
    public static final String TOWN = "Town";
    public static final String COUNTY = "County";
    public static final String STATUS = "Status";

    public AddressRecord {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String get(String column) {
        return fields.get(column);
    }

    public String physicalAddress() {
        return fields.get(PHYSICAL_ADDRESS);
    }

    public String town() {
        return fields.get(TOWN);
    }

    public String county() {
        return fields.get(COUNTY);
    }

    public String status() {
        return fields.get(STATUS);
    }

    public boolean isActive() {
        String status = status();
        return status != null && status.trim().equalsIgnoreCase("active");
    }
}
