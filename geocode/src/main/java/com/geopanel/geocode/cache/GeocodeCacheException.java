/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.cache;

/**
 * The resolution cache's backing store could not be read or written.
 */
public class GeocodeCacheException extends RuntimeException {

    public GeocodeCacheException(String message) {
        super(message);
    }

    public GeocodeCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
