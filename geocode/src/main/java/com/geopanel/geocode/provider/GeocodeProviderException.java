/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.provider;

/**
 * A failed call to the geocoding provider: network error, timeout, error
 * status or an unreadable response. Callers treat it as a failed attempt.
 */
public class GeocodeProviderException extends RuntimeException {

    public GeocodeProviderException(String message) {
        super(message);
    }

    public GeocodeProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
