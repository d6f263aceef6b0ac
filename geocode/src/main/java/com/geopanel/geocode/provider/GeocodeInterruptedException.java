/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.provider;

/**
 * Raised when the current thread is interrupted while waiting on the rate
 * gate or a retry backoff. The interrupt flag is restored before throwing.
 */
public class GeocodeInterruptedException extends RuntimeException {

    public GeocodeInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
