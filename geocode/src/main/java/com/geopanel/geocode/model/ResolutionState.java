/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.model;

/**
 * Terminal state of the fallback resolver for one record.
 */
public enum ResolutionState {
    VIRTUAL_SHORT_CIRCUIT,
    CACHE_HIT,
    ATTEMPT_FULL,
    ATTEMPT_TOWN,
    FAILED
}
