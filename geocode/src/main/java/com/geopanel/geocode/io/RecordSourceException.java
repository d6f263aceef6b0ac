/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.io;

/**
 * The run's input is missing, unreadable or malformed. Fatal.
 */
public class RecordSourceException extends RuntimeException {

    public RecordSourceException(String message) {
        super(message);
    }

    public RecordSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
