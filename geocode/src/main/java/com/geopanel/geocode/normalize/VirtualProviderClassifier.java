/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.normalize;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Flags providers that have no physical premises (telehealth and similar).
 * Such records are never sent to the geocoder.
 */
@Component
public class VirtualProviderClassifier {

    static final List<String> KEYWORDS = List.of("virtual", "online", "telemedicine", "telehealth");

    /**
     * @param address a raw or normalized address, may be null
     * @return true if the address mentions any virtual-care keyword; false for null
     */
    public boolean isVirtual(String address) {
        if (address == null) {
            return false;
        }
        String lower = address.toLowerCase(Locale.ROOT);
        return KEYWORDS.stream().anyMatch(lower::contains);
    }
}
