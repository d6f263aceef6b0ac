/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.normalize;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for VirtualProviderClassifier.
 */
class VirtualProviderClassifierTest {

    private final VirtualProviderClassifier classifier = new VirtualProviderClassifier();

    @ParameterizedTest
    @ValueSource(strings = {
            "Telehealth - Online Consultation",
            "VIRTUAL CLINIC",
            "virtual",
            "Online only",
            "TeleMedicine services",
            "telehealth",
            "Consultations ONLINE via app"
    })
    @DisplayName("Should flag addresses containing a virtual-care keyword in any case")
    void shouldFlagVirtualAddresses(String address) {
        assertTrue(classifier.isVirtual(address));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "3rd Floor, Near City Mall, Moi Avenue",
            "Kenyatta National Hospital, Hospital Road",
            "Tele Towers, Ngong Road"
    })
    @DisplayName("Should treat addresses without a keyword as physical")
    void shouldTreatOthersAsPhysical(String address) {
        assertFalse(classifier.isVirtual(address));
    }

    @Test
    @DisplayName("Should treat a missing address as physical")
    void shouldTreatNullAsPhysical() {
        assertFalse(classifier.isVirtual(null));
    }

    @Test
    @DisplayName("Should recognise every keyword")
    void shouldRecogniseEveryKeyword() {
        for (String keyword : VirtualProviderClassifier.KEYWORDS) {
            assertTrue(classifier.isVirtual("Clinic " + keyword.toUpperCase()), keyword);
        }
    }
}
