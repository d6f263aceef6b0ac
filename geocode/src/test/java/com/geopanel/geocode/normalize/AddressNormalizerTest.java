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
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AddressNormalizer.
 */
class AddressNormalizerTest {

    private final AddressNormalizer normalizer = new AddressNormalizer();

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\t\n"})
    @DisplayName("Should normalize absent or blank input to an empty string")
    void shouldNormalizeAbsentToEmpty(String input) {
        assertEquals("", normalizer.normalize(input));
    }

    @Test
    @DisplayName("Should strip the floor and compress the rest of a typical address")
    void shouldNormalizeTypicalAddress() {
        assertEquals(", nr city mall, moi ave", normalizer.normalize("3rd Floor, Near City Mall, Moi Avenue"));
    }

    @ParameterizedTest(name = "[{index}] {0}")
    @CsvSource(delimiter = '|', value = {
            "3rd Floor Kimathi House                | kimathi house",
            "12th floor, Anniversary Towers          | , anniversary towers",
            "1 floor Tumaini Plaza                   | tumaini plaza",
            "Floor 2, Kenyatta Avenue                | , kenyatta ave",
            "Kenyatta Avenue floor 4th               | kenyatta ave",
            "Ground Floor, Sarit Centre              | ground floor, sarit centre"
    })
    @DisplayName("Should strip floor references written either way round")
    void shouldStripFloors(String input, String expected) {
        assertEquals(expected, normalizer.normalize(input));
    }

    @ParameterizedTest(name = "[{index}] {0}")
    @CsvSource(delimiter = '|', value = {
            "Clinic 4 Room, Mama Ngina Street        | clinic , mama ngina st",
            "2nd room Hurlingham Plaza               | hurlingham plaza",
            "Room 101, Hospital Road                 | room 101, hospital rd"
    })
    @DisplayName("Should strip room references that follow their number")
    void shouldStripRooms(String input, String expected) {
        assertEquals(expected, normalizer.normalize(input));
    }

    @ParameterizedTest(name = "[{index}] {0}")
    @CsvSource(delimiter = '|', value = {
            "Next to Total Petrol Station, off Thika Road | total petrol station, thika rd",
            "Next   To Bus Stage                          | bus stage",
            "Next off to Market                           | market",
            "Offices at Broadway, Nearby Roadside         | offices at broadway, nearby roadside"
    })
    @DisplayName("Should strip 'next to' and 'off' as whole words only")
    void shouldStripFillerWords(String input, String expected) {
        assertEquals(expected, normalizer.normalize(input));
    }

    @ParameterizedTest(name = "[{index}] {0}")
    @CsvSource(delimiter = '|', value = {
            "Ngong Road                  | ngong rd",
            "Biashara Street             | biashara st",
            "Moi Avenue                  | moi ave",
            "Opposite Nakumatt           | opp nakumatt",
            "Near Bus Stage              | nr bus stage",
            "Moi Avenue Street Road      | moi ave st rd",
            "Broadway Streetwise Avenues | broadway streetwise avenues"
    })
    @DisplayName("Should compress whole-word suffixes")
    void shouldCompressSuffixes(String input, String expected) {
        assertEquals(expected, normalizer.normalize(input));
    }

    @Test
    @DisplayName("Should collapse whitespace and trim")
    void shouldCollapseWhitespace() {
        assertEquals("kimathi st nairobi", normalizer.normalize("  Kimathi\tStreet   \n Nairobi "));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "3rd Floor, Near City Mall, Moi Avenue",
            "Next to Total Petrol Station, off Thika Road",
            "Clinic 4 Room, Mama Ngina Street",
            "Next off to Market",
            "2 off floor Tom Mboya Street",
            "Room 101, Hospital Road",
            "Telehealth - Online Consultation",
            "  Kimathi\tStreet   \n Nairobi "
    })
    @DisplayName("Should be idempotent")
    void shouldBeIdempotent(String input) {
        String once = normalizer.normalize(input);

        assertEquals(once, normalizer.normalize(once));
    }

    @Test
    @DisplayName("Should strip a floor reference exposed by removing a filler word")
    void shouldReachFixpoint() {
        assertEquals("tom mboya st", normalizer.normalize("2 off floor Tom Mboya Street"));
    }

    @Test
    @DisplayName("Should trim town and county fields and map null to empty")
    void shouldCleanFields() {
        assertEquals("Nairobi", normalizer.cleanField("  Nairobi "));
        assertEquals("", normalizer.cleanField(null));
    }
}
