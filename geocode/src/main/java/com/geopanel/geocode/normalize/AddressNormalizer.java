/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geopanel.geocode.normalize;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Deterministic clean-up applied to a physical address before it is used in a
 * geocoding query.
 *
 * <p>The transform runs in a fixed order:
 * <ol>
 *   <li>lowercase</li>
 *   <li>strip floor references ({@code 3rd floor}, {@code floor 2})</li>
 *   <li>strip room references ({@code 101 room})</li>
 *   <li>strip the filler words {@code off} and {@code next to}</li>
 *   <li>compress road, street, avenue, opposite and near to their short forms</li>
 *   <li>collapse whitespace and trim</li>
 * </ol>
 * Punctuation around a stripped phrase is left in place. The rules are
 * reapplied until the text stops changing, so normalizing twice is a no-op.
 */
@Component
public class AddressNormalizer {

    private static final String ORDINAL = "(?:st|nd|rd|th)?";

    private static final Pattern FLOOR_AFTER_NUMBER = Pattern.compile("\\b\\d+" + ORDINAL + "\\s*floor\\b");
    private static final Pattern FLOOR_BEFORE_NUMBER = Pattern.compile("\\bfloor\\s*\\d+" + ORDINAL + "\\b");
    private static final Pattern ROOM_AFTER_NUMBER = Pattern.compile("\\b\\d+" + ORDINAL + "\\s*room\\b");
    private static final Pattern OFF = Pattern.compile("\\boff\\b");
    private static final Pattern NEXT_TO = Pattern.compile("\\bnext\\s+to\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<Pattern, String> COMPRESSIONS = new LinkedHashMap<>();

    static {
        COMPRESSIONS.put(Pattern.compile("\\broad\\b"), "rd");
        COMPRESSIONS.put(Pattern.compile("\\bstreet\\b"), "st");
        COMPRESSIONS.put(Pattern.compile("\\bavenue\\b"), "ave");
        COMPRESSIONS.put(Pattern.compile("\\bopposite\\b"), "opp");
        COMPRESSIONS.put(Pattern.compile("\\bnear\\b"), "nr");
    }

    /**
     * Normalizes a free-text address.
     *
     * @param address the raw address, may be null
     * @return the normalized address, or an empty string for null or blank input
     */
    public String normalize(String address) {
        if (address == null || address.isBlank()) {
            return "";
        }

        String current = applyRules(address.toLowerCase(Locale.ROOT));
        // every rule only removes or shortens text, so this terminates
        String next = applyRules(current);
        while (!next.equals(current)) {
            current = next;
            next = applyRules(current);
        }
        return current;
    }

    private String applyRules(String text) {
        text = FLOOR_AFTER_NUMBER.matcher(text).replaceAll("");
        text = FLOOR_BEFORE_NUMBER.matcher(text).replaceAll("");
        text = ROOM_AFTER_NUMBER.matcher(text).replaceAll("");

        // "off" is stripped before "next to" since removing it can join the two words
        text = OFF.matcher(text).replaceAll("");
        text = NEXT_TO.matcher(text).replaceAll("");

        for (Map.Entry<Pattern, String> compression : COMPRESSIONS.entrySet()) {
            text = compression.getKey().matcher(text).replaceAll(compression.getValue());
        }

        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Trims a town or county field, mapping null to an empty string.
     */
    public String cleanField(String value) {
        return value == null ? "" : value.trim();
    }
}
