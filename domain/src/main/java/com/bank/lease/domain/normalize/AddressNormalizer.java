package com.bank.lease.domain.normalize;

import com.bank.lease.domain.model.PropertyAddress;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Canonical form of a street address for comparison
 */
public final class AddressNormalizer {

    private static final Map<String, String> ABBREVIATIONS = Map.ofEntries(
            Map.entry("street", "st"),
            Map.entry("avenue", "ave"),
            Map.entry("boulevard", "blvd"),
            Map.entry("road", "rd"),
            Map.entry("drive", "dr"),
            Map.entry("lane", "ln"),
            Map.entry("court", "ct"),
            Map.entry("place", "pl"),
            Map.entry("parkway", "pkwy"),
            Map.entry("highway", "hwy"),
            Map.entry("suite", "ste"),
            Map.entry("floor", "fl"),
            Map.entry("north", "n"),
            Map.entry("south", "s"),
            Map.entry("east", "e"),
            Map.entry("west", "w"));

    private AddressNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = text.toLowerCase(Locale.ROOT)
                .replace("#", " ste ")
                .replaceAll("[^a-z0-9 ]", " ")
                .trim();
        return Arrays.stream(cleaned.split("\\s+"))
                .filter(token -> !token.isEmpty())
                .map(token -> ABBREVIATIONS.getOrDefault(token, token))
                .collect(Collectors.joining(" "));
    }

    /**
     * Compares the parts both addresses state. A part missing on either side is not a mismatch.
     */
    public static boolean sameAddress(PropertyAddress a, PropertyAddress b) {
        if (a == null || b == null) {
            return true;
        }
        return partMatches(a.getStreetAddress(), b.getStreetAddress())
                && partMatches(a.getCity(), b.getCity())
                && partMatches(a.getState(), b.getState())
                && partMatches(zip5(a.getZipCode()), zip5(b.getZipCode()));
    }

    private static boolean partMatches(String a, String b) {
        if (a == null || b == null || a.isBlank() || b.isBlank()) {
            return true;
        }
        return normalize(a).equals(normalize(b));
    }

    private static String zip5(String zip) {
        if (zip == null) {
            return null;
        }
        String digits = zip.trim();
        return digits.length() > 5 ? digits.substring(0, 5) : digits;
    }
}
