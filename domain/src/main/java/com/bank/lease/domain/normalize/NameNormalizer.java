package com.bank.lease.domain.normalize;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Canonical form of a party name: lower case, punctuation removed, legal-entity suffixes dropped
 */
public final class NameNormalizer {

    private static final List<String> ENTITY_SUFFIXES = List.of(
            "inc", "incorporated", "llc", "l l c", "ltd", "limited", "corp", "corporation",
            "co", "company", "lp", "llp", "plc", "pc", "na");

    private NameNormalizer() {
    }

    public static String normalize(String name) {
        if (name == null) {
            return null;
        }
        String cleaned = name.toLowerCase(Locale.ROOT)
                .replace("&", " and ")
                .replaceAll("[^a-z0-9 ]", " ")
                .replaceAll("\\s+", " ")
                .trim();
        if (cleaned.startsWith("the ")) {
            cleaned = cleaned.substring(4);
        }
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            for (String suffix : ENTITY_SUFFIXES) {
                if (cleaned.endsWith(" " + suffix)) {
                    cleaned = cleaned.substring(0, cleaned.length() - suffix.length() - 1).trim();
                    stripped = true;
                }
            }
        }
        return Arrays.stream(cleaned.split(" "))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.joining(" "));
    }

    public static boolean sameParty(String a, String b) {
        if (a == null || b == null) {
            return true; // nothing to compare
        }
        return normalize(a).equals(normalize(b));
    }
}
