package com.bank.lease.domain.normalize;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads dates the way lease documents write them: "December 31, 2030", "Dec. 31 2030",
 * "12/31/2030", "31st day of December, 2030" and ISO-8601.
 */
public final class DateNormalizer {

    private static final String MONTH_NAMES =
            "January|February|March|April|May|June|July|August|September|October|November|December";
    private static final String MONTH_ABBREVIATIONS = "Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sept|Sep|Oct|Nov|Dec";

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("(?<year>\\d{4})-(?<month>\\d{2})-(?<day>\\d{2})"),
            Pattern.compile("(?<month>" + MONTH_NAMES + ")\\s+(?<day>\\d{1,2})(?:st|nd|rd|th)?,?\\s+(?<year>\\d{4})",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?<month>" + MONTH_ABBREVIATIONS + ")\\.?\\s+(?<day>\\d{1,2}),?\\s+(?<year>\\d{4})",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?<month>\\d{1,2})/(?<day>\\d{1,2})/(?<year>\\d{4}|\\d{2})"),
            Pattern.compile("(?<day>\\d{1,2})(?:st|nd|rd|th)\\s+(?:day\\s+of\\s+)?(?<month>" + MONTH_NAMES
                    + "),?\\s+(?<year>\\d{4})", Pattern.CASE_INSENSITIVE));

    private static final Pattern NUMERIC_TERM = Pattern.compile("(\\d+)\\s*\\)?\\s*(year|month)s?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WORD_TERM = Pattern.compile("\\b([a-z]+)\\s+(year|month)s?\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Map<String, Integer> NUMBER_WORDS = Map.ofEntries(
            Map.entry("one", 1), Map.entry("two", 2), Map.entry("three", 3), Map.entry("four", 4),
            Map.entry("five", 5), Map.entry("six", 6), Map.entry("seven", 7), Map.entry("eight", 8),
            Map.entry("nine", 9), Map.entry("ten", 10), Map.entry("eleven", 11), Map.entry("twelve", 12),
            Map.entry("fifteen", 15), Map.entry("twenty", 20), Map.entry("thirty", 30));

    private DateNormalizer() {
    }

    /**
     * The date the whole text denotes; empty when the text is not a single recognizable calendar date
     */
    public static Optional<LocalDate> normalize(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String cleaned = text.trim();
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(cleaned);
            if (matcher.matches()) {
                return toDate(matcher);
            }
        }
        return Optional.empty();
    }

    /**
     * Every valid date written in a block of text, in order of first appearance, without duplicates
     */
    public static List<LocalDate> findDates(String text) {
        if (text == null) {
            return List.of();
        }
        TreeMap<Integer, LocalDate> byPosition = new TreeMap<>();
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                int start = matcher.start();
                toDate(matcher).ifPresent(date -> byPosition.putIfAbsent(start, date));
            }
        }
        Set<LocalDate> dates = new LinkedHashSet<>(byPosition.values());
        return new ArrayList<>(dates);
    }

    /**
     * Last day of a term of "5 years", "60 months" or "three (3) years" starting on the given date
     */
    public static Optional<LocalDate> calculateTermEnd(LocalDate start, String termDescription) {
        if (start == null || termDescription == null) {
            return Optional.empty();
        }
        Integer amount = null;
        String unit = null;
        Matcher numeric = NUMERIC_TERM.matcher(termDescription);
        if (numeric.find()) {
            amount = Integer.valueOf(numeric.group(1));
            unit = numeric.group(2);
        } else {
            Matcher word = WORD_TERM.matcher(termDescription);
            while (amount == null && word.find()) {
                amount = NUMBER_WORDS.get(word.group(1).toLowerCase(Locale.ROOT));
                unit = word.group(2);
            }
        }
        if (amount == null || amount <= 0) {
            return Optional.empty();
        }
        LocalDate next = unit.equalsIgnoreCase("year") ? start.plusYears(amount) : start.plusMonths(amount);
        return Optional.of(next.minusDays(1));
    }

    private static Optional<LocalDate> toDate(Matcher matcher) {
        int year = Integer.parseInt(matcher.group("year"));
        if (year < 100) {
            year += 2000;
        }
        int month = monthOf(matcher.group("month"));
        int day = Integer.parseInt(matcher.group("day"));
        if (month < 1 || month > 12 || !YearMonth.of(year, month).isValidDay(day)) {
            return Optional.empty();
        }
        return Optional.of(LocalDate.of(year, month, day));
    }

    private static int monthOf(String token) {
        if (Character.isDigit(token.charAt(0))) {
            return Integer.parseInt(token);
        }
        String prefix = token.substring(0, 3).toLowerCase(Locale.ROOT);
        List<String> months = List.of("jan", "feb", "mar", "apr", "may", "jun",
                "jul", "aug", "sep", "oct", "nov", "dec");
        return months.indexOf(prefix) + 1;
    }
}
