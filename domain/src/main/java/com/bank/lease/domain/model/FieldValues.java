package com.bank.lease.domain.model;

import com.bank.lease.domain.exception.FieldValueException;
import com.bank.lease.domain.normalize.DateNormalizer;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads loosely typed values (as they arrive in amendment change-sets) as the
 * declared type of a lease field, and renders values for conflict evidence.
 */
public final class FieldValues {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private FieldValues() {
    }

    public static <T> T coerce(String fieldName, Object raw, Class<T> type) {
        if (raw == null) {
            return null;
        }
        if (type.isInstance(raw)) {
            return type.cast(raw);
        }
        try {
            if (type == BigDecimal.class) {
                return type.cast(toDecimal(raw));
            }
            if (type == Integer.class) {
                return type.cast(toDecimal(raw).intValueExact());
            }
            if (type == LocalDate.class) {
                return type.cast(DateNormalizer.normalize(raw.toString())
                        .orElseThrow(() -> new DateTimeException("Unrecognized date: " + raw)));
            }
            if (type == String.class) {
                return type.cast(raw.toString());
            }
            return MAPPER.convertValue(raw, type);
        } catch (IllegalArgumentException | ArithmeticException | DateTimeException e) {
            throw new FieldValueException(fieldName, raw, e);
        }
    }

    private static BigDecimal toDecimal(Object raw) {
        if (raw instanceof BigDecimal) {
            return (BigDecimal) raw;
        }
        if (raw instanceof Number) {
            return new BigDecimal(raw.toString());
        }
        String cleaned = raw.toString().replace("$", "").replace(",", "").trim();
        return new BigDecimal(cleaned);
    }

    /**
     * Money and footage to two decimals, dates ISO-8601, addresses as a single line
     */
    public static String render(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).setScale(2, RoundingMode.HALF_UP).toPlainString();
        }
        if (value instanceof PropertyAddress) {
            PropertyAddress address = (PropertyAddress) value;
            return Stream.of(address.getStreetAddress(), address.getCity(), address.getState(),
                            address.getZipCode(), address.getCountry())
                    .filter(Objects::nonNull)
                    .collect(Collectors.joining(", "));
        }
        return value.toString();
    }
}
