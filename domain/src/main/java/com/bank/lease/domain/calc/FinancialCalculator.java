package com.bank.lease.domain.calc;

import com.bank.lease.domain.enums.EscalationType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Lease financial arithmetic. Money values are rounded HALF_UP to cents.
 */
public final class FinancialCalculator {

    public static final int PRECISION = 2;
    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private FinancialCalculator() {
    }

    public static BigDecimal round(BigDecimal value) {
        return value == null ? null : value.setScale(PRECISION, RoundingMode.HALF_UP);
    }

    /**
     * Equality to the cent
     */
    public static boolean equalToCent(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == b;
        }
        return round(a).compareTo(round(b)) == 0;
    }

    public static BigDecimal annualFromMonthly(BigDecimal monthly) {
        return round(monthly.multiply(MONTHS_PER_YEAR));
    }

    public static BigDecimal monthlyFromAnnual(BigDecimal annual) {
        return annual.divide(MONTHS_PER_YEAR, PRECISION, RoundingMode.HALF_UP);
    }

    /**
     * Annual rent per rentable square foot
     * @throws IllegalArgumentException if square footage is not positive
     */
    public static BigDecimal rentPerSquareFoot(BigDecimal annualRent, BigDecimal squareFeet) {
        if (squareFeet == null || squareFeet.signum() <= 0) {
            throw new IllegalArgumentException("Square footage must be positive: " + squareFeet);
        }
        return annualRent.divide(squareFeet, PRECISION, RoundingMode.HALF_UP);
    }

    /**
     * Rent after the given number of escalation periods.
     * CPI and market escalations cannot be computed and return the base rent.
     */
    public static BigDecimal escalatedRent(BigDecimal baseRent, EscalationType type,
                                           BigDecimal rateOrAmount, int periods) {
        if (type == null || rateOrAmount == null || periods <= 0) {
            return round(baseRent);
        }
        return switch (type) {
            case FIXED_PERCENTAGE -> {
                BigDecimal factor = BigDecimal.ONE.add(rateOrAmount.divide(HUNDRED, 10, RoundingMode.HALF_UP));
                yield round(baseRent.multiply(factor.pow(periods)));
            }
            case FIXED_AMOUNT -> round(baseRent.add(rateOrAmount.multiply(BigDecimal.valueOf(periods))));
            case CPI, MARKET -> round(baseRent);
        };
    }

    /**
     * Whole months covered by a term whose expiration date is inclusive,
     * e.g. 2024-01-01 to 2028-12-31 is 60 months
     */
    public static long monthsBetween(LocalDate commencement, LocalDate expiration) {
        return ChronoUnit.MONTHS.between(commencement, expiration.plusDays(1));
    }

    /**
     * Whether a stated value agrees with a calculated one within a relative tolerance
     * @param tolerancePercent relative tolerance, 0.01 means 1%
     */
    public static boolean verify(BigDecimal stated, BigDecimal calculated, BigDecimal tolerancePercent) {
        BigDecimal difference = stated.subtract(calculated).abs();
        BigDecimal allowed = stated.abs().multiply(tolerancePercent);
        return difference.compareTo(allowed) <= 0;
    }
}
