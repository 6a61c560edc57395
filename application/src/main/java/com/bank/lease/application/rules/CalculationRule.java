package com.bank.lease.application.rules;

import com.bank.lease.application.config.ReconciliationProperties;
import com.bank.lease.domain.calc.FinancialCalculator;
import com.bank.lease.domain.enums.ConflictCategory;
import com.bank.lease.domain.model.ChainLink;
import com.bank.lease.domain.model.ConflictRecord;
import com.bank.lease.domain.model.FieldValues;
import com.bank.lease.domain.model.Lease;
import com.bank.lease.domain.model.LeaseField;
import com.bank.lease.domain.model.LeaseGroupSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * validate_calculations: derived amounts of the merged lease must follow from their inputs.
 * A derived value set earlier in the chain than one of its inputs is stale and not reported.
 */
@Component
@Order(6)
public class CalculationRule implements ConflictRule {

    private static final Logger log = LoggerFactory.getLogger(CalculationRule.class);

    private final ReconciliationProperties properties;

    public CalculationRule(ReconciliationProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return "validate_calculations";
    }

    @Override
    public List<ConflictRecord> evaluate(LeaseGroupSnapshot group) {
        List<ConflictRecord> findings = new ArrayList<>();
        Lease merged = group.getCurrentState();
        Map<String, Integer> positions = chainPositions(group);

        checkAnnualRent(group, merged, positions, findings);
        checkRentPerSquareFoot(group, merged, positions, findings);
        checkTermMonths(group, merged, positions, findings);
        return findings;
    }

    private void checkAnnualRent(LeaseGroupSnapshot group, Lease merged, Map<String, Integer> positions,
                                 List<ConflictRecord> findings) {
        BigDecimal monthly = merged.getBaseRentMonthly();
        BigDecimal annual = merged.getBaseRentAnnual();
        if (monthly == null || annual == null
                || isStale(group, positions, LeaseField.BASE_RENT_ANNUAL, LeaseField.BASE_RENT_MONTHLY)) {
            return;
        }
        BigDecimal calculated = FinancialCalculator.annualFromMonthly(monthly);
        if (!FinancialCalculator.verify(annual, calculated, properties.getCalculationTolerancePercent())) {
            findings.add(error(group, LeaseField.BASE_RENT_ANNUAL, LeaseField.BASE_RENT_MONTHLY, calculated, annual,
                    String.format("Annual rent %s does not equal monthly rent %s x 12 = %s",
                            FieldValues.render(annual), FieldValues.render(monthly), FieldValues.render(calculated))));
        }
    }

    private void checkRentPerSquareFoot(LeaseGroupSnapshot group, Lease merged, Map<String, Integer> positions,
                                        List<ConflictRecord> findings) {
        BigDecimal stated = merged.getRentPerSquareFoot();
        BigDecimal monthly = merged.getBaseRentMonthly();
        BigDecimal squareFeet = merged.getRentableSquareFeet();
        if (stated == null || monthly == null || squareFeet == null
                || isStale(group, positions, LeaseField.RENT_PER_SQUARE_FOOT,
                        LeaseField.BASE_RENT_MONTHLY, LeaseField.RENTABLE_SQUARE_FEET)) {
            return;
        }
        if (squareFeet.signum() <= 0) {
            log.debug("Lease {} has non-positive rentable area {}; rent per square foot not checked",
                    group.getLeaseId(), squareFeet);
            return;
        }
        BigDecimal calculated = FinancialCalculator.rentPerSquareFoot(
                FinancialCalculator.annualFromMonthly(monthly), squareFeet);
        if (!FinancialCalculator.verify(stated, calculated, properties.getCalculationTolerancePercent())) {
            findings.add(error(group, LeaseField.RENT_PER_SQUARE_FOOT, LeaseField.BASE_RENT_MONTHLY, calculated, stated,
                    String.format("Rent per square foot %s does not match %s x 12 / %s = %s",
                            FieldValues.render(stated), FieldValues.render(monthly),
                            FieldValues.render(squareFeet), FieldValues.render(calculated))));
        }
    }

    private void checkTermMonths(LeaseGroupSnapshot group, Lease merged, Map<String, Integer> positions,
                                 List<ConflictRecord> findings) {
        Integer stated = merged.getTermMonths();
        if (stated == null || merged.getCommencementDate() == null || merged.getExpirationDate() == null
                || !merged.getExpirationDate().isAfter(merged.getCommencementDate())
                || isStale(group, positions, LeaseField.TERM_MONTHS,
                        LeaseField.COMMENCEMENT_DATE, LeaseField.EXPIRATION_DATE)) {
            return;
        }
        long calculated = FinancialCalculator.monthsBetween(merged.getCommencementDate(), merged.getExpirationDate());
        if (Math.abs(calculated - stated) > properties.getTermMonthsTolerance()) {
            findings.add(error(group, LeaseField.TERM_MONTHS, LeaseField.EXPIRATION_DATE, calculated, stated,
                    String.format("Term of %d months does not match %s to %s (%d months)",
                            stated, merged.getCommencementDate(), merged.getExpirationDate(), calculated)));
        }
    }

    private ConflictRecord error(LeaseGroupSnapshot group, LeaseField derived, LeaseField input,
                                 Object calculated, Object stated, String description) {
        String leaseId = group.getLeaseId();
        return Findings.of(group, ConflictCategory.CALCULATION_ERROR, derived.getFieldName(),
                group.getProvenance().getOrDefault(input.getFieldName(), leaseId), calculated,
                group.getProvenance().getOrDefault(derived.getFieldName(), leaseId), stated,
                description);
    }

    private boolean isStale(LeaseGroupSnapshot group, Map<String, Integer> positions,
                            LeaseField derived, LeaseField... inputs) {
        int derivedPosition = positionOf(group, positions, derived);
        for (LeaseField input : inputs) {
            if (positionOf(group, positions, input) > derivedPosition) {
                return true;
            }
        }
        return false;
    }

    private int positionOf(LeaseGroupSnapshot group, Map<String, Integer> positions, LeaseField field) {
        String documentId = group.getProvenance().get(field.getFieldName());
        return documentId == null ? 0 : positions.getOrDefault(documentId, 0);
    }

    // base lease is position 0, amendments follow in chain order
    private static Map<String, Integer> chainPositions(LeaseGroupSnapshot group) {
        Map<String, Integer> positions = new HashMap<>();
        positions.put(group.getLeaseId(), 0);
        int position = 1;
        for (ChainLink link : group.getChain()) {
            positions.put(link.getAmendment().getAmendmentId(), position++);
        }
        return positions;
    }
}
