package com.bank.lease.application.rules;

import com.bank.lease.application.config.ReconciliationProperties;
import com.bank.lease.domain.enums.ConflictCategory;
import com.bank.lease.domain.enums.FieldGroup;
import com.bank.lease.domain.exception.FieldValueException;
import com.bank.lease.domain.model.Amendment;
import com.bank.lease.domain.model.ChainLink;
import com.bank.lease.domain.model.ConflictRecord;
import com.bank.lease.domain.model.FieldChange;
import com.bank.lease.domain.model.FieldValues;
import com.bank.lease.domain.model.Lease;
import com.bank.lease.domain.model.LeaseField;
import com.bank.lease.domain.model.LeaseGroupSnapshot;
import com.bank.lease.domain.model.PropertyAddress;
import com.bank.lease.domain.normalize.AddressNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * compare_property: premises referenced by amendments and restated footage must match
 * the premises in force; usable area may not exceed rentable area
 */
@Component
@Order(4)
public class PropertyConsistencyRule implements ConflictRule {

    private static final Logger log = LoggerFactory.getLogger(PropertyConsistencyRule.class);

    private final ReconciliationProperties properties;

    public PropertyConsistencyRule(ReconciliationProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return "compare_property";
    }

    @Override
    public List<ConflictRecord> evaluate(LeaseGroupSnapshot group) {
        List<ConflictRecord> findings = new ArrayList<>();
        for (ChainLink link : Findings.appliedLinks(group)) {
            checkReferencedPremises(group, link, findings);
            checkRestatements(group, link, findings);
        }
        checkUsableArea(group, findings);
        return findings;
    }

    private void checkReferencedPremises(LeaseGroupSnapshot group, ChainLink link, List<ConflictRecord> findings) {
        Amendment amendment = link.getAmendment();
        PropertyAddress referenced = amendment.getPropertyReference();
        PropertyAddress before = link.getStateBefore().getPropertyAddress();
        if (referenced == null || before == null || AddressNormalizer.sameAddress(referenced, before)) {
            return;
        }
        FieldChange change = amendment.getChanges().get(LeaseField.PROPERTY_ADDRESS.getFieldName());
        if (change != null && change.isAuthoritative()
                && AddressNormalizer.sameAddress(referenced, link.getStateAfter().getPropertyAddress())) {
            return;
        }
        String fieldName = LeaseField.PROPERTY_ADDRESS.getFieldName();
        findings.add(Findings.of(group, ConflictCategory.PROPERTY_CONFLICT, fieldName,
                link.sourceOf(fieldName, group.getLeaseId()), before,
                amendment.getAmendmentId(), referenced,
                String.format("Amendment %s references premises '%s' but the lease premises are '%s'",
                        amendment.getAmendmentId(), FieldValues.render(referenced), FieldValues.render(before))));
    }

    private void checkRestatements(LeaseGroupSnapshot group, ChainLink link, List<ConflictRecord> findings) {
        String amendmentId = link.getAmendment().getAmendmentId();
        for (Findings.Restatement restatement : Findings.restatements(link, FieldGroup.PROPERTY)) {
            String fieldName = restatement.field.getFieldName();
            Object inForce = restatement.field.read(link.getStateBefore());
            if (inForce == null) {
                continue;
            }
            Object claimed;
            try {
                claimed = restatement.field.coerce(restatement.claimedValue);
            } catch (FieldValueException e) {
                log.warn("Skipping {} restatement on amendment {}: {}", fieldName, amendmentId, e.getMessage());
                continue;
            }
            boolean matches = inForce instanceof BigDecimal
                    ? withinTolerance((BigDecimal) inForce, (BigDecimal) claimed)
                    : AddressNormalizer.sameAddress((PropertyAddress) inForce, (PropertyAddress) claimed);
            if (!matches) {
                findings.add(Findings.of(group, ConflictCategory.PROPERTY_CONFLICT, fieldName,
                        link.sourceOf(fieldName, group.getLeaseId()), inForce,
                        amendmentId, claimed,
                        String.format("Amendment %s states prior %s of %s but %s was in force",
                                amendmentId, fieldName, FieldValues.render(claimed), FieldValues.render(inForce))));
            }
        }
    }

    private void checkUsableArea(LeaseGroupSnapshot group, List<ConflictRecord> findings) {
        Lease merged = group.getCurrentState();
        BigDecimal rentable = merged.getRentableSquareFeet();
        BigDecimal usable = merged.getUsableSquareFeet();
        if (rentable == null || usable == null) {
            return;
        }
        if (usable.subtract(rentable).compareTo(properties.getSquareFootageTolerance()) > 0) {
            String leaseId = group.getLeaseId();
            findings.add(Findings.of(group, ConflictCategory.PROPERTY_CONFLICT,
                    LeaseField.USABLE_SQUARE_FEET.getFieldName(),
                    group.getProvenance().getOrDefault(LeaseField.RENTABLE_SQUARE_FEET.getFieldName(), leaseId), rentable,
                    group.getProvenance().getOrDefault(LeaseField.USABLE_SQUARE_FEET.getFieldName(), leaseId), usable,
                    String.format("Usable area %s exceeds rentable area %s",
                            FieldValues.render(usable), FieldValues.render(rentable))));
        }
    }

    private boolean withinTolerance(BigDecimal inForce, BigDecimal claimed) {
        return inForce.subtract(claimed).abs().compareTo(properties.getSquareFootageTolerance()) <= 0;
    }
}
