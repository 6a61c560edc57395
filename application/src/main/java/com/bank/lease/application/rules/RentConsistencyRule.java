package com.bank.lease.application.rules;

import com.bank.lease.domain.calc.FinancialCalculator;
import com.bank.lease.domain.enums.ConflictCategory;
import com.bank.lease.domain.enums.FieldGroup;
import com.bank.lease.domain.exception.FieldValueException;
import com.bank.lease.domain.model.ChainLink;
import com.bank.lease.domain.model.ConflictRecord;
import com.bank.lease.domain.model.FieldValues;
import com.bank.lease.domain.model.LeaseGroupSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * compare_rent: a rent amount an amendment quotes as the prior value must equal,
 * to the cent, the amount in force when the amendment takes effect
 */
@Component
@Order(2)
public class RentConsistencyRule implements ConflictRule {

    private static final Logger log = LoggerFactory.getLogger(RentConsistencyRule.class);

    @Override
    public String name() {
        return "compare_rent";
    }

    @Override
    public List<ConflictRecord> evaluate(LeaseGroupSnapshot group) {
        List<ConflictRecord> findings = new ArrayList<>();
        for (ChainLink link : Findings.appliedLinks(group)) {
            String amendmentId = link.getAmendment().getAmendmentId();
            for (Findings.Restatement restatement : Findings.restatements(link, FieldGroup.RENT)) {
                String fieldName = restatement.field.getFieldName();
                BigDecimal inForce = (BigDecimal) restatement.field.read(link.getStateBefore());
                if (inForce == null) {
                    continue;
                }
                BigDecimal claimed;
                try {
                    claimed = (BigDecimal) restatement.field.coerce(restatement.claimedValue);
                } catch (FieldValueException e) {
                    log.warn("Skipping {} restatement on amendment {}: {}", fieldName, amendmentId, e.getMessage());
                    continue;
                }
                if (!FinancialCalculator.equalToCent(inForce, claimed)) {
                    findings.add(Findings.of(group, ConflictCategory.RENT_CONFLICT, fieldName,
                            link.sourceOf(fieldName, group.getLeaseId()), inForce,
                            amendmentId, claimed,
                            String.format("Amendment %s states prior %s of %s but %s was in force",
                                    amendmentId, fieldName, FieldValues.render(claimed), FieldValues.render(inForce))));
                }
            }
        }
        return findings;
    }
}
