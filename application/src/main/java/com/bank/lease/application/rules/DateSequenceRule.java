package com.bank.lease.application.rules;

import com.bank.lease.domain.calc.FinancialCalculator;
import com.bank.lease.domain.enums.ConflictCategory;
import com.bank.lease.domain.enums.FieldGroup;
import com.bank.lease.domain.exception.FieldValueException;
import com.bank.lease.domain.model.Amendment;
import com.bank.lease.domain.model.ChainLink;
import com.bank.lease.domain.model.ConflictRecord;
import com.bank.lease.domain.model.FieldChange;
import com.bank.lease.domain.model.Lease;
import com.bank.lease.domain.model.LeaseField;
import com.bank.lease.domain.model.LeaseGroupSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * compare_dates: term ordering, amendment effective dates against the term,
 * overlapping amendment windows, and restated term fields
 */
@Component
@Order(1)
public class DateSequenceRule implements ConflictRule {

    private static final Logger log = LoggerFactory.getLogger(DateSequenceRule.class);

    private static final String EFFECTIVE_DATE = "effective_date";

    @Override
    public String name() {
        return "compare_dates";
    }

    @Override
    public List<ConflictRecord> evaluate(LeaseGroupSnapshot group) {
        List<ConflictRecord> findings = new ArrayList<>();
        checkMergedTerm(group, findings);

        List<ChainLink> links = Findings.appliedLinks(group);
        LocalDate baseCommencement = group.getBaseRecord().getCommencementDate();
        for (ChainLink link : links) {
            checkEffectiveDate(group, link, baseCommencement, findings);
            checkRestatedTerm(group, link, findings);
        }
        checkOverlaps(group, links, findings);
        return findings;
    }

    private void checkMergedTerm(LeaseGroupSnapshot group, List<ConflictRecord> findings) {
        Lease merged = group.getCurrentState();
        LocalDate commencement = merged.getCommencementDate();
        LocalDate expiration = merged.getExpirationDate();
        if (commencement == null || expiration == null || expiration.isAfter(commencement)) {
            return;
        }
        String leaseId = group.getLeaseId();
        findings.add(Findings.of(group, ConflictCategory.TERM_CONFLICT, LeaseField.EXPIRATION_DATE.getFieldName(),
                group.getProvenance().getOrDefault(LeaseField.COMMENCEMENT_DATE.getFieldName(), leaseId), commencement,
                group.getProvenance().getOrDefault(LeaseField.EXPIRATION_DATE.getFieldName(), leaseId), expiration,
                String.format("Expiration %s is not after commencement %s", expiration, commencement)));
    }

    private void checkEffectiveDate(LeaseGroupSnapshot group, ChainLink link, LocalDate baseCommencement,
                                    List<ConflictRecord> findings) {
        Amendment amendment = link.getAmendment();
        LocalDate effective = amendment.getEffectiveDate();
        if (effective == null) {
            return;
        }
        if (baseCommencement != null && effective.isBefore(baseCommencement)) {
            findings.add(Findings.of(group, ConflictCategory.DATE_SEQUENCE, EFFECTIVE_DATE,
                    group.getLeaseId(), baseCommencement,
                    amendment.getAmendmentId(), effective,
                    String.format("Amendment %s is effective %s, before the lease commences on %s",
                            amendment.getAmendmentId(), effective, baseCommencement)));
            return;
        }
        LocalDate expirationInForce = link.getStateBefore().getExpirationDate();
        if (expirationInForce != null && effective.isAfter(expirationInForce)) {
            String fieldName = LeaseField.EXPIRATION_DATE.getFieldName();
            findings.add(Findings.of(group, ConflictCategory.DATE_SEQUENCE, EFFECTIVE_DATE,
                    link.sourceOf(fieldName, group.getLeaseId()), expirationInForce,
                    amendment.getAmendmentId(), effective,
                    String.format("Amendment %s is effective %s, after the term expired on %s",
                            amendment.getAmendmentId(), effective, expirationInForce)));
        }
    }

    private void checkRestatedTerm(LeaseGroupSnapshot group, ChainLink link, List<ConflictRecord> findings) {
        String amendmentId = link.getAmendment().getAmendmentId();
        for (Findings.Restatement restatement : Findings.restatements(link, FieldGroup.TERM)) {
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
            if (!Findings.sameValue(inForce, claimed)) {
                findings.add(Findings.of(group, ConflictCategory.TERM_CONFLICT, fieldName,
                        link.sourceOf(fieldName, group.getLeaseId()), inForce,
                        amendmentId, claimed,
                        String.format("Amendment %s states prior %s of %s but %s was in force",
                                amendmentId, fieldName, claimed, inForce)));
            }
        }
    }

    /**
     * Two amendments changing the same field to different values while both are in effect:
     * same effective date, or the earlier one's window still open when the later one starts.
     * Money fields disagree at the cent and are reported as rent conflicts.
     */
    private void checkOverlaps(LeaseGroupSnapshot group, List<ChainLink> links, List<ConflictRecord> findings) {
        for (int i = 0; i < links.size(); i++) {
            Amendment earlier = links.get(i).getAmendment();
            if (earlier.getEffectiveDate() == null) {
                continue;
            }
            for (int j = i + 1; j < links.size(); j++) {
                Amendment later = links.get(j).getAmendment();
                LocalDate laterEffective = later.getEffectiveDate();
                if (laterEffective == null) {
                    continue;
                }
                boolean sameDay = earlier.getEffectiveDate().equals(laterEffective);
                boolean windowOpen = earlier.getTermsEndDate() != null && earlier.getTermsEndDate().isAfter(laterEffective);
                if (!sameDay && !windowOpen) {
                    continue;
                }
                for (Map.Entry<String, FieldChange> entry : earlier.getChanges().entrySet()) {
                    FieldChange other = later.getChanges().get(entry.getKey());
                    if (entry.getValue() == null || other == null
                            || !entry.getValue().isAuthoritative() || !other.isAuthoritative()) {
                        continue;
                    }
                    Optional<LeaseField> field = LeaseField.fromFieldName(entry.getKey());
                    if (field.isEmpty()) {
                        continue;
                    }
                    Object earlierValue;
                    Object laterValue;
                    try {
                        earlierValue = field.get().coerce(entry.getValue().getNewValue());
                        laterValue = field.get().coerce(other.getNewValue());
                    } catch (FieldValueException e) {
                        log.warn("Skipping overlap check of {} between {} and {}: {}",
                                entry.getKey(), earlier.getAmendmentId(), later.getAmendmentId(), e.getMessage());
                        continue;
                    }
                    boolean rent = field.get().getGroup() == FieldGroup.RENT;
                    boolean same = rent
                            ? FinancialCalculator.equalToCent((BigDecimal) earlierValue, (BigDecimal) laterValue)
                            : Findings.sameValue(earlierValue, laterValue);
                    if (!same) {
                        findings.add(Findings.of(group,
                                rent ? ConflictCategory.RENT_CONFLICT : ConflictCategory.TERM_CONFLICT, entry.getKey(),
                                earlier.getAmendmentId(), earlierValue,
                                later.getAmendmentId(), laterValue,
                                String.format("Amendments %s and %s set %s differently for overlapping periods from %s",
                                        earlier.getAmendmentId(), later.getAmendmentId(), entry.getKey(), laterEffective)));
                    }
                }
            }
        }
    }
}
