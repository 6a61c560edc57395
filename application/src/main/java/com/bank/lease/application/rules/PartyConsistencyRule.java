package com.bank.lease.application.rules;

import com.bank.lease.domain.enums.ConflictCategory;
import com.bank.lease.domain.enums.FieldGroup;
import com.bank.lease.domain.model.Amendment;
import com.bank.lease.domain.model.ChainLink;
import com.bank.lease.domain.model.ConflictRecord;
import com.bank.lease.domain.model.FieldChange;
import com.bank.lease.domain.model.LeaseField;
import com.bank.lease.domain.model.LeaseGroupSnapshot;
import com.bank.lease.domain.normalize.NameNormalizer;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * compare_parties: tenant and landlord named on an amendment, or quoted as prior parties,
 * must be the parties in force. An amendment that itself replaces a party may name either one.
 */
@Component
@Order(3)
public class PartyConsistencyRule implements ConflictRule {

    @Override
    public String name() {
        return "compare_parties";
    }

    @Override
    public List<ConflictRecord> evaluate(LeaseGroupSnapshot group) {
        List<ConflictRecord> findings = new ArrayList<>();
        for (ChainLink link : Findings.appliedLinks(group)) {
            Amendment amendment = link.getAmendment();
            checkNamedParty(group, link, LeaseField.TENANT, amendment.getTenantName(), findings);
            checkNamedParty(group, link, LeaseField.LANDLORD, amendment.getLandlordName(), findings);

            for (Findings.Restatement restatement : Findings.restatements(link, FieldGroup.PARTY)) {
                String inForce = (String) restatement.field.read(link.getStateBefore());
                String claimed = restatement.claimedValue.toString();
                if (inForce != null && !NameNormalizer.sameParty(inForce, claimed)) {
                    findings.add(mismatch(group, link, restatement.field, inForce, claimed,
                            String.format("Amendment %s states prior %s '%s' but '%s' was in force",
                                    amendment.getAmendmentId(), restatement.field.getFieldName(), claimed, inForce)));
                }
            }
        }
        return findings;
    }

    private void checkNamedParty(LeaseGroupSnapshot group, ChainLink link, LeaseField field, String named,
                                 List<ConflictRecord> findings) {
        if (named == null || named.isBlank()) {
            return;
        }
        String before = (String) field.read(link.getStateBefore());
        if (before == null || NameNormalizer.sameParty(named, before)) {
            return;
        }
        FieldChange change = link.getAmendment().getChanges().get(field.getFieldName());
        if (change != null && change.isAuthoritative()) {
            String after = (String) field.read(link.getStateAfter());
            if (NameNormalizer.sameParty(named, after)) {
                return;
            }
        }
        findings.add(mismatch(group, link, field, before, named,
                String.format("Amendment %s names %s '%s' but the lease %s is '%s'",
                        link.getAmendment().getAmendmentId(), field.getFieldName(), named, field.getFieldName(), before)));
    }

    private ConflictRecord mismatch(LeaseGroupSnapshot group, ChainLink link, LeaseField field,
                                    String inForce, String claimed, String description) {
        return Findings.of(group, ConflictCategory.PARTY_CONFLICT, field.getFieldName(),
                link.sourceOf(field.getFieldName(), group.getLeaseId()), inForce,
                link.getAmendment().getAmendmentId(), claimed,
                description);
    }
}
