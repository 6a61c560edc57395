package com.bank.lease.application.rules;

import com.bank.lease.domain.enums.ConflictCategory;
import com.bank.lease.domain.model.Amendment;
import com.bank.lease.domain.model.ChainLink;
import com.bank.lease.domain.model.ConflictRecord;
import com.bank.lease.domain.model.LeaseGroupSnapshot;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * check_superseded: each amendment must name the document immediately before it in the
 * chain (the base lease for the first) as the one it amends
 */
@Component
@Order(5)
public class SupersessionRule implements ConflictRule {

    public static final String FIELD_NAME = "supersedes_document_id";

    @Override
    public String name() {
        return "check_superseded";
    }

    @Override
    public List<ConflictRecord> evaluate(LeaseGroupSnapshot group) {
        List<ConflictRecord> findings = new ArrayList<>();
        for (ChainLink link : Findings.appliedLinks(group)) {
            Amendment amendment = link.getAmendment();
            String expected = link.getPreviousDocumentId();
            String referenced = amendment.getSupersedesDocumentId();
            if (expected.equals(referenced)) {
                continue;
            }
            String description = referenced == null
                    ? String.format("Amendment %s does not reference the document it amends; expected %s",
                            amendment.getAmendmentId(), expected)
                    : String.format("Amendment %s amends %s but the preceding document is %s",
                            amendment.getAmendmentId(), referenced, expected);
            findings.add(Findings.of(group, ConflictCategory.TERM_CONFLICT, FIELD_NAME,
                    expected, expected,
                    amendment.getAmendmentId(), referenced,
                    description));
        }
        return findings;
    }
}
