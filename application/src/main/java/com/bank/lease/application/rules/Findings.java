package com.bank.lease.application.rules;

import com.bank.lease.domain.enums.ConflictCategory;
import com.bank.lease.domain.enums.FieldGroup;
import com.bank.lease.domain.model.ChainLink;
import com.bank.lease.domain.model.ConflictRecord;
import com.bank.lease.domain.model.FieldChange;
import com.bank.lease.domain.model.FieldValues;
import com.bank.lease.domain.model.LeaseField;
import com.bank.lease.domain.model.LeaseGroupSnapshot;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Helpers shared by the comparator rules
 */
final class Findings {

    private Findings() {
    }

    /**
     * Raw finding; severity follows the category
     */
    static ConflictRecord of(LeaseGroupSnapshot group, ConflictCategory category, String fieldName,
                             String sourceDocumentId, Object sourceValue,
                             String conflictingDocumentId, Object conflictingValue,
                             String description) {
        return ConflictRecord.builder()
                .leaseId(group.getLeaseId())
                .category(category)
                .severity(category.getSeverity())
                .fieldName(fieldName)
                .sourceDocumentId(sourceDocumentId)
                .sourceValue(FieldValues.render(sourceValue))
                .conflictingDocumentId(conflictingDocumentId)
                .conflictingValue(FieldValues.render(conflictingValue))
                .description(description)
                .build();
    }

    static boolean sameValue(Object a, Object b) {
        if (a instanceof BigDecimal && b instanceof BigDecimal) {
            return ((BigDecimal) a).compareTo((BigDecimal) b) == 0;
        }
        return Objects.equals(a, b);
    }

    static List<ChainLink> appliedLinks(LeaseGroupSnapshot group) {
        List<ChainLink> links = new ArrayList<>();
        for (ChainLink link : group.getChain()) {
            if (link.isApplied()) {
                links.add(link);
            }
        }
        return links;
    }

    /**
     * Prior values an amendment quotes for fields of the given family
     */
    static List<Restatement> restatements(ChainLink link, FieldGroup fieldGroup) {
        List<Restatement> result = new ArrayList<>();
        for (Map.Entry<String, FieldChange> entry : link.getAmendment().getChanges().entrySet()) {
            FieldChange change = entry.getValue();
            if (change == null || !change.hasPriorValue()) {
                continue;
            }
            Optional<LeaseField> field = LeaseField.fromFieldName(entry.getKey());
            if (field.isPresent() && field.get().getGroup() == fieldGroup) {
                result.add(new Restatement(field.get(), change.getPriorValue()));
            }
        }
        return result;
    }

    static final class Restatement {
        final LeaseField field;
        final Object claimedValue;

        Restatement(LeaseField field, Object claimedValue) {
            this.field = field;
            this.claimedValue = claimedValue;
        }
    }
}
