package com.bank.lease.domain.model;

import com.bank.lease.domain.enums.ConflictCategory;
import com.bank.lease.domain.enums.ConflictSeverity;
import com.bank.lease.domain.enums.ConflictStatus;
import com.bank.lease.domain.enums.SuggestedResolution;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Objects;

/**
 * Contradiction between two documents' claims about the same fact
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConflictRecord {
    String conflictId;
    String leaseId;
    ConflictCategory category;
    ConflictSeverity severity;
    String fieldName;

    String sourceDocumentId;
    String sourceValue;
    String conflictingDocumentId;
    String conflictingValue;

    String description;
    SuggestedResolution suggestedResolution;
    ConflictStatus status;
    Instant detectedAt;
    Instant resolvedAt;
    String resolutionNote;
    String reopenedFromId;

    /**
     * Identity of the finding across rescans: what was compared, between which documents
     */
    @JsonIgnore
    public String getFingerprint() {
        return String.join("|", category.getCode(), String.valueOf(fieldName),
                String.valueOf(sourceDocumentId), String.valueOf(conflictingDocumentId));
    }

    @JsonIgnore
    public boolean hasSameEvidence(ConflictRecord other) {
        return Objects.equals(sourceValue, other.sourceValue)
                && Objects.equals(conflictingValue, other.conflictingValue);
    }
}
