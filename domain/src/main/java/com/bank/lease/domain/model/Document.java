package com.bank.lease.domain.model;

import com.bank.lease.domain.enums.DocumentType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Ingested document envelope. The content hash is the deduplication key.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Document {
    String documentId;
    String fileName;
    DocumentType declaredType;
    double classificationConfidence;
    Instant ingestedAt;
    String contentHash;
    boolean needsReview;
}
