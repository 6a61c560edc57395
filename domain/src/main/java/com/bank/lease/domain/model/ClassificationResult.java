package com.bank.lease.domain.model;

import com.bank.lease.domain.enums.DocumentType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of the external document classifier
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ClassificationResult {
    private DocumentType documentType;
    private double confidence;
    private String reasoning;
    private List<String> keyIndicators;
    private boolean needsReview; // advisory only
    private boolean failed;
}
