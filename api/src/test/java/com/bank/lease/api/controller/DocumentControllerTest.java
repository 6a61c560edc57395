package com.bank.lease.api.controller;

import com.bank.lease.api.filter.CorrelationIdFilter;
import com.bank.lease.application.config.JacksonConfig;
import com.bank.lease.application.service.CorrelationIdService;
import com.bank.lease.application.service.IngestionCoordinator;
import com.bank.lease.domain.enums.ConflictCategory;
import com.bank.lease.domain.enums.ConflictStatus;
import com.bank.lease.domain.enums.DocumentType;
import com.bank.lease.domain.exception.CandidateValidationException;
import com.bank.lease.domain.exception.UnknownLeaseException;
import com.bank.lease.domain.model.ConflictRecord;
import com.bank.lease.domain.model.Document;
import com.bank.lease.domain.model.IngestionRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DocumentController.class)
@Import({CorrelationIdService.class, JacksonConfig.class})
class DocumentControllerTest {

    private static final String AMENDMENT_JSON = """
            {
              "document": {
                "document_id": "AMD-1",
                "file_name": "amendment-1.pdf",
                "declared_type": "amendment",
                "classification_confidence": 0.92,
                "content_hash": "3f2a"
              },
              "candidate": {
                "amendment": {
                  "target_lease_id": "LEASE-001",
                  "supersedes_document_id": "LEASE-001",
                  "effective_date": "2024-06-01",
                  "changes": {
                    "base_rent_monthly": { "prior_value": "10500.00" }
                  }
                }
              }
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private IngestionCoordinator ingestionCoordinator;

    @Test
    void testIngestReturnsNewConflicts() throws Exception {
        ConflictRecord conflict = ConflictRecord.builder()
                .conflictId("C-1")
                .leaseId("LEASE-001")
                .category(ConflictCategory.RENT_CONFLICT)
                .severity(ConflictCategory.RENT_CONFLICT.getSeverity())
                .fieldName("base_rent_monthly")
                .sourceDocumentId("LEASE-001")
                .sourceValue("10000.00")
                .conflictingDocumentId("AMD-1")
                .conflictingValue("10500.00")
                .status(ConflictStatus.OPEN)
                .build();
        when(ingestionCoordinator.ingest(any(IngestionRequest.class))).thenReturn(List.of(conflict));

        mockMvc.perform(post("/api/documents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(CorrelationIdFilter.CORRELATION_ID_HEADER, "corr-123")
                        .content(AMENDMENT_JSON))
                .andExpect(status().isOk())
                .andExpect(header().string(CorrelationIdFilter.CORRELATION_ID_HEADER, "corr-123"))
                .andExpect(jsonPath("$.document_id").value("AMD-1"))
                .andExpect(jsonPath("$.new_conflict_count").value(1))
                .andExpect(jsonPath("$.new_conflicts[0].category").value("rent_conflict"))
                .andExpect(jsonPath("$.new_conflicts[0].source_value").value("10000.00"))
                .andExpect(jsonPath("$.new_conflicts[0].status").value("open"));
    }

    @Test
    void testValidationFailureIsBadRequest() throws Exception {
        when(ingestionCoordinator.ingest(any(IngestionRequest.class)))
                .thenThrow(new CandidateValidationException(List.of("Content hash is required")));

        mockMvc.perform(post("/api/documents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(AMENDMENT_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(header().exists(CorrelationIdFilter.CORRELATION_ID_HEADER))
                .andExpect(jsonPath("$.errors[0]").value("Content hash is required"));
    }

    @Test
    void testAmendmentForUnknownLeaseIsNotFound() throws Exception {
        when(ingestionCoordinator.ingest(any(IngestionRequest.class)))
                .thenThrow(new UnknownLeaseException("LEASE-001"));

        mockMvc.perform(post("/api/documents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(AMENDMENT_JSON))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.leaseId").value("LEASE-001"));
    }

    @Test
    void testUnassignedDocuments() throws Exception {
        when(ingestionCoordinator.unassignedDocuments()).thenReturn(List.of(Document.builder()
                .documentId("DOC-9")
                .declaredType(DocumentType.OTHER)
                .needsReview(true)
                .build()));

        mockMvc.perform(get("/api/documents/unassigned"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].document_id").value("DOC-9"))
                .andExpect(jsonPath("$[0].declared_type").value("other"));
    }
}
