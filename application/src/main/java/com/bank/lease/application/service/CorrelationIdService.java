package com.bank.lease.application.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Manages the correlation id and lease/document context carried in the logging MDC
 */
@Service
public class CorrelationIdService {

    private static final Logger log = LoggerFactory.getLogger(CorrelationIdService.class);

    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String LEASE_ID_KEY = "leaseId";
    public static final String DOCUMENT_ID_KEY = "documentId";

    public String generateCorrelationId() {
        String correlationId = UUID.randomUUID().toString();
        MDC.put(CORRELATION_ID_KEY, correlationId);
        log.debug("Generated correlation ID: {}", correlationId);
        return correlationId;
    }

    public String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY);
    }

    public void setCorrelationId(String correlationId) {
        if (correlationId != null && !correlationId.isEmpty()) {
            MDC.put(CORRELATION_ID_KEY, correlationId);
        }
    }

    public void setDocumentContext(String documentId, String leaseId) {
        if (documentId != null) {
            MDC.put(DOCUMENT_ID_KEY, documentId);
        }
        if (leaseId != null) {
            MDC.put(LEASE_ID_KEY, leaseId);
        }
    }

    public void clearDocumentContext() {
        MDC.remove(DOCUMENT_ID_KEY);
        MDC.remove(LEASE_ID_KEY);
    }

    /**
     * Clear correlation id and document context from MDC
     */
    public void clear() {
        MDC.remove(CORRELATION_ID_KEY);
        clearDocumentContext();
    }
}
