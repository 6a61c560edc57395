package com.bank.lease.application.service;

import com.bank.lease.application.config.ReconciliationProperties;
import com.bank.lease.domain.cache.CacheService;
import com.bank.lease.domain.model.Document;
import com.bank.lease.domain.registry.DocumentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Content-hash deduplication of ingested documents.
 * Uses cache for fast lookups with the document registry as source of truth.
 */
@Service
public class IdempotencyService {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyService.class);

    private static final String CACHE_KEY_PREFIX = "idempotency:document:";
    private static final String CACHE_STATUS_PROCESSED = "PROCESSED";

    private final DocumentRegistry documentRegistry;
    private final CacheService cacheService;
    private final ReconciliationProperties properties;

    public IdempotencyService(DocumentRegistry documentRegistry, CacheService cacheService,
                              ReconciliationProperties properties) {
        this.documentRegistry = documentRegistry;
        this.cacheService = cacheService;
        this.properties = properties;
    }

    /**
     * Check if content with this hash has already been ingested
     */
    public boolean isProcessed(String contentHash) {
        if (contentHash == null || contentHash.isEmpty()) {
            return false;
        }
        String cacheKey = CACHE_KEY_PREFIX + contentHash;
        if (cacheService.get(cacheKey, String.class).filter(CACHE_STATUS_PROCESSED::equals).isPresent()) {
            log.debug("Content hash {} found in cache as processed", contentHash);
            return true;
        }
        boolean exists = documentRegistry.findDocumentIdByHash(contentHash).isPresent();
        if (exists) {
            cacheService.put(cacheKey, CACHE_STATUS_PROCESSED, properties.getIdempotencyTtl());
        }
        return exists;
    }

    /**
     * Claim the document's content hash for this ingestion.
     * @return false if the same content was already ingested or is being ingested
     */
    public boolean claim(Document document) {
        if (isProcessed(document.getContentHash())) {
            return false;
        }
        boolean claimed = documentRegistry.claim(document.getContentHash(), document.getDocumentId());
        if (!claimed) {
            log.debug("Content hash {} claimed concurrently", document.getContentHash());
        }
        return claimed;
    }

    public void markAsProcessed(Document document) {
        cacheService.put(CACHE_KEY_PREFIX + document.getContentHash(), CACHE_STATUS_PROCESSED,
                properties.getIdempotencyTtl());
        log.debug("Marked document {} as processed (hash {})", document.getDocumentId(), document.getContentHash());
    }

    /**
     * Release the claim so the same content can be ingested again
     */
    public void markAsFailed(Document document, String error) {
        documentRegistry.release(document.getContentHash());
        cacheService.evict(CACHE_KEY_PREFIX + document.getContentHash());
        log.warn("Ingestion of document {} failed, claim released: {}", document.getDocumentId(), error);
    }
}
