package com.bank.lease.domain.registry;

import com.bank.lease.domain.model.Document;

import java.util.List;
import java.util.Optional;

/**
 * Registry of ingested documents, keyed by id and by content hash
 */
public interface DocumentRegistry {

    /**
     * Atomically claim a content hash for a document.
     * @return true if the hash was unseen and is now owned by documentId
     */
    boolean claim(String contentHash, String documentId);

    /**
     * Give up a claim so the same content can be ingested again
     */
    void release(String contentHash);

    Optional<String> findDocumentIdByHash(String contentHash);

    void save(Document document);

    Optional<Document> findById(String documentId);

    /**
     * Record a document that could not be attached to any lease group
     */
    void markUnassigned(String documentId);

    void clearUnassigned(String documentId);

    List<Document> findUnassigned();
}
