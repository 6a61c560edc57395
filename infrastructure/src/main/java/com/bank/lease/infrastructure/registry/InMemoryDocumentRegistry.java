package com.bank.lease.infrastructure.registry;

import com.bank.lease.domain.model.Document;
import com.bank.lease.domain.registry.DocumentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-local document registry
 */
@Repository
public class InMemoryDocumentRegistry implements DocumentRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentRegistry.class);

    private final Map<String, String> documentIdsByHash = new ConcurrentHashMap<>();
    private final Map<String, Document> documentsById = new ConcurrentHashMap<>();
    private final Set<String> unassigned = ConcurrentHashMap.newKeySet();

    @Override
    public boolean claim(String contentHash, String documentId) {
        String owner = documentIdsByHash.putIfAbsent(contentHash, documentId);
        if (owner != null) {
            log.debug("Content hash {} already claimed by document {}", contentHash, owner);
            return false;
        }
        return true;
    }

    @Override
    public void release(String contentHash) {
        documentIdsByHash.remove(contentHash);
    }

    @Override
    public Optional<String> findDocumentIdByHash(String contentHash) {
        return Optional.ofNullable(documentIdsByHash.get(contentHash));
    }

    @Override
    public void save(Document document) {
        documentsById.put(document.getDocumentId(), document);
    }

    @Override
    public Optional<Document> findById(String documentId) {
        return Optional.ofNullable(documentsById.get(documentId));
    }

    @Override
    public void markUnassigned(String documentId) {
        unassigned.add(documentId);
    }

    @Override
    public void clearUnassigned(String documentId) {
        unassigned.remove(documentId);
    }

    @Override
    public List<Document> findUnassigned() {
        return unassigned.stream()
                .map(documentsById::get)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(Document::getIngestedAt,
                        Comparator.nullsLast(Comparator.<Instant>naturalOrder())))
                .collect(Collectors.toList());
    }
}
