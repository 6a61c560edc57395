package com.bank.lease.infrastructure.registry;

import com.bank.lease.domain.model.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDocumentRegistryTest {

    private InMemoryDocumentRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryDocumentRegistry();
    }

    @Test
    void testClaimIsExclusive() {
        assertTrue(registry.claim("hash-1", "DOC-1"));
        assertFalse(registry.claim("hash-1", "DOC-2"));
        assertEquals("DOC-1", registry.findDocumentIdByHash("hash-1").orElse(null));
    }

    @Test
    void testReleaseAllowsNewClaim() {
        registry.claim("hash-1", "DOC-1");
        registry.release("hash-1");

        assertTrue(registry.findDocumentIdByHash("hash-1").isEmpty());
        assertTrue(registry.claim("hash-1", "DOC-2"));
    }

    @Test
    void testUnassignedDocumentsInIngestionOrder() {
        Instant now = Instant.now();
        registry.save(Document.builder().documentId("DOC-2").ingestedAt(now.plusSeconds(5)).build());
        registry.save(Document.builder().documentId("DOC-1").ingestedAt(now).build());
        registry.save(Document.builder().documentId("DOC-3").ingestedAt(now).build());
        registry.markUnassigned("DOC-2");
        registry.markUnassigned("DOC-1");
        registry.markUnassigned("DOC-3");

        registry.clearUnassigned("DOC-3");

        List<String> ids = registry.findUnassigned().stream()
                .map(Document::getDocumentId)
                .collect(Collectors.toList());
        assertEquals(List.of("DOC-1", "DOC-2"), ids);
        assertTrue(registry.findById("DOC-3").isPresent());
    }
}
