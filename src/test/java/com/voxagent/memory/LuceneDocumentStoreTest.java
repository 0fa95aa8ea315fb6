package com.voxagent.memory;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LuceneDocumentStoreTest {

    @TempDir
    Path tempDir;

    private LuceneDocumentStore store;

    @BeforeEach
    void setUp() throws IOException {
        // no embedding service: keyword search only
        store = new LuceneDocumentStore(text -> null, tempDir.resolve("index").toString());
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void emptyIndexHasNoCollections() {
        assertFalse(store.hasCollection("hotel"));
        assertTrue(store.search("hotel", "checkout", null, 5).isEmpty());
    }

    @Test
    void findsPassagesWithinCollection() {
        store.add("hotel", "policies.pdf", "Checkout time is eleven in the morning.");
        store.add("hotel", "faq.md", "Breakfast is served from seven until ten.");
        store.add("spa", "spa.md", "The spa checkout desk closes at eight.");

        assertTrue(store.hasCollection("hotel"));
        assertFalse(store.hasCollection("gym"));

        var hits = store.search("hotel", "checkout time", null, 5);
        assertFalse(hits.isEmpty());
        assertEquals("policies.pdf", hits.get(0).source());
        assertTrue(hits.stream().noneMatch(p -> p.source().equals("spa.md")));
    }

    @Test
    void respectsTopK() {
        for (int i = 0; i < 5; i++) store.add("c", "doc" + i, "pool opening hours entry " + i);
        assertEquals(2, store.search("c", "pool hours", null, 2).size());
    }

    @Test
    void vectorSearchFusesWithKeywords() throws IOException {
        var vectorStore = new LuceneDocumentStore(
                text -> text.contains("dog") ? new float[]{1f, 0f} : new float[]{0f, 1f},
                tempDir.resolve("vectors").toString());
        try {
            vectorStore.add("pets", "a.md", "The dog park opens at dawn.");
            vectorStore.add("pets", "b.md", "Cats sleep most of the day.");

            var hits = vectorStore.search("pets", "dog", new float[]{1f, 0f}, 1);
            assertEquals(1, hits.size());
            assertEquals("a.md", hits.get(0).source());
        } finally {
            vectorStore.close();
        }
    }

    @Test
    void reopenedIndexKeepsVectorSearch() throws IOException {
        Embedder embedder = text -> text.contains("dog") ? new float[]{1f, 0f} : new float[]{0f, 1f};
        var path = tempDir.resolve("reopen").toString();
        var first = new LuceneDocumentStore(embedder, path);
        first.add("pets", "a.md", "The dog park opens at dawn.");
        first.add("pets", "b.md", "Cats sleep most of the day.");
        first.close();

        var reopened = new LuceneDocumentStore(embedder, path);
        try {
            var hits = reopened.search("pets", "", new float[]{0f, 1f}, 1);
            assertEquals(1, hits.size());
            assertEquals("b.md", hits.get(0).source());
        } finally {
            reopened.close();
        }
    }
}
