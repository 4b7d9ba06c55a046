package me.golemcore.memory.domain.service;

import me.golemcore.memory.adapter.outbound.embedding.HashEmbeddingAdapter;
import me.golemcore.memory.adapter.outbound.vector.InMemoryVectorBackendAdapter;
import me.golemcore.memory.domain.exception.MemoryStoreException;
import me.golemcore.memory.domain.model.ChunkMetadata;
import me.golemcore.memory.domain.model.MemoryChunk;
import me.golemcore.memory.domain.model.SearchResult;
import me.golemcore.memory.domain.model.StoredMemory;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.port.outbound.VectorBackendPort;
import me.golemcore.memory.port.outbound.VectorCollection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class VectorMemoryStoreTest {

    private static final String TIMESTAMP = "2026-01-01T12:00:00Z";

    private MemoryProperties properties;
    private InMemoryVectorBackendAdapter backend;
    private MemoryIdGenerator idGenerator;
    private VectorMemoryStore store;

    @BeforeEach
    void setUp() {
        properties = new MemoryProperties();
        properties.getEmbedding().setDimension(64);
        backend = spy(new InMemoryVectorBackendAdapter());
        idGenerator = new MemoryIdGenerator(Clock.fixed(Instant.parse(TIMESTAMP), ZoneOffset.UTC));
        store = new VectorMemoryStore(new HashEmbeddingAdapter(properties), backend, idGenerator, properties);
    }

    private static MemoryChunk chunk(String narrative, String topics) {
        return new MemoryChunk(narrative,
                new ChunkMetadata(TIMESTAMP, FactExtractionService.SOURCE, topics, narrative.length()));
    }

    // ===== Insert and list =====

    @Test
    void storedChunksRoundTripThroughListAll() {
        MemoryChunk tokyo = chunk("User is Brazilian and recently moved to Tokyo.", "brazilian, recently");
        MemoryChunk marathon = chunk("User is training for a marathon in June.", null);

        store.insert(List.of(tokyo, marathon));

        List<StoredMemory> stored = store.listAll();
        assertEquals(2, stored.size());
        assertEquals(tokyo.narrative(), stored.get(0).narrative());
        assertEquals(tokyo.metadata(), stored.get(0).metadata());
        assertEquals(marathon.metadata(), stored.get(1).metadata());
        assertNotEquals(stored.get(0).id(), stored.get(1).id());
        assertTrue(stored.get(0).id().startsWith("chunk_"));
    }

    @Test
    void emptyInsertIsNoOp() {
        store.insert(List.of());
        store.insert(null);

        assertTrue(store.listAll().isEmpty());
        verify(backend, never()).getOrCreateCollection(anyString(), anyInt());
    }

    @Test
    void separateBatchesNeverCollide() {
        store.insert(List.of(chunk("first memory", null)));
        store.insert(List.of(chunk("second memory", null)));

        assertEquals(2, store.listAll().size());
    }

    // ===== Search =====

    @Test
    void searchReturnsAtMostLimitClosestFirst() {
        store.insert(List.of(
                chunk("User loves hiking in the mountains every weekend.", null),
                chunk("User works as a backend engineer writing Java.", null),
                chunk("User has a cat named Miso.", null),
                chunk("User is learning Japanese before a trip.", null)));

        List<SearchResult> results = store.search("User works as a backend engineer writing Java.", 3);

        assertEquals(3, results.size());
        assertEquals("User works as a backend engineer writing Java.", results.get(0).narrative());
        assertEquals(0.0, results.get(0).distance(), 1e-6);
        for (int i = 1; i < results.size(); i++) {
            assertTrue(results.get(i - 1).distance() <= results.get(i).distance());
        }
    }

    @Test
    void searchOnEmptyStoreReturnsNothing() {
        assertTrue(store.search("anything", 3).isEmpty());
    }

    @Test
    void zeroLimitOrBlankQueryReturnsNothing() {
        store.insert(List.of(chunk("User has a cat named Miso.", null)));

        assertTrue(store.search("cat", 0).isEmpty());
        assertTrue(store.search("  ", 3).isEmpty());
    }

    @Test
    void negativeLimitIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.search("cat", -1));
    }

    // ===== Clear =====

    @Test
    void clearIsIdempotent() {
        store.insert(List.of(chunk("first memory", null), chunk("second memory", null)));

        assertEquals(2, store.clear());
        assertEquals(0, store.clear());
        assertTrue(store.listAll().isEmpty());
        assertTrue(store.search("first memory", 3).isEmpty());
    }

    @Test
    void clearRemovesEveryRecordCountedByTheBackend() {
        VectorBackendPort largeBackend = mock(VectorBackendPort.class);
        VectorCollection largeCollection = mock(VectorCollection.class);
        when(largeBackend.getOrCreateCollection(anyString(), anyInt())).thenReturn(largeCollection);
        when(largeCollection.count()).thenReturn(17_000L, 0L);
        VectorMemoryStore largeStore = new VectorMemoryStore(new HashEmbeddingAdapter(properties), largeBackend,
                idGenerator, properties);

        assertEquals(17_000, largeStore.clear());
        assertEquals(0, largeStore.clear());

        verify(largeCollection, times(1)).deleteAll();
        verify(largeCollection, never()).getAll();
    }

    @Test
    void collectionIsResolvedOnce() {
        store.insert(List.of(chunk("first memory", null)));
        store.search("first", 1);
        store.listAll();
        store.clear();

        verify(backend, times(1)).getOrCreateCollection("memories", 64);
    }

    // ===== Failures =====

    @Test
    void embeddingFailureDegradesSearchButFailsInsert() {
        EmbeddingPort failing = mock(EmbeddingPort.class);
        when(failing.getDimension()).thenReturn(64);
        when(failing.embed(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("quota exceeded")));
        VectorMemoryStore failingStore = new VectorMemoryStore(failing, backend, idGenerator, properties);

        assertTrue(failingStore.search("cat", 3).isEmpty());
        List<MemoryChunk> chunks = List.of(chunk("User has a cat named Miso.", null));
        MemoryStoreException error = assertThrows(MemoryStoreException.class, () -> failingStore.insert(chunks));
        assertTrue(error.getMessage().contains("quota exceeded"));
        assertTrue(failingStore.listAll().isEmpty());
    }

    @Test
    void backendWriteFailureIsWrapped() {
        VectorBackendPort brokenBackend = mock(VectorBackendPort.class);
        VectorCollection brokenCollection = mock(VectorCollection.class);
        when(brokenBackend.getOrCreateCollection(anyString(), anyInt())).thenReturn(brokenCollection);
        doThrow(new IllegalStateException("disk full")).when(brokenCollection)
                .add(anyList(), anyList(), anyList(), anyList());
        when(brokenCollection.getAll()).thenThrow(new IllegalStateException("offline"));
        when(brokenCollection.count()).thenThrow(new IllegalStateException("offline"));
        VectorMemoryStore brokenStore = new VectorMemoryStore(new HashEmbeddingAdapter(properties), brokenBackend,
                idGenerator, properties);

        List<MemoryChunk> chunks = List.of(chunk("User has a cat named Miso.", null));
        assertThrows(MemoryStoreException.class, () -> brokenStore.insert(chunks));
        assertThrows(MemoryStoreException.class, brokenStore::clear);
        assertTrue(brokenStore.listAll().isEmpty());
    }
}
