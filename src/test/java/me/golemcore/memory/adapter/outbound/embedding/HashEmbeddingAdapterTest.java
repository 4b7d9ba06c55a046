package me.golemcore.memory.adapter.outbound.embedding;

import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HashEmbeddingAdapterTest {

    private HashEmbeddingAdapter adapter;

    @BeforeEach
    void setUp() {
        MemoryProperties properties = new MemoryProperties();
        properties.getEmbedding().setDimension(32);
        adapter = new HashEmbeddingAdapter(properties);
    }

    @Test
    void shouldProduceUnitVectorsOfConfiguredDimension() throws Exception {
        float[] vector = adapter.embed("User recently moved to Tokyo").get();

        assertEquals(32, vector.length);
        double norm = 0;
        for (float value : vector) {
            norm += value * value;
        }
        assertEquals(1.0, Math.sqrt(norm), 1e-5);
    }

    @Test
    void shouldBeDeterministic() throws Exception {
        assertArrayEquals(adapter.embed("same text").get(), adapter.embed("same text").get());
    }

    @Test
    void shouldRankSimilarTextsCloser() throws Exception {
        float[] base = adapter.embed("User is training for a marathon").get();
        float[] similar = adapter.embed("User is training for a marathon in June").get();
        float[] different = adapter.embed("zzzz").get();

        assertTrue(dot(base, similar) > dot(base, different));
    }

    // unit vectors, so the dot product is the cosine similarity
    private static double dot(float[] a, float[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    @Test
    void shouldReturnZeroVectorForEmptyText() {
        float[] vector = HashEmbeddingAdapter.hash("", 4);

        assertArrayEquals(new float[4], vector);
    }

    @Test
    void shouldFailForNullText() {
        assertThrows(ExecutionException.class, () -> adapter.embed(null).get());
    }

    @Test
    void shouldAlwaysBeAvailable() {
        assertTrue(adapter.isAvailable());
        assertEquals("char-hash", adapter.getModel());
        assertEquals(32, adapter.getDimension());
    }
}
