package me.golemcore.memory.adapter.outbound.embedding;

import me.golemcore.memory.infrastructure.config.MemoryStoreProperties;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Langchain4jEmbeddingAdapterTest {

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        Langchain4jEmbeddingAdapter adapter = new Langchain4jEmbeddingAdapter(new MemoryStoreProperties());

        assertFalse(adapter.isAvailable());
    }

    @Test
    void embedBatchShouldFailWithoutModel() {
        MemoryStoreProperties properties = new MemoryStoreProperties();
        properties.getEmbedding().setApiKey(" ");
        Langchain4jEmbeddingAdapter adapter = new Langchain4jEmbeddingAdapter(properties);

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.embedBatch(List.of("text")).get());
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void shouldBuildModelWhenApiKeyConfigured() {
        MemoryStoreProperties properties = new MemoryStoreProperties();
        properties.getEmbedding().setApiKey("test-key");
        properties.getEmbedding().setBaseUrl("http://localhost:1/v1");

        assertTrue(new Langchain4jEmbeddingAdapter(properties).isAvailable());
    }

    @Test
    void cosineSimilarityShouldHandleZeroAndMismatchedVectors() {
        Langchain4jEmbeddingAdapter adapter = new Langchain4jEmbeddingAdapter(new MemoryStoreProperties());

        assertEquals(1.0, adapter.cosineSimilarity(new float[] { 1f, 2f }, new float[] { 2f, 4f }), 1e-6);
        assertEquals(0.0, adapter.cosineSimilarity(new float[] { 0f, 0f }, new float[] { 1f, 0f }));
        assertThrows(IllegalArgumentException.class,
                () -> adapter.cosineSimilarity(new float[] { 1f }, new float[] { 1f, 0f }));
    }
}
