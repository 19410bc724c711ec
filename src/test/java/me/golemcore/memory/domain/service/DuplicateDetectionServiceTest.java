package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.model.DuplicateWarning;
import me.golemcore.memory.domain.model.Memory;
import me.golemcore.memory.domain.model.ProjectRef;
import me.golemcore.memory.infrastructure.config.MemoryStoreProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.port.outbound.MemoryRepositoryPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DuplicateDetectionServiceTest {

    private static final ProjectRef PROJECT = new ProjectRef("org-1", "proj-1");
    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    private EmbeddingPort embeddingPort;
    private MemoryRepositoryPort memoryRepository;
    private MemoryStoreProperties properties;
    private DuplicateDetectionService service;

    @BeforeEach
    void setUp() {
        embeddingPort = mock(EmbeddingPort.class);
        memoryRepository = mock(MemoryRepositoryPort.class);
        properties = new MemoryStoreProperties();
        properties.getDedup().setTimeoutMs(200);
        service = new DuplicateDetectionService(embeddingPort, memoryRepository, properties);

        when(embeddingPort.isAvailable()).thenReturn(true);
        when(embeddingPort.cosineSimilarity(any(), any())).thenCallRealMethod();
        when(memoryRepository.findAll("proj-1")).thenReturn(List.of(
                memory("db/schema", "users table has id and email"),
                memory("db/indexes", "index on users.email"),
                memory("new-key", "the key being written")));
    }

    @Test
    void shouldWarnAboutMostSimilarMemory() {
        when(embeddingPort.embedBatch(anyList())).thenReturn(CompletableFuture.completedFuture(List.of(
                new float[] { 1f, 0f }, new float[] { 0.99f, 0.05f }, new float[] { 0f, 1f })));

        Optional<DuplicateWarning> warning = service.findSimilar(PROJECT, "new-key", "users table: id, email");

        assertTrue(warning.isPresent());
        assertEquals("db/schema", warning.get().similarKey());
        assertEquals(0.999, warning.get().similarity());
    }

    @Test
    void shouldExcludeTheKeyBeingWrittenFromCandidates() {
        when(embeddingPort.embedBatch(anyList())).thenAnswer(invocation -> {
            List<String> texts = invocation.getArgument(0);
            assertEquals(3, texts.size());
            assertTrue(texts.stream().noneMatch("the key being written"::equals));
            return CompletableFuture.completedFuture(List.of(
                    new float[] { 1f, 0f }, new float[] { 0f, 1f }, new float[] { 0f, 1f }));
        });

        assertTrue(service.findSimilar(PROJECT, "new-key", "unrelated").isEmpty());
    }

    @Test
    void shouldNotWarnBelowThreshold() {
        when(embeddingPort.embedBatch(anyList())).thenReturn(CompletableFuture.completedFuture(List.of(
                new float[] { 1f, 0f }, new float[] { 0.7f, 0.7f }, new float[] { 0f, 1f })));

        assertTrue(service.findSimilar(PROJECT, "new-key", "text").isEmpty());
    }

    @Test
    void shouldSkipWhenEmbeddingsUnavailable() {
        when(embeddingPort.isAvailable()).thenReturn(false);

        assertTrue(service.findSimilar(PROJECT, "new-key", "text").isEmpty());
        verify(embeddingPort, never()).embedBatch(anyList());
    }

    @Test
    void shouldSkipWhenDisabled() {
        properties.getDedup().setEnabled(false);

        assertTrue(service.findSimilar(PROJECT, "new-key", "text").isEmpty());
        verify(memoryRepository, never()).findAll(any());
    }

    @Test
    void shouldSkipWhenEmbeddingFails() {
        when(embeddingPort.embedBatch(anyList()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("rate limited")));

        assertTrue(service.findSimilar(PROJECT, "new-key", "text").isEmpty());
    }

    @Test
    void shouldSkipWhenEmbeddingTimesOut() {
        when(embeddingPort.embedBatch(anyList())).thenReturn(new CompletableFuture<>());

        assertTrue(service.findSimilar(PROJECT, "new-key", "text").isEmpty());
    }

    @Test
    void shouldSkipWhenEmbeddingCountDoesNotMatch() {
        when(embeddingPort.embedBatch(anyList()))
                .thenReturn(CompletableFuture.completedFuture(List.of(new float[] { 1f, 0f })));

        assertTrue(service.findSimilar(PROJECT, "new-key", "text").isEmpty());
    }

    private static Memory memory(String key, String content) {
        return Memory.builder()
                .id("id-" + key)
                .orgId("org-1")
                .projectId("proj-1")
                .key(key)
                .content(content)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }
}
