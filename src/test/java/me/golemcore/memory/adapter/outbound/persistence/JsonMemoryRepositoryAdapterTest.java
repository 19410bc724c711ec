package me.golemcore.memory.adapter.outbound.persistence;

import me.golemcore.memory.domain.model.AccessTally;
import me.golemcore.memory.domain.model.Memory;
import me.golemcore.memory.domain.model.MemoryVersion;
import me.golemcore.memory.infrastructure.config.AppConfiguration;
import me.golemcore.memory.infrastructure.config.MemoryStoreProperties;
import me.golemcore.memory.testsupport.storage.InMemoryStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonMemoryRepositoryAdapterTest {

    private static final Instant NOW = Instant.parse("2026-02-01T10:00:00Z");

    private InMemoryStoragePort storage;
    private MemoryStoreProperties properties;
    private JsonMemoryRepositoryAdapter repository;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStoragePort();
        properties = new MemoryStoreProperties();
        repository = newRepository();
    }

    @Test
    void shouldPersistCommittedTransaction() {
        save(repository, memory("org-1", "proj-1", "k", "v"));

        JsonMemoryRepositoryAdapter reopened = newRepository();

        assertEquals("v", reopened.findByKey("proj-1", "k").orElseThrow().getContent());
        assertNotNull(storage.read("memories", "proj-1.json"));
    }

    @Test
    void shouldNotWriteWhenTransactionChangesNothing() {
        String result = repository.inTransaction("proj-1", tx -> "read-only " + tx.findAll().size());

        assertEquals("read-only 0", result);
        assertEquals(0, storage.getWriteCount());
    }

    @Test
    void shouldLeaveNoTraceWhenTransactionThrows() {
        assertThrows(IllegalStateException.class, () -> repository.inTransaction("proj-1", tx -> {
            tx.save(memory("org-1", "proj-1", "k", "v"));
            throw new IllegalStateException("abort");
        }));

        assertTrue(repository.findAll("proj-1").isEmpty());
        assertEquals(0, storage.getWriteCount());
    }

    @Test
    void shouldKeepCacheUnchangedWhenWriteFails() {
        save(repository, memory("org-1", "proj-1", "k", "v1"));
        storage.setFailWrites(true);

        Memory changed = memory("org-1", "proj-1", "k", "v2");
        assertThrows(IllegalStateException.class, () -> save(repository, changed));

        assertEquals("v1", repository.findByKey("proj-1", "k").orElseThrow().getContent());
    }

    @Test
    void shouldRejectSecondMemoryWithSameKey() {
        save(repository, memory("org-1", "proj-1", "k", "v"));
        Memory clash = memory("org-1", "proj-1", "k", "other");
        clash.setId("another-id");

        assertThrows(IllegalStateException.class, () -> save(repository, clash));
        assertEquals(1, repository.findAll("proj-1").size());
    }

    @Test
    void shouldHandOutCopies() {
        save(repository, memory("org-1", "proj-1", "k", "v"));

        Memory loaded = repository.findByKey("proj-1", "k").orElseThrow();
        loaded.setContent("mutated outside");
        loaded.getTags().add("sneaky");

        Memory reloaded = repository.findByKey("proj-1", "k").orElseThrow();
        assertEquals("v", reloaded.getContent());
        assertFalse(reloaded.getTags().contains("sneaky"));
    }

    @Test
    void shouldServeCachedDocumentUntilInvalidated() {
        save(repository, memory("org-1", "proj-1", "k", "v1"));
        JsonMemoryRepositoryAdapter otherProcess = newRepository();
        save(otherProcess, memory("org-1", "proj-1", "k", "v2"));

        assertEquals("v1", repository.findByKey("proj-1", "k").orElseThrow().getContent());

        repository.invalidate("proj-1");

        assertEquals("v2", repository.findByKey("proj-1", "k").orElseThrow().getContent());
    }

    @Test
    void shouldCountActiveMemoriesAcrossProjectsOfOrg() {
        save(repository, memory("org-1", "proj-a", "one", "x"));
        save(repository, memory("org-1", "proj-a", "two", "x"));
        Memory archived = memory("org-1", "proj-a", "three", "x");
        archived.setArchivedAt(NOW);
        save(repository, archived);
        save(repository, memory("org-1", "proj-b", "one", "x"));
        save(repository, memory("org-2", "proj-c", "one", "x"));

        JsonMemoryRepositoryAdapter reopened = newRepository();

        assertEquals(2, reopened.countActiveByProject("proj-a"));
        assertEquals(3, reopened.countActiveByOrg("org-1"));
        assertEquals(1, reopened.countActiveByOrg("org-2"));
        assertEquals(0, reopened.countActiveByOrg("org-3"));
    }

    @Test
    void shouldEncodeProjectIdInDocumentName() {
        save(repository, memory("org-1", "team/a", "k", "v"));

        assertNotNull(storage.read("memories", "team%2Fa.json"));
        assertEquals(1, newRepository().countActiveByOrg("org-1"));
    }

    @Test
    void shouldFailLoudlyOnCorruptDocument() {
        storage.write("memories", "proj-x.json", "{not json");

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> repository.findAll("proj-x"));
        assertTrue(error.getMessage().contains("proj-x"));
    }

    @Test
    void shouldRecordAccess() {
        save(repository, memory("org-1", "proj-1", "k", "v"));

        assertEquals(1, repository.recordAccesses("proj-1",
                Map.of("k", new AccessTally(3, NOW.plusSeconds(5)), "missing", new AccessTally(1, NOW))));
        assertEquals(1, repository.recordAccesses("proj-1", Map.of("k", new AccessTally(1, NOW.plusSeconds(1)))));
        assertEquals(0, repository.recordAccesses("proj-1", Map.of("missing", new AccessTally(1, NOW))));

        Memory memory = repository.findByKey("proj-1", "k").orElseThrow();
        assertEquals(4, memory.getAccessCount());
        assertEquals(NOW.plusSeconds(5), memory.getLastAccessedAt());
        assertEquals(1, memory.getRevision());
    }

    @Test
    void shouldDeleteVersionsWithMemory() {
        Memory memory = memory("org-1", "proj-1", "k", "v");
        save(repository, memory);
        repository.inTransaction("proj-1", tx -> {
            tx.appendVersion(version(memory.getId(), 1));
            tx.appendVersion(version(memory.getId(), 2));
            return null;
        });

        List<Integer> before = repository.inTransaction("proj-1",
                tx -> tx.versions(memory.getId()).stream().map(MemoryVersion::getVersion).toList());
        boolean deleted = repository.inTransaction("proj-1", tx -> tx.delete(memory.getId()));

        assertEquals(List.of(2, 1), before);
        assertTrue(deleted);
        assertTrue(repository.inTransaction("proj-1", tx -> tx.versions(memory.getId())).isEmpty());
    }

    @Test
    void shouldRejectDuplicateVersionNumbers() {
        Memory memory = memory("org-1", "proj-1", "k", "v");
        save(repository, memory);

        assertThrows(IllegalStateException.class, () -> repository.inTransaction("proj-1", tx -> {
            tx.appendVersion(version(memory.getId(), 1));
            tx.appendVersion(version(memory.getId(), 1));
            return null;
        }));
        assertTrue(repository.inTransaction("proj-1", tx -> tx.versions(memory.getId())).isEmpty());
    }

    private JsonMemoryRepositoryAdapter newRepository() {
        return new JsonMemoryRepositoryAdapter(storage, AppConfiguration.objectMapper(), properties);
    }

    private static void save(JsonMemoryRepositoryAdapter target, Memory memory) {
        target.inTransaction(memory.getProjectId(), tx -> {
            tx.save(memory);
            return null;
        });
    }

    private static Memory memory(String orgId, String projectId, String key, String content) {
        return Memory.builder()
                .id(projectId + ":" + key)
                .orgId(orgId)
                .projectId(projectId)
                .key(key)
                .content(content)
                .createdAt(NOW)
                .updatedAt(NOW)
                .revision(1)
                .build();
    }

    private static MemoryVersion version(String memoryId, int number) {
        return MemoryVersion.builder()
                .memoryId(memoryId)
                .version(number)
                .content("c" + number)
                .changeType(MemoryVersion.ChangeType.UPDATED)
                .createdAt(NOW)
                .build();
    }
}
