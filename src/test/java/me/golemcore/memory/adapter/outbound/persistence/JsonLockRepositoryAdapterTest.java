package me.golemcore.memory.adapter.outbound.persistence;

import me.golemcore.memory.domain.model.LockResult;
import me.golemcore.memory.domain.model.MemoryLock;
import me.golemcore.memory.infrastructure.config.AppConfiguration;
import me.golemcore.memory.infrastructure.config.MemoryStoreProperties;
import me.golemcore.memory.testsupport.storage.InMemoryStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonLockRepositoryAdapterTest {

    private static final Instant NOW = Instant.parse("2026-02-01T10:00:00Z");

    private InMemoryStoragePort storage;
    private JsonLockRepositoryAdapter repository;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStoragePort();
        repository = new JsonLockRepositoryAdapter(storage, AppConfiguration.objectMapper(),
                new MemoryStoreProperties());
    }

    @Test
    void shouldAcquireFreeLock() {
        LockResult result = repository.tryAcquire("proj-1", "k", "alice", NOW, NOW.plusSeconds(60));

        assertTrue(result.acquired());
        assertEquals("alice", result.lock().getLockedBy());
        assertEquals(NOW.plusSeconds(60), result.lock().getExpiresAt());
        assertNotNullId(result.lock());
        assertNotNullId(repository.find("proj-1", "k").orElseThrow());
        assertTrue(storage.read("locks", "proj-1.json").contains("alice"));
    }

    @Test
    void shouldReportLiveLockAsHeld() {
        repository.tryAcquire("proj-1", "k", "alice", NOW, NOW.plusSeconds(60));

        LockResult second = repository.tryAcquire("proj-1", "k", "bob", NOW.plusSeconds(30), NOW.plusSeconds(90));

        assertFalse(second.acquired());
        assertEquals("alice", second.lock().getLockedBy());
    }

    @Test
    void shouldReplaceExpiredLock() {
        LockResult first = repository.tryAcquire("proj-1", "k", "alice", NOW, NOW.plusSeconds(60));

        LockResult second = repository.tryAcquire("proj-1", "k", "bob", NOW.plusSeconds(61), NOW.plusSeconds(121));

        assertTrue(second.acquired());
        assertNotEquals(first.lock().getId(), second.lock().getId());
        assertEquals("bob", repository.find("proj-1", "k").orElseThrow().getLockedBy());
    }

    @Test
    void shouldTreatLockAsLiveAtItsExpiryInstant() {
        repository.tryAcquire("proj-1", "k", "alice", NOW, NOW.plusSeconds(60));

        assertFalse(repository.tryAcquire("proj-1", "k", "bob", NOW.plusSeconds(60), NOW.plusSeconds(120))
                .acquired());
    }

    @Test
    void shouldDeleteOnlyMatchingLockId() {
        MemoryLock lock = repository.tryAcquire("proj-1", "k", "alice", NOW, NOW.plusSeconds(60)).lock();

        assertFalse(repository.delete("proj-1", "k", "stale-id"));
        assertTrue(repository.delete("proj-1", "k", lock.getId()));
        assertTrue(repository.find("proj-1", "k").isEmpty());
    }

    @Test
    void shouldDeleteExpiredLocksOnly() {
        repository.tryAcquire("proj-1", "old", "alice", NOW.minusSeconds(120), NOW.minusSeconds(60));
        repository.tryAcquire("proj-1", "live", "alice", NOW, NOW.plusSeconds(60));
        int writesBefore = storage.getWriteCount();

        assertEquals(1, repository.deleteExpired("proj-1", NOW));
        assertEquals(0, repository.deleteExpired("proj-1", NOW));
        assertEquals(writesBefore + 1, storage.getWriteCount());
        assertTrue(repository.find("proj-1", "live").isPresent());
    }

    @Test
    void shouldGrantLockToExactlyOneConcurrentCaller() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<LockResult>> attempts = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                String holder = "agent-" + i;
                attempts.add(() -> repository.tryAcquire("proj-1", "k", holder, NOW, NOW.plusSeconds(60)));
            }
            int acquired = 0;
            for (Future<LockResult> future : executor.invokeAll(attempts)) {
                if (future.get().acquired()) {
                    acquired++;
                }
            }
            assertEquals(1, acquired);
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        }
    }

    private static void assertNotNullId(MemoryLock lock) {
        assertFalse(lock.getId() == null || lock.getId().isBlank());
    }
}
