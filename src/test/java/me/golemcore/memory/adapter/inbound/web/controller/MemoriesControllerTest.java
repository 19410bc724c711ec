package me.golemcore.memory.adapter.inbound.web.controller;

import me.golemcore.memory.domain.exception.InvalidMemoryArgumentException;
import me.golemcore.memory.domain.exception.MemoryNotFoundException;
import me.golemcore.memory.domain.model.BatchAction;
import me.golemcore.memory.domain.model.BatchCommand;
import me.golemcore.memory.domain.model.BatchResult;
import me.golemcore.memory.domain.model.ConflictStrategy;
import me.golemcore.memory.domain.model.DuplicateWarning;
import me.golemcore.memory.domain.model.Memory;
import me.golemcore.memory.domain.model.MemoryHealth;
import me.golemcore.memory.domain.model.MemoryScope;
import me.golemcore.memory.domain.model.ProjectRef;
import me.golemcore.memory.domain.model.QuotaSnapshot;
import me.golemcore.memory.domain.model.SafeStoreResult;
import me.golemcore.memory.domain.model.StoreCommand;
import me.golemcore.memory.domain.model.StoreResult;
import me.golemcore.memory.domain.service.ConflictResolutionService;
import me.golemcore.memory.domain.service.DuplicateDetectionService;
import me.golemcore.memory.domain.service.MemoryQuotaService;
import me.golemcore.memory.domain.service.MemoryRecordService;
import me.golemcore.memory.domain.service.MemoryScoringService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoriesControllerTest {

    private static final Instant NOW = Instant.parse("2026-02-10T09:00:00Z");
    private static final ProjectRef PROJECT = new ProjectRef("org-1", "proj-1");

    private MemoryRecordService recordService;
    private ConflictResolutionService conflictResolutionService;
    private DuplicateDetectionService duplicateDetectionService;
    private MemoryQuotaService quotaService;
    private MemoryScoringService scoringService;
    private MemoriesController controller;

    @BeforeEach
    void setUp() {
        recordService = mock(MemoryRecordService.class);
        conflictResolutionService = mock(ConflictResolutionService.class);
        duplicateDetectionService = mock(DuplicateDetectionService.class);
        quotaService = mock(MemoryQuotaService.class);
        scoringService = mock(MemoryScoringService.class);
        controller = new MemoriesController(recordService, conflictResolutionService, duplicateDetectionService,
                quotaService, scoringService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void storeShouldReturnCreatedWithEtagAndDuplicateWarning() {
        Memory memory = memory("db/schema", 1);
        when(recordService.find(PROJECT, "db/schema")).thenReturn(Optional.empty());
        when(duplicateDetectionService.findSimilar(PROJECT, "db/schema", "users table"))
                .thenReturn(Optional.of(new DuplicateWarning("db/tables", 0.95)));
        when(recordService.store(eq(PROJECT), any(StoreCommand.class))).thenReturn(StoreResult.builder()
                .memory(memory).created(true).version(1).quota(QuotaSnapshot.builder().projectUsed(1).build())
                .build());

        StepVerifier.create(controller.store("org-1", "proj-1", "agent-7", new MemoriesController.StoreMemoryRequest(
                "db/schema", "users table", Map.of("source", "agent"), 40, Set.of("db"), null, "project")))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.CREATED, resp.getStatusCode());
                    assertEquals("\"1\"", resp.getHeaders().getETag());
                    MemoriesController.StoreMemoryResponse body = resp.getBody();
                    assertNotNull(body);
                    assertTrue(body.created());
                    assertEquals("db/tables", body.duplicateWarning().similarKey());
                })
                .verifyComplete();

        ArgumentCaptor<StoreCommand> captor = ArgumentCaptor.forClass(StoreCommand.class);
        verify(recordService).store(eq(PROJECT), captor.capture());
        assertEquals("agent-7", captor.getValue().getActorId());
        assertEquals(40, captor.getValue().getPriority());
    }

    @Test
    void storeOfExistingKeyShouldSkipDuplicateCheckAndReturnOk() {
        Memory memory = memory("k", 3);
        when(recordService.find(PROJECT, "k")).thenReturn(Optional.of(memory));
        when(recordService.store(eq(PROJECT), any(StoreCommand.class)))
                .thenReturn(StoreResult.builder().memory(memory).created(false).version(3).build());

        StepVerifier.create(controller.store("org-1", "proj-1", null,
                new MemoriesController.StoreMemoryRequest("k", "v", null, null, null, null, null)))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.OK, resp.getStatusCode());
                    assertEquals("\"3\"", resp.getHeaders().getETag());
                    assertNull(resp.getBody().duplicateWarning());
                })
                .verifyComplete();

        verify(duplicateDetectionService, never()).findSimilar(any(), any(), any());
    }

    @Test
    void storeWithoutOrgShouldFailValidation() {
        StepVerifier.create(controller.store(" ", "proj-1", null,
                new MemoriesController.StoreMemoryRequest("k", "v", null, null, null, null, null)))
                .expectError(InvalidMemoryArgumentException.class)
                .verify();
    }

    @Test
    void safeStoreShouldReturnConflictWhenNothingStored() {
        SafeStoreResult rejected = SafeStoreResult.builder()
                .key("k").conflict(true).stored(false).strategy(ConflictStrategy.REJECT).build();
        when(conflictResolutionService.storeSafe(eq(PROJECT), any(StoreCommand.class), eq(NOW),
                eq(ConflictStrategy.REJECT))).thenReturn(rejected);

        StepVerifier.create(controller.storeSafe("org-1", "proj-1", null, new MemoriesController.SafeStoreRequest(
                "k", "v", null, null, null, null, null, NOW, null)))
                .assertNext(resp -> assertEquals(HttpStatus.CONFLICT, resp.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void safeStoreShouldReturnOkWhenStored() {
        SafeStoreResult appended = SafeStoreResult.builder()
                .key("k").conflict(true).stored(true).strategy(ConflictStrategy.APPEND).build();
        when(conflictResolutionService.storeSafe(eq(PROJECT), any(StoreCommand.class), eq(NOW),
                eq(ConflictStrategy.APPEND))).thenReturn(appended);

        StepVerifier.create(controller.storeSafe("org-1", "proj-1", null, new MemoriesController.SafeStoreRequest(
                "k", "v", null, null, null, null, null, NOW, "append")))
                .assertNext(resp -> assertEquals(HttpStatus.OK, resp.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void getShouldReturnMemoryWithEtag() {
        when(recordService.get(PROJECT, "a/b/c", false)).thenReturn(memory("a/b/c", 7));

        StepVerifier.create(controller.get("org-1", "proj-1", "a/b/c", false))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.OK, resp.getStatusCode());
                    assertEquals("\"7\"", resp.getHeaders().getETag());
                    assertEquals("a/b/c", resp.getBody().getKey());
                })
                .verifyComplete();
    }

    @Test
    void getShouldPropagateNotFound() {
        when(recordService.get(PROJECT, "missing", false)).thenThrow(new MemoryNotFoundException("missing"));

        StepVerifier.create(controller.get("org-1", "proj-1", "missing", false))
                .expectError(MemoryNotFoundException.class)
                .verify();
    }

    @Test
    void updateShouldPassRevisionFromIfMatch() {
        Memory updated = memory("k", 5);
        when(recordService.updateIfMatch(eq(PROJECT), eq(4L), any(StoreCommand.class)))
                .thenReturn(StoreResult.builder().memory(updated).version(2).build());

        StepVerifier.create(controller.update("org-1", "proj-1", null, "W/\"4\"", "k",
                new MemoriesController.UpdateMemoryRequest("v2", null, null, null, null, null)))
                .assertNext(resp -> assertEquals("\"5\"", resp.getHeaders().getETag()))
                .verifyComplete();
    }

    @Test
    void deleteShouldBeConditionalOnlyWithIfMatch() {
        StepVerifier.create(controller.delete("org-1", "proj-1", "agent", null, "k"))
                .assertNext(resp -> assertEquals(HttpStatus.NO_CONTENT, resp.getStatusCode()))
                .verifyComplete();
        StepVerifier.create(controller.delete("org-1", "proj-1", "agent", "\"2\"", "k"))
                .assertNext(resp -> assertEquals(HttpStatus.NO_CONTENT, resp.getStatusCode()))
                .verifyComplete();

        verify(recordService).delete(PROJECT, "k", "agent");
        verify(recordService).deleteIfMatch(PROJECT, "k", 2L, "agent");
    }

    @Test
    void rollbackShouldDefaultToOneStepWithoutDeadline() {
        StepVerifier.create(controller.rollback("org-1", "proj-1", null,
                new MemoriesController.RollbackRequest("k", null, null)))
                .assertNext(resp -> assertEquals(HttpStatus.OK, resp.getStatusCode()))
                .verifyComplete();

        verify(recordService).rollback(eq(PROJECT), eq("k"), eq(1), isNull(), isNull());
    }

    @Test
    void diffShouldTurnTimeoutIntoDeadline() {
        StepVerifier.create(controller.diff("org-1", "proj-1", "k", 1, null, 500L))
                .assertNext(resp -> assertEquals(HttpStatus.OK, resp.getStatusCode()))
                .verifyComplete();
        verify(recordService).diff(PROJECT, "k", 1, null, NOW.plusMillis(500));

        StepVerifier.create(controller.diff("org-1", "proj-1", "k", 1, null, 0L))
                .expectError(InvalidMemoryArgumentException.class)
                .verify();
    }

    @Test
    void oversizedTimeoutShouldBeRejectedAsInvalidArgument() {
        StepVerifier.create(controller.diff("org-1", "proj-1", "k", 1, null, Long.MAX_VALUE))
                .expectError(InvalidMemoryArgumentException.class)
                .verify();
        verify(recordService, never()).diff(any(), any(), anyInt(), any(), any());
    }

    @Test
    void healthShouldScoreActiveMemories() {
        List<Memory> active = List.of(memory("a", 1));
        List<MemoryHealth> report = List.of(MemoryHealth.builder().key("a").build());
        when(recordService.list(PROJECT, false, null)).thenReturn(active);
        when(scoringService.report(active, NOW, 10)).thenReturn(report);

        StepVerifier.create(controller.health("org-1", "proj-1", 10))
                .assertNext(resp -> assertEquals(report, resp.getBody()))
                .verifyComplete();
    }

    @Test
    void capacityShouldReturnQuotaSnapshot() {
        QuotaSnapshot snapshot = QuotaSnapshot.builder().projectUsed(3).orgUsed(9).build();
        when(quotaService.snapshot(PROJECT)).thenReturn(snapshot);

        StepVerifier.create(controller.capacity("org-1", "proj-1"))
                .assertNext(resp -> assertEquals(snapshot, resp.getBody()))
                .verifyComplete();
    }

    @Test
    void parseRevisionShouldAcceptQuotedWeakAndBareValues() {
        assertEquals(3L, MemoriesController.parseRevision("\"3\""));
        assertEquals(3L, MemoriesController.parseRevision("W/\"3\""));
        assertEquals(3L, MemoriesController.parseRevision(" 3 "));
        assertThrows(InvalidMemoryArgumentException.class, () -> MemoriesController.parseRevision("\"abc\""));
    }

    @Test
    void batchShouldTypeTheValueByAction() {
        BatchResult expected = new BatchResult(BatchAction.SET_PRIORITY, 2, 2, 2);
        when(recordService.batch(eq(PROJECT), any())).thenReturn(expected);

        StepVerifier.create(controller.batch("org-1", "proj-1", "alice",
                new MemoriesController.BatchRequest(List.of("a", "b"), "set_priority", 70)))
                .assertNext(resp -> assertEquals(expected, resp.getBody()))
                .verifyComplete();

        ArgumentCaptor<BatchCommand> captor = ArgumentCaptor.forClass(BatchCommand.class);
        verify(recordService).batch(eq(PROJECT), captor.capture());
        assertEquals(70, captor.getValue().getPriority());
        assertEquals("alice", captor.getValue().getActorId());
    }

    @Test
    void batchCommandShouldConvertTagsAndScope() {
        BatchCommand tags = MemoriesController.toBatchCommand(
                new MemoriesController.BatchRequest(List.of("a"), "add_tags", List.of("infra", "ci")), null);
        BatchCommand scope = MemoriesController.toBatchCommand(
                new MemoriesController.BatchRequest(List.of("a"), "set_scope", "shared"), null);

        assertEquals(Set.of("infra", "ci"), tags.getTags());
        assertEquals(MemoryScope.SHARED, scope.getScope());
    }

    @Test
    void batchShouldRejectWronglyTypedValueOrUnknownAction() {
        assertThrows(InvalidMemoryArgumentException.class, () -> MemoriesController.toBatchCommand(
                new MemoriesController.BatchRequest(List.of("a"), "set_priority", "high"), null));
        assertThrows(InvalidMemoryArgumentException.class, () -> MemoriesController.toBatchCommand(
                new MemoriesController.BatchRequest(List.of("a"), "add_tags", List.of(1, 2)), null));
        assertThrows(InvalidMemoryArgumentException.class, () -> MemoriesController.toBatchCommand(
                new MemoriesController.BatchRequest(List.of("a"), "set_scope", "global"), null));
        assertThrows(InvalidMemoryArgumentException.class, () -> MemoriesController.toBatchCommand(
                new MemoriesController.BatchRequest(List.of("a"), "tag", null), null));
    }

    private static Memory memory(String key, long revision) {
        return Memory.builder()
                .id("id-" + key)
                .orgId("org-1")
                .projectId("proj-1")
                .key(key)
                .content("content")
                .createdAt(NOW)
                .updatedAt(NOW)
                .revision(revision)
                .build();
    }
}
