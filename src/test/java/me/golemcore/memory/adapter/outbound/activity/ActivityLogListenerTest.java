package me.golemcore.memory.adapter.outbound.activity;

import me.golemcore.memory.domain.model.MemoryChangedEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

class ActivityLogListenerTest {

    private final ActivityLogListener listener = new ActivityLogListener();

    @Test
    void shouldLogEventsWithAndWithoutOptionalFields() {
        Instant now = Instant.parse("2026-02-01T00:00:00Z");

        assertDoesNotThrow(() -> listener.onMemoryChanged(new MemoryChangedEvent(
                MemoryChangedEvent.ChangeKind.UPDATED, "org-1", "proj-1", "k", "agent", 3, now)));
        assertDoesNotThrow(() -> listener.onMemoryChanged(new MemoryChangedEvent(
                MemoryChangedEvent.ChangeKind.DELETED, "org-1", "proj-1", "k", null, null, now)));
    }
}
