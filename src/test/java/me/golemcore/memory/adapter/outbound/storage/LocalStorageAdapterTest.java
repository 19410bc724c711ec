package me.golemcore.memory.adapter.outbound.storage;

import me.golemcore.memory.infrastructure.config.MemoryStoreProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String MEMORIES = "memories";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;

    @BeforeEach
    void setUp() {
        MemoryStoreProperties properties = new MemoryStoreProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storage = new LocalStorageAdapter(properties);
        storage.init();
    }

    @Test
    void initCreatesDocumentDirectories() {
        assertTrue(Files.isDirectory(tempDir.resolve("memories")));
        assertTrue(Files.isDirectory(tempDir.resolve("locks")));
    }

    @Test
    void replacedDocumentIsReadBackWithoutStagingFile() throws ExecutionException, InterruptedException {
        storage.putTextAtomic(MEMORIES, "proj-1.json", "{\"a\":1}", false).get();

        assertEquals("{\"a\":1}", storage.getText(MEMORIES, "proj-1.json").get());
        assertFalse(Files.exists(tempDir.resolve("memories/proj-1.json.tmp")));
    }

    @Test
    void missingDocumentReadsAsNull() throws ExecutionException, InterruptedException {
        assertNull(storage.getText(MEMORIES, "absent.json").get());
    }

    @Test
    void backupKeepsPreviousDocument() throws Exception {
        storage.putTextAtomic(MEMORIES, "proj-1.json", "first", true).get();
        storage.putTextAtomic(MEMORIES, "proj-1.json", "second", true).get();

        assertEquals("second", storage.getText(MEMORIES, "proj-1.json").get());
        assertEquals("first", Files.readString(tempDir.resolve("memories/proj-1.json.bak"), StandardCharsets.UTF_8));
    }

    @Test
    void replaceWithoutBackupLeavesNoBakFile() throws ExecutionException, InterruptedException {
        storage.putTextAtomic(MEMORIES, "proj-1.json", "first", false).get();
        storage.putTextAtomic(MEMORIES, "proj-1.json", "second", false).get();

        assertFalse(Files.exists(tempDir.resolve("memories/proj-1.json.bak")));
    }

    @Test
    void deletedDocumentIsGone() throws ExecutionException, InterruptedException {
        storage.putTextAtomic(MEMORIES, "gone.json", "x", false).get();

        storage.deleteObject(MEMORIES, "gone.json").get();

        assertNull(storage.getText(MEMORIES, "gone.json").get());
    }

    @Test
    void listObjectsFiltersByPrefixAndSkipsTempAndBackupFiles() throws Exception {
        storage.putTextAtomic(MEMORIES, "b.json", "x", false).get();
        storage.putTextAtomic(MEMORIES, "a.json", "x", false).get();
        storage.putTextAtomic(MEMORIES, "a.json", "y", true).get();
        Files.writeString(tempDir.resolve("memories/c.json.tmp"), "partial");

        List<String> all = storage.listObjects(MEMORIES, "").get();
        List<String> filtered = storage.listObjects(MEMORIES, "b").get();

        assertEquals(List.of("a.json", "b.json"), all);
        assertEquals(List.of("b.json"), filtered);
    }

    @Test
    void listObjectsOnMissingDirectoryIsEmpty() throws ExecutionException, InterruptedException {
        assertTrue(storage.listObjects("nowhere", "").get().isEmpty());
    }

    @Test
    void pathsEscapingRootAreRejected() {
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> storage.getText(MEMORIES, "../../outside.json").get());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }

    @Test
    void initFailsWhenBasePathIsAFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("not-a-dir"), "x");
        MemoryStoreProperties properties = new MemoryStoreProperties();
        properties.getStorage().getLocal().setBasePath(file.toString());
        LocalStorageAdapter broken = new LocalStorageAdapter(properties);

        assertThrows(UncheckedIOException.class, broken::init);
    }
}
