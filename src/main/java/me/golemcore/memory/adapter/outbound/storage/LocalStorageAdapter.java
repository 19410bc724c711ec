package me.golemcore.memory.adapter.outbound.storage;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.infrastructure.config.MemoryStoreProperties;
import me.golemcore.memory.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Keeps project documents as files below {@code memstore.storage.local.base-path}
 * (default {@code ${user.home}/.golemcore/memory-store}), one subdirectory per
 * document kind: {@code memories/} and {@code locks/}.
 *
 * <p>
 * Replacing a document stages the bytes in a {@code .tmp} sibling, forces them
 * to disk and renames the sibling over the target. Staging and backup siblings
 * never show up in listings.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private static final String STAGING_SUFFIX = ".tmp";
    private static final String BACKUP_SUFFIX = ".bak";

    private final MemoryStoreProperties properties;

    private Path root;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getLocal().getBasePath();
        root = Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath()
                .normalize();
        MemoryStoreProperties.DirectoriesProperties directories = properties.getStorage().getDirectories();
        for (String directory : List.of(directories.getMemories(), directories.getLocks())) {
            try {
                Files.createDirectories(root.resolve(directory));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot prepare document directory " + directory + " in " + root, e);
            }
        }
        log.info("[Storage] Documents stored under {}", root);
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = locate(directory, path);
            try {
                return Files.readString(file, StandardCharsets.UTF_8);
            } catch (NoSuchFileException e) {
                return null;
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read document " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return CompletableFuture.runAsync(() -> {
            Path target = locate(directory, path);
            Path staging = sibling(target, STAGING_SUFFIX);
            byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
            try {
                Files.createDirectories(target.getParent());
                writeDurably(staging, bytes);
                if (backup && Files.exists(target)) {
                    Files.copy(target, sibling(target, BACKUP_SUFFIX), StandardCopyOption.REPLACE_EXISTING);
                }
                replace(staging, target);
            } catch (IOException e) {
                discardStaging(staging);
                throw new UncheckedIOException("Cannot replace document " + directory + "/" + path, e);
            }
            log.debug("[Storage] Replaced {}/{}: {} bytes", directory, path, bytes.length);
        });
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        return CompletableFuture.runAsync(() -> {
            try {
                Files.deleteIfExists(locate(directory, path));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot delete document " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        return CompletableFuture.supplyAsync(() -> {
            Path folder = locate(directory, ".");
            if (!Files.isDirectory(folder)) {
                return List.of();
            }
            String wanted = prefix == null ? "" : prefix;
            try (Stream<Path> entries = Files.list(folder)) {
                return entries.filter(Files::isRegularFile)
                        .map(entry -> entry.getFileName().toString())
                        .filter(name -> name.startsWith(wanted) && isDocumentName(name))
                        .sorted()
                        .toList();
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot list documents in " + directory, e);
            }
        });
    }

    private static void writeDurably(Path file, byte[] bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static void replace(Path staging, Path target) throws IOException {
        try {
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] File system refused atomic rename of {}, falling back to plain move", target);
            Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discardStaging(Path staging) {
        try {
            Files.deleteIfExists(staging);
        } catch (IOException e) {
            log.warn("[Storage] Left staging file behind: {}", staging, e);
        }
    }

    private static boolean isDocumentName(String name) {
        return !name.endsWith(STAGING_SUFFIX) && !name.endsWith(BACKUP_SUFFIX);
    }

    private static Path sibling(Path file, String suffix) {
        return file.resolveSibling(file.getFileName() + suffix);
    }

    private Path locate(String directory, String path) {
        Path resolved = root.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes storage root: " + directory + "/" + path);
        }
        return resolved;
    }
}
