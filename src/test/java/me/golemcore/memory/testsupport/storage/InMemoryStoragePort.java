package me.golemcore.memory.testsupport.storage;

import me.golemcore.memory.port.outbound.StoragePort;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * StoragePort backed by a map, with a switch to make writes fail.
 */
public class InMemoryStoragePort implements StoragePort {

    private final Map<String, String> files = new ConcurrentHashMap<>();
    private final AtomicInteger writes = new AtomicInteger();
    private volatile boolean failWrites;

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.completedFuture(files.get(directory + "/" + path));
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        if (failWrites) {
            return CompletableFuture.failedFuture(new IllegalStateException("disk full"));
        }
        files.put(directory + "/" + path, content);
        writes.incrementAndGet();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        files.remove(directory + "/" + path);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        String dirPrefix = directory + "/";
        String namePrefix = prefix != null ? prefix : "";
        List<String> names = files.keySet().stream()
                .filter(name -> name.startsWith(dirPrefix))
                .map(name -> name.substring(dirPrefix.length()))
                .filter(name -> name.startsWith(namePrefix))
                .sorted()
                .toList();
        return CompletableFuture.completedFuture(names);
    }

    public void setFailWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }

    public int getWriteCount() {
        return writes.get();
    }

    public String read(String directory, String path) {
        return files.get(directory + "/" + path);
    }

    public void write(String directory, String path, String content) {
        files.put(directory + "/" + path, content);
    }
}
