package com.alterante.drop.store;

import com.alterante.drop.util.Json;
import com.fasterxml.jackson.databind.JavaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Record store that keeps its working set in memory and writes a JSON snapshot
 * on every mutation. The snapshot is written to a sibling temp file and moved
 * over the previous one, so a crash leaves either the old or the new snapshot.
 *
 * <p>A mutation becomes visible in memory only after its snapshot is on disk;
 * if the write fails the caller gets the exception and the record keeps its
 * previous value.
 */
public class FileRecordStore<V> extends InMemoryRecordStore<V> {

    private static final Logger log = LoggerFactory.getLogger(FileRecordStore.class);

    private final Path file;
    private final JavaType mapType;
    private final Object writeLock = new Object();
    private Map<String, V> persisted = new LinkedHashMap<>();

    public FileRecordStore(Path file, Class<V> type) {
        this.file = file;
        this.mapType = Json.mapper().getTypeFactory()
                .constructMapType(LinkedHashMap.class, String.class, type);
        load();
    }

    private void load() {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            if (!Files.exists(file)) {
                return;
            }
            Map<String, V> loaded = Json.mapper().readValue(file.toFile(), mapType);
            records.putAll(loaded);
            persisted = new LinkedHashMap<>(loaded);
            log.info("Loaded {} records from {}", loaded.size(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load record store " + file, e);
        }
    }

    @Override
    protected void beforePublish(String key, V next) {
        synchronized (writeLock) {
            // start from the last written snapshot; the live map may lack keys still being published
            Map<String, V> candidate = new LinkedHashMap<>(persisted);
            candidate.put(key, next);
            write(candidate);
            persisted = candidate;
        }
    }

    private void write(Map<String, V> snapshot) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Json.mapper().writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist record store " + file, e);
        }
    }

    public Path file() {
        return file;
    }
}
