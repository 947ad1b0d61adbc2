package com.alterante.drop.store;

import com.alterante.drop.identity.PeerIdentity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileRecordStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void recordsSurviveReopen() {
        Path file = tempDir.resolve("identities.json");
        FileRecordStore<PeerIdentity> store = new FileRecordStore<>(file, PeerIdentity.class);
        store.insertIfAbsent("p1", new PeerIdentity("p1", "Alice", "alice@example.com"));
        store.upsert("p2", current -> new PeerIdentity("p2", "Bob", "bob@example.com"));

        FileRecordStore<PeerIdentity> reopened = new FileRecordStore<>(file, PeerIdentity.class);
        assertEquals(2, reopened.size());
        assertEquals("Alice", reopened.get("p1").orElseThrow().displayName());
        assertEquals("bob@example.com", reopened.get("p2").orElseThrow().contact());
    }

    @Test
    void createsParentDirectories() {
        Path file = tempDir.resolve("nested/dir/store.json");
        FileRecordStore<PeerIdentity> store = new FileRecordStore<>(file, PeerIdentity.class);
        store.insertIfAbsent("p1", new PeerIdentity("p1", "Alice", "a"));

        assertTrue(Files.exists(file));
        assertFalse(Files.exists(file.resolveSibling("store.json.tmp")), "temp snapshot should be moved away");
    }

    @Test
    void unappliedConditionalUpdateDoesNotRewrite() throws Exception {
        Path file = tempDir.resolve("store.json");
        FileRecordStore<PeerIdentity> store = new FileRecordStore<>(file, PeerIdentity.class);
        store.insertIfAbsent("p1", new PeerIdentity("p1", "Alice", "a"));
        String before = Files.readString(file);

        assertTrue(store.updateIf("p1", v -> false, v -> new PeerIdentity("p1", "Mallory", "m")).isEmpty());
        assertEquals(before, Files.readString(file));
    }

    @Test
    void failedWriteKeepsPreviousValue() throws Exception {
        Path file = tempDir.resolve("store.json");
        FileRecordStore<PeerIdentity> store = new FileRecordStore<>(file, PeerIdentity.class);
        store.insertIfAbsent("p1", new PeerIdentity("p1", "Alice", "a"));
        Path blocker = Files.createDirectory(tempDir.resolve("store.json.tmp"));

        assertThrows(UncheckedIOException.class,
                () -> store.update("p1", v -> new PeerIdentity("p1", "Renamed", "a")));
        assertThrows(UncheckedIOException.class,
                () -> store.insertIfAbsent("p2", new PeerIdentity("p2", "Bob", "b")));
        assertEquals("Alice", store.get("p1").orElseThrow().displayName());
        assertTrue(store.get("p2").isEmpty());

        Files.delete(blocker);
        store.update("p1", v -> new PeerIdentity("p1", "Renamed", "a"));

        FileRecordStore<PeerIdentity> reopened = new FileRecordStore<>(file, PeerIdentity.class);
        assertEquals("Renamed", reopened.get("p1").orElseThrow().displayName());
        assertEquals(1, reopened.size());
    }

    @Test
    void corruptFileFailsLoudly() throws Exception {
        Path file = tempDir.resolve("store.json");
        Files.writeString(file, "{not json");
        assertThrows(UncheckedIOException.class, () -> new FileRecordStore<>(file, PeerIdentity.class));
    }
}
