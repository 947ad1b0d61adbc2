package com.alterante.drop.router;

import com.alterante.drop.MutableClock;
import com.alterante.drop.blob.BlobReference;
import com.alterante.drop.blob.BlobStore;
import com.alterante.drop.blob.LocalBlobStore;
import com.alterante.drop.error.NotFoundException;
import com.alterante.drop.error.UpstreamException;
import com.alterante.drop.error.ValidationException;
import com.alterante.drop.identity.PeerIdentity;
import com.alterante.drop.identity.StoreIdentityDirectory;
import com.alterante.drop.queue.DeliveryQueue;
import com.alterante.drop.queue.TransferRecord;
import com.alterante.drop.store.InMemoryRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BlobStagingTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private StoreIdentityDirectory identities;
    private DeliveryQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        identities = new StoreIdentityDirectory(new InMemoryRecordStore<>());
        identities.register(new PeerIdentity("p1", "Alice", "a"));
        identities.register(new PeerIdentity("p2", "Bob", "b"));
        queue = new DeliveryQueue(new InMemoryRecordStore<>(), identities, clock);
    }

    @Test
    void uploadsThenEnqueues() throws Exception {
        LocalBlobStore blobs = new LocalBlobStore(tempDir.resolve("blobs"), "http://localhost:8080");
        BlobStaging staging = new BlobStaging(blobs, queue, identities, clock);
        Path file = Files.writeString(tempDir.resolve("doc.pdf"), "contents");

        Outcome.Queued queued = staging.stage(new StagingRequest("p1", "Alice", "p2", file, "doc.pdf"));

        assertEquals("Bob", queued.receiverDisplayName());
        TransferRecord record = queue.find(queued.transferId()).orElseThrow();
        assertEquals(queued.blobReference(), record.blobReference());
        assertEquals(queued.blobUrl(), record.blobUrl());
        assertEquals(8, record.fileSize());
        assertTrue(blobs.locate(record.blobReference()).isPresent(), "record must point at a stored blob");
    }

    @Test
    void attachesUploadMetadata() throws Exception {
        Map<String, String> seen = new HashMap<>();
        BlobStore capturing = (name, content, metadata) -> {
            seen.putAll(metadata);
            return new BlobReference("h", "u");
        };
        Path file = Files.writeString(tempDir.resolve("doc.pdf"), "x");

        new BlobStaging(capturing, queue, identities, clock)
                .stage(new StagingRequest("p1", "Alice", "p2", file, "doc.pdf"));

        assertEquals("doc.pdf", seen.get("originalName"));
        assertEquals("p1", seen.get("sender"));
        assertEquals("p2", seen.get("receiver"));
        assertEquals("2026-01-01T00:00:00Z", seen.get("timestamp"));
    }

    @Test
    void failedUploadLeavesNoRecord() throws Exception {
        BlobStore failing = (name, content, metadata) -> {
            throw new UpstreamException("storage offline");
        };
        Path file = Files.writeString(tempDir.resolve("doc.pdf"), "x");
        BlobStaging staging = new BlobStaging(failing, queue, identities, clock);

        assertThrows(UpstreamException.class,
                () -> staging.stage(new StagingRequest("p1", "Alice", "p2", file, "doc.pdf")));
        assertEquals(List.of(), queue.listAllPending());
    }

    @Test
    void unknownReceiverCheckedBeforeUpload() throws Exception {
        boolean[] uploaded = {false};
        BlobStore tracking = (name, content, metadata) -> {
            uploaded[0] = true;
            return new BlobReference("h", "u");
        };
        Path file = Files.writeString(tempDir.resolve("doc.pdf"), "x");

        assertThrows(NotFoundException.class, () -> new BlobStaging(tracking, queue, identities, clock)
                .stage(new StagingRequest("p1", "Alice", "ghost", file, "doc.pdf")));
        assertFalse(uploaded[0]);
    }

    @Test
    void emptyFileRejected() throws Exception {
        Path file = Files.createFile(tempDir.resolve("empty.txt"));
        BlobStaging staging = new BlobStaging(new LocalBlobStore(tempDir.resolve("blobs"), "http://x"),
                queue, identities, clock);

        assertThrows(ValidationException.class,
                () -> staging.stage(new StagingRequest("p1", "Alice", "p2", file, "empty.txt")));
    }
}
