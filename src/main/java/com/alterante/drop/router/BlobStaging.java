package com.alterante.drop.router;

import com.alterante.drop.blob.BlobReference;
import com.alterante.drop.blob.BlobStore;
import com.alterante.drop.error.NotFoundException;
import com.alterante.drop.error.UpstreamException;
import com.alterante.drop.error.ValidationException;
import com.alterante.drop.identity.IdentityDirectory;
import com.alterante.drop.identity.PeerIdentity;
import com.alterante.drop.queue.DeliveryQueue;
import com.alterante.drop.queue.EnqueueRequest;
import com.alterante.drop.queue.TransferRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Upload through a {@link BlobStore}, then enqueue.
 */
public class BlobStaging implements OfflineStaging {

    private static final Logger log = LoggerFactory.getLogger(BlobStaging.class);

    private final BlobStore blobs;
    private final DeliveryQueue queue;
    private final IdentityDirectory identities;
    private final Clock clock;

    public BlobStaging(BlobStore blobs, DeliveryQueue queue, IdentityDirectory identities, Clock clock) {
        this.blobs = blobs;
        this.queue = queue;
        this.identities = identities;
        this.clock = clock;
    }

    @Override
    public Outcome.Queued stage(StagingRequest request)
            throws ValidationException, NotFoundException, UpstreamException {
        if (request.fileName() == null || request.fileName().isBlank()) {
            throw new ValidationException("Missing required field: fileName");
        }
        long size;
        try {
            size = Files.size(request.file());
        } catch (IOException e) {
            throw new ValidationException("Unreadable file: " + e.getMessage());
        }
        if (size == 0) {
            throw new ValidationException("File is empty");
        }

        // fail before the upload when the receiver does not exist
        PeerIdentity receiver = identities.find(request.receiverPeerId())
                .orElseThrow(() -> new NotFoundException("Unknown receiver " + request.receiverPeerId()));

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("originalName", request.fileName());
        metadata.put("sender", request.senderPeerId());
        metadata.put("receiver", request.receiverPeerId());
        metadata.put("timestamp", clock.instant().toString());

        BlobReference blob = blobs.upload(request.fileName(), request.file(), metadata);

        TransferRecord record = queue.enqueue(new EnqueueRequest(
                request.senderPeerId(), request.senderDisplayName(), request.receiverPeerId(),
                blob.hash(), blob.url(), request.fileName(), size));
        log.info("Staged {} for {} as {} (blob {})", request.fileName(), request.receiverPeerId(),
                record.id(), blob.hash());
        return new Outcome.Queued(blob.hash(), blob.url(), receiver.displayName(), record.id());
    }
}
