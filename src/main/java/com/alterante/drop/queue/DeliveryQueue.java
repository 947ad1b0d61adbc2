package com.alterante.drop.queue;

import com.alterante.drop.error.NotFoundException;
import com.alterante.drop.error.UnauthorizedException;
import com.alterante.drop.error.ValidationException;
import com.alterante.drop.identity.IdentityDirectory;
import com.alterante.drop.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns transfer records and their status machine.
 *
 * <p>Records are created READY: {@link #enqueue} is only called after the blob
 * upload has completed, so every record points at a stored blob. Delivery is a
 * conditional update from READY, which makes repeated or concurrent
 * acknowledgments harmless.
 */
public class DeliveryQueue {

    private static final Logger log = LoggerFactory.getLogger(DeliveryQueue.class);

    private static final Comparator<TransferRecord> NEWEST_FIRST =
            Comparator.comparing(TransferRecord::readyAt).reversed()
                    .thenComparing(TransferRecord::id);

    private final RecordStore<TransferRecord> store;
    private final IdentityDirectory identities;
    private final Clock clock;

    public DeliveryQueue(RecordStore<TransferRecord> store, IdentityDirectory identities, Clock clock) {
        this.store = store;
        this.identities = identities;
        this.clock = clock;
    }

    /**
     * Stage a transfer whose blob is already stored.
     *
     * @throws ValidationException if a required field is missing
     * @throws NotFoundException   if the receiver is not a registered identity
     */
    public TransferRecord enqueue(EnqueueRequest request) throws ValidationException, NotFoundException {
        requireText(request.senderPeerId(), "senderPeerId");
        requireText(request.senderDisplayName(), "senderDisplayName");
        requireText(request.receiverPeerId(), "receiverPeerId");
        requireText(request.blobReference(), "blobReference");
        requireText(request.fileName(), "fileName");
        if (request.fileSize() <= 0) {
            throw new ValidationException("fileSize must be positive");
        }
        requireReceiver(request.receiverPeerId());

        Instant now = clock.instant();
        TransferRecord record = new TransferRecord(
                UUID.randomUUID().toString(),
                request.senderPeerId(),
                request.senderDisplayName(),
                request.receiverPeerId(),
                request.blobReference(),
                request.blobUrl(),
                request.fileName(),
                request.fileSize(),
                TransferStatus.READY,
                now,
                now,
                null);
        store.insertIfAbsent(record.id(), record);
        log.info("Queued transfer {} ({}, {} bytes) from {} to {}",
                record.id(), record.fileName(), record.fileSize(), record.senderPeerId(), record.receiverPeerId());
        return record;
    }

    /**
     * Fail with NotFound unless {@code receiverPeerId} is a registered identity.
     */
    public void requireReceiver(String receiverPeerId) throws NotFoundException {
        if (!identities.exists(receiverPeerId)) {
            throw new NotFoundException("Receiver not found: " + receiverPeerId);
        }
    }

    /**
     * READY records for one receiver, newest first. Recomputed on every call.
     */
    public List<TransferRecord> listPending(String receiverPeerId) {
        List<TransferRecord> pending = new ArrayList<>(
                store.query(r -> r.isReady() && r.receiverPeerId().equals(receiverPeerId)));
        pending.sort(NEWEST_FIRST);
        return pending;
    }

    /** READY records for every receiver, newest first. */
    public List<TransferRecord> listAllPending() {
        List<TransferRecord> pending = new ArrayList<>(store.query(TransferRecord::isReady));
        pending.sort(NEWEST_FIRST);
        return pending;
    }

    public Optional<TransferRecord> find(String transferId) {
        if (transferId == null) {
            return Optional.empty();
        }
        return store.get(transferId);
    }

    /**
     * Receiver acknowledgment. A record that is already DELIVERED is returned
     * unchanged, so client retries succeed without touching {@code deliveredAt}.
     *
     * @throws NotFoundException     if no such record exists
     * @throws UnauthorizedException if the requester is not the record's receiver
     */
    public TransferRecord markDelivered(String transferId, String requestingPeerId)
            throws NotFoundException, UnauthorizedException {
        TransferRecord current = find(transferId)
                .orElseThrow(() -> new NotFoundException("Transfer not found: " + transferId));
        if (!current.receiverPeerId().equals(requestingPeerId)) {
            log.warn("Peer {} tried to acknowledge transfer {} addressed to {}",
                    requestingPeerId, transferId, current.receiverPeerId());
            throw new UnauthorizedException("Only the receiver may acknowledge transfer " + transferId);
        }

        Optional<TransferRecord> applied = store.updateIf(transferId, TransferRecord::isReady,
                r -> r.delivered(clock.instant()));
        if (applied.isPresent()) {
            log.info("Transfer {} delivered to {}", transferId, requestingPeerId);
            return applied.get();
        }
        log.debug("Transfer {} already delivered", transferId);
        return store.get(transferId).orElse(current);
    }

    private static void requireText(String value, String field) throws ValidationException {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Missing required field: " + field);
        }
    }
}
