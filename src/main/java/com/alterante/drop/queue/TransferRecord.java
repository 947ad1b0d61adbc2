package com.alterante.drop.queue;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Durable description of a file staged in the blob store for pickup by an
 * unreachable receiver.
 *
 * @param blobReference content address returned by the blob store
 * @param blobUrl       where the receiver fetches the bytes
 * @param deliveredAt   null until the receiver acknowledges
 */
public record TransferRecord(
        String id,
        String senderPeerId,
        String senderDisplayName,
        String receiverPeerId,
        String blobReference,
        String blobUrl,
        String fileName,
        long fileSize,
        TransferStatus status,
        Instant createdAt,
        Instant readyAt,
        Instant deliveredAt) {

    @JsonIgnore
    public boolean isReady() {
        return status == TransferStatus.READY;
    }

    TransferRecord delivered(Instant now) {
        return new TransferRecord(id, senderPeerId, senderDisplayName, receiverPeerId, blobReference, blobUrl,
                fileName, fileSize, TransferStatus.DELIVERED, createdAt, readyAt, now);
    }
}
