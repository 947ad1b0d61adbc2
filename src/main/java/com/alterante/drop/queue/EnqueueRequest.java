package com.alterante.drop.queue;

/**
 * Input to {@link DeliveryQueue#enqueue}. The blob must already be stored.
 */
public record EnqueueRequest(
        String senderPeerId,
        String senderDisplayName,
        String receiverPeerId,
        String blobReference,
        String blobUrl,
        String fileName,
        long fileSize) {
}
