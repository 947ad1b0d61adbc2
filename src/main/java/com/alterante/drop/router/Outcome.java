package com.alterante.drop.router;

/**
 * Result of {@link TransferRouter#send}. Establishment failures other than an
 * unreachable peer are thrown, not returned.
 */
public sealed interface Outcome {

    /** The receiver confirmed the file over a live channel. */
    record DeliveredLive(String receiverPeerId, String fileName, long fileSize) implements Outcome {
    }

    /** The file was staged for later pickup. */
    record Queued(String blobReference, String blobUrl, String receiverDisplayName,
                  String transferId) implements Outcome {
    }

    /** Nothing was delivered and nothing was queued. */
    record TransferFailed(String reason) implements Outcome {
    }
}
