package com.alterante.drop.queue;

/**
 * Transfer record lifecycle. Transitions only READY → DELIVERED.
 */
public enum TransferStatus {
    READY,
    DELIVERED
}
