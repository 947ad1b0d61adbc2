package com.alterante.drop.reconcile;

import com.alterante.drop.queue.TransferRecord;

/**
 * Side effect run by the {@link Reconciler} for each READY transfer. The same
 * record can be offered on many sweeps, so implementations must be idempotent.
 */
public interface TransferSubscriber {

    /** Stable name, used to remember which records this subscriber has completed. */
    String name();

    /**
     * @return true once the side effect is observably complete for this record;
     *         false to be offered the record again on the next sweep
     * @throws Exception any failure; logged and retried on the next sweep
     */
    boolean onReady(TransferRecord record) throws Exception;
}
