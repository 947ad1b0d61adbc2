package com.alterante.drop.router;

import com.alterante.drop.error.DropException;

/**
 * Stores a file durably and records it for pickup. Implementations must finish
 * the upload before the delivery record is created; a failed upload leaves no
 * record behind.
 */
public interface OfflineStaging {

    Outcome.Queued stage(StagingRequest request) throws DropException;
}
