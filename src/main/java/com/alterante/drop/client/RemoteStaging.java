package com.alterante.drop.client;

import com.alterante.drop.error.DropException;
import com.alterante.drop.router.OfflineStaging;
import com.alterante.drop.router.Outcome;
import com.alterante.drop.router.StagingRequest;

/**
 * Stages through the server's {@code /api/share/offline}, which uploads and
 * enqueues on the server side.
 */
public class RemoteStaging implements OfflineStaging {

    private final DropClient client;

    public RemoteStaging(DropClient client) {
        this.client = client;
    }

    @Override
    public Outcome.Queued stage(StagingRequest request) throws DropException {
        return client.shareOffline(request.senderPeerId(), request.senderDisplayName(),
                request.receiverPeerId(), request.file(), request.fileName());
    }
}
