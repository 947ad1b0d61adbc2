package com.alterante.drop.reconcile;

import com.alterante.drop.net.PresenceServer;
import com.alterante.drop.presence.PresenceTracker;
import com.alterante.drop.protocol.PresencePayloads;
import com.alterante.drop.queue.TransferRecord;

/**
 * Pushes a NOTIFY for a staged transfer to the receiver's presence session.
 * Incomplete until the receiver is reachable and acknowledges.
 */
public class PresenceNotifier implements TransferSubscriber {

    private final PresenceServer server;
    private final PresenceTracker tracker;
    private final long ackTimeoutMs;

    public PresenceNotifier(PresenceServer server, PresenceTracker tracker, long ackTimeoutMs) {
        this.server = server;
        this.tracker = tracker;
        this.ackTimeoutMs = ackTimeoutMs;
    }

    @Override
    public String name() {
        return "presence-notify";
    }

    @Override
    public boolean onReady(TransferRecord record) {
        if (!tracker.isReachable(record.receiverPeerId())) {
            return false;
        }
        PresencePayloads.Notify notify = new PresencePayloads.Notify(
                record.id(), record.senderDisplayName(), record.fileName(), record.fileSize());
        return server.notifyPeer(record.receiverPeerId(), notify, ackTimeoutMs);
    }
}
