package com.alterante.drop.transport;

import com.alterante.drop.identity.IdentityDirectory;
import com.alterante.drop.presence.PeerPresence;
import com.alterante.drop.presence.PresenceTracker;

import java.net.InetSocketAddress;
import java.util.Optional;

/**
 * In-process signaling straight off the presence tracker.
 */
public class TrackerSignaling implements Signaling {

    private final IdentityDirectory identities;
    private final PresenceTracker tracker;

    public TrackerSignaling(IdentityDirectory identities, PresenceTracker tracker) {
        this.identities = identities;
        this.tracker = tracker;
    }

    @Override
    public Lookup locate(String peerId) {
        Optional<PeerPresence> presence = tracker.find(peerId);
        if (presence.isEmpty()) {
            return identities.exists(peerId) ? Lookup.absent() : Lookup.unknown();
        }
        if (!tracker.isReachable(peerId)) {
            return Lookup.absent();
        }
        InetSocketAddress endpoint = Signaling.parseEndpoint(presence.get().directEndpoint());
        return endpoint == null ? Lookup.absent() : Lookup.present(endpoint);
    }
}
