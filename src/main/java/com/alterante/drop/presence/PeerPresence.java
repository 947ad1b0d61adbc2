package com.alterante.drop.presence;

import java.time.Duration;
import java.time.Instant;

/**
 * Stored liveness record for one peer.
 *
 * @param directEndpoint {@code host:port} where the peer accepts live channels, or null
 */
public record PeerPresence(
        String peerId,
        String displayName,
        String contact,
        PresenceStatus status,
        Instant lastHeartbeat,
        String directEndpoint) {

    /**
     * A stored ONLINE status counts only while the last heartbeat is younger than
     * the staleness window. Crashed peers never send OFFLINE, so the timestamp is
     * the real evidence.
     */
    public boolean isReachable(Instant now, Duration stalenessWindow) {
        return status == PresenceStatus.ONLINE
                && Duration.between(lastHeartbeat, now).compareTo(stalenessWindow) < 0;
    }

    PeerPresence refreshed(Instant now) {
        return new PeerPresence(peerId, displayName, contact, status, latest(now), directEndpoint);
    }

    PeerPresence offline(Instant now) {
        return new PeerPresence(peerId, displayName, contact, PresenceStatus.OFFLINE, latest(now), directEndpoint);
    }

    private Instant latest(Instant now) {
        return now.isAfter(lastHeartbeat) ? now : lastHeartbeat;
    }
}
