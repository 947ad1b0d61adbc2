package com.alterante.drop.presence;

import java.time.Instant;

/**
 * Answer to a presence query. {@code lastSeen} is null when the peer is known
 * but has never announced itself.
 */
public record PresenceView(
        String peerId,
        boolean reachable,
        Instant lastSeen,
        String displayName,
        String directEndpoint) {
}
