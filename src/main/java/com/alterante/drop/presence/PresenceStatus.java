package com.alterante.drop.presence;

/**
 * Stored presence status. Not the same as liveness: see {@link PeerPresence#isReachable}.
 */
public enum PresenceStatus {
    ONLINE,
    OFFLINE
}
