package com.alterante.drop.presence;

/**
 * Signals a presence session can receive from its connection.
 */
public sealed interface PresenceEvent
        permits PresenceEvent.UserOnline, PresenceEvent.Heartbeat,
                PresenceEvent.UserOffline, PresenceEvent.SessionClosed {

    /** Announces (or re-announces) the peer behind this session. */
    record UserOnline(String peerId, String displayName, String contact, String directEndpoint)
            implements PresenceEvent {
    }

    record Heartbeat(String peerId) implements PresenceEvent {
    }

    /** Explicit logout. */
    record UserOffline(String peerId) implements PresenceEvent {
    }

    /** The connection went away, cleanly or by idle expiry. */
    record SessionClosed(String reason) implements PresenceEvent {
    }
}
