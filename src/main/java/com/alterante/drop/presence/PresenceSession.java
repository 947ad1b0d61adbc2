package com.alterante.drop.presence;

import com.alterante.drop.error.DropException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-connection presence state. A session binds to a peer on
 * {@link PresenceEvent.UserOnline}; heartbeat and offline signals naming any
 * other peer are ignored. Closing a bound session marks its peer offline.
 *
 * <p>Failures from the tracker are logged and reported as "not applied"; they
 * never escape the session.
 */
public class PresenceSession {

    private static final Logger log = LoggerFactory.getLogger(PresenceSession.class);

    private final String sessionKey;
    private final PresenceTracker tracker;

    private String boundPeerId;
    private long lastActivity;
    private boolean closed;

    public PresenceSession(String sessionKey, PresenceTracker tracker) {
        this.sessionKey = sessionKey;
        this.tracker = tracker;
        this.lastActivity = System.currentTimeMillis();
    }

    /**
     * Apply one event.
     *
     * @return true if the event changed presence state
     */
    public synchronized boolean handle(PresenceEvent event) {
        if (closed) {
            log.debug("Session {} already closed, dropping {}", sessionKey, event);
            return false;
        }
        lastActivity = System.currentTimeMillis();
        try {
            if (event instanceof PresenceEvent.UserOnline online) {
                tracker.markOnline(online.peerId(), online.displayName(), online.contact(),
                        online.directEndpoint());
                if (boundPeerId != null && !boundPeerId.equals(online.peerId())) {
                    log.info("Session {} rebound from {} to {}", sessionKey, boundPeerId, online.peerId());
                }
                boundPeerId = online.peerId();
                return true;
            } else if (event instanceof PresenceEvent.Heartbeat heartbeat) {
                if (!isBoundTo(heartbeat.peerId())) {
                    log.debug("Session {} ignoring heartbeat for {}", sessionKey, heartbeat.peerId());
                    return false;
                }
                tracker.heartbeat(heartbeat.peerId());
                return true;
            } else if (event instanceof PresenceEvent.UserOffline offline) {
                if (!isBoundTo(offline.peerId())) {
                    log.debug("Session {} ignoring offline for {}", sessionKey, offline.peerId());
                    return false;
                }
                tracker.markOffline(offline.peerId());
                boundPeerId = null;
                return true;
            } else if (event instanceof PresenceEvent.SessionClosed close) {
                closed = true;
                if (boundPeerId == null) {
                    return false;
                }
                log.info("Session {} closed ({}), peer {} offline", sessionKey, close.reason(), boundPeerId);
                tracker.markOffline(boundPeerId);
                return true;
            }
            return false;
        } catch (DropException e) {
            log.warn("Session {} could not apply {}: {}", sessionKey, event, e.getMessage());
            return false;
        }
    }

    /**
     * Close without touching presence: the bound peer announced itself from
     * another session, which now owns it.
     */
    public synchronized void supersede() {
        if (!closed && boundPeerId != null) {
            log.info("Session {} superseded, peer {} announced elsewhere", sessionKey, boundPeerId);
        }
        closed = true;
        boundPeerId = null;
    }

    private boolean isBoundTo(String peerId) {
        return boundPeerId != null && boundPeerId.equals(peerId);
    }

    public synchronized String boundPeerId() {
        return boundPeerId;
    }

    public synchronized long lastActivity() {
        return lastActivity;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public String sessionKey() {
        return sessionKey;
    }
}
