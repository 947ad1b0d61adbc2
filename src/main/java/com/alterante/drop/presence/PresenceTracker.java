package com.alterante.drop.presence;

import com.alterante.drop.error.NotFoundException;
import com.alterante.drop.error.ValidationException;
import com.alterante.drop.identity.IdentityDirectory;
import com.alterante.drop.identity.PeerIdentity;
import com.alterante.drop.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Owns peer liveness records.
 *
 * <p>Liveness is evaluated lazily on every read: there is no background expiry,
 * a peer whose heartbeats stop simply reads as unreachable once the staleness
 * window has passed. Timestamps are taken inside the per-key update so the
 * store applies presence changes last-write-wins, and a heartbeat never moves
 * {@code lastHeartbeat} backwards.
 */
public class PresenceTracker {

    private static final Logger log = LoggerFactory.getLogger(PresenceTracker.class);

    private final RecordStore<PeerPresence> store;
    private final IdentityDirectory identities;
    private final Clock clock;
    private final Duration stalenessWindow;

    public PresenceTracker(RecordStore<PeerPresence> store, IdentityDirectory identities,
                           Clock clock, Duration stalenessWindow) {
        this.store = store;
        this.identities = identities;
        this.clock = clock;
        this.stalenessWindow = stalenessWindow;
    }

    /** Idempotent upsert: status ONLINE, timestamp refreshed, direct endpoint unchanged. */
    public PeerPresence markOnline(String peerId, String displayName, String contact) throws ValidationException {
        return markOnline(peerId, displayName, contact, null);
    }

    /**
     * Idempotent upsert: status ONLINE, timestamp refreshed.
     *
     * @param directEndpoint new live-channel endpoint, or null to keep the stored one
     */
    public PeerPresence markOnline(String peerId, String displayName, String contact,
                                   String directEndpoint) throws ValidationException {
        requireText(peerId, "peerId");
        requireText(displayName, "displayName");
        requireText(contact, "contact");

        PeerPresence updated = store.upsert(peerId, current -> {
            Instant now = clock.instant();
            Instant ts = current.map(p -> p.lastHeartbeat().isAfter(now) ? p.lastHeartbeat() : now).orElse(now);
            String endpoint = directEndpoint != null
                    ? directEndpoint
                    : current.map(PeerPresence::directEndpoint).orElse(null);
            return new PeerPresence(peerId, displayName, contact, PresenceStatus.ONLINE, ts, endpoint);
        });
        log.debug("Peer {} online (endpoint={})", peerId, updated.directEndpoint());
        return updated;
    }

    /**
     * Refresh the heartbeat timestamp only. Heartbeats never create a record.
     */
    public PeerPresence heartbeat(String peerId) throws NotFoundException {
        return store.update(peerId, p -> p.refreshed(clock.instant()))
                .orElseThrow(() -> new NotFoundException("No presence for peer " + peerId));
    }

    /** Status OFFLINE, timestamp refreshed. */
    public PeerPresence markOffline(String peerId) throws NotFoundException {
        PeerPresence updated = store.update(peerId, p -> p.offline(clock.instant()))
                .orElseThrow(() -> new NotFoundException("No presence for peer " + peerId));
        log.info("Peer {} marked offline", peerId);
        return updated;
    }

    public boolean isReachable(String peerId) {
        return store.get(peerId)
                .map(p -> p.isReachable(clock.instant(), stalenessWindow))
                .orElse(false);
    }

    /**
     * Presence as seen by other peers. Unknown only when neither an identity nor
     * a presence record exists.
     */
    public PresenceView query(String peerId) throws NotFoundException {
        Optional<PeerPresence> presence = store.get(peerId);
        if (presence.isPresent()) {
            PeerPresence p = presence.get();
            return new PresenceView(peerId, p.isReachable(clock.instant(), stalenessWindow),
                    p.lastHeartbeat(), p.displayName(), p.directEndpoint());
        }
        PeerIdentity identity = identities.find(peerId)
                .orElseThrow(() -> new NotFoundException("Unknown peer " + peerId));
        return new PresenceView(peerId, false, null, identity.displayName(), null);
    }

    public Optional<PeerPresence> find(String peerId) {
        return store.get(peerId);
    }

    public Duration stalenessWindow() {
        return stalenessWindow;
    }

    private static void requireText(String value, String field) throws ValidationException {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Missing required field: " + field);
        }
    }
}
