package com.alterante.drop.identity;

import java.util.Optional;

/**
 * Read side of the identity store: answers whether a peer id belongs to a
 * registered identity at all.
 */
public interface IdentityDirectory {

    Optional<PeerIdentity> find(String peerId);

    default boolean exists(String peerId) {
        return find(peerId).isPresent();
    }

    int count();
}
