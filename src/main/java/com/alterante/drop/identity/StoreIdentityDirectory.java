package com.alterante.drop.identity;

import com.alterante.drop.store.RecordStore;

import java.util.Optional;

/**
 * {@link IdentityDirectory} backed by a {@link RecordStore}. Identities are
 * seeded by configuration at startup.
 */
public class StoreIdentityDirectory implements IdentityDirectory {

    private final RecordStore<PeerIdentity> store;

    public StoreIdentityDirectory(RecordStore<PeerIdentity> store) {
        this.store = store;
    }

    /** Add or replace an identity. */
    public PeerIdentity register(PeerIdentity identity) {
        return store.upsert(identity.peerId(), current -> identity);
    }

    @Override
    public Optional<PeerIdentity> find(String peerId) {
        if (peerId == null) {
            return Optional.empty();
        }
        return store.get(peerId);
    }

    @Override
    public int count() {
        return store.size();
    }
}
