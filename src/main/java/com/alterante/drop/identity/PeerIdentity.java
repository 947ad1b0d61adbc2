package com.alterante.drop.identity;

/**
 * A registered peer. Stands in for the account record that registration
 * (outside this service) creates.
 */
public record PeerIdentity(String peerId, String displayName, String contact) {
}
