package com.alterante.drop.api;

/**
 * Body carrying only the calling peer's id.
 */
public record PeerRequest(String peerId) {
}
