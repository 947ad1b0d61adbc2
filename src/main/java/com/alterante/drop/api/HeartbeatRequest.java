package com.alterante.drop.api;

/**
 * Body of {@code POST /api/user/heartbeat}. {@code directEndpoint} is optional.
 */
public record HeartbeatRequest(String peerId, String displayName, String contact, String directEndpoint) {
}
