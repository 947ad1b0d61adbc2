package com.alterante.drop.transport;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * Answers where (and whether) a peer can be reached for a live channel.
 */
public interface Signaling {

    enum State {
        UNKNOWN,
        ABSENT,
        PRESENT
    }

    /**
     * @param endpoint direct endpoint, non-null only when {@code state} is PRESENT
     */
    record Lookup(State state, InetSocketAddress endpoint) {

        public static Lookup unknown() {
            return new Lookup(State.UNKNOWN, null);
        }

        public static Lookup absent() {
            return new Lookup(State.ABSENT, null);
        }

        public static Lookup present(InetSocketAddress endpoint) {
            return new Lookup(State.PRESENT, endpoint);
        }
    }

    /**
     * @throws IOException if the signaling service itself cannot be reached
     */
    Lookup locate(String peerId) throws IOException;

    /**
     * Parse a {@code host:port} endpoint string, or return null if malformed.
     */
    static InetSocketAddress parseEndpoint(String endpoint) {
        if (endpoint == null) {
            return null;
        }
        int colon = endpoint.lastIndexOf(':');
        if (colon <= 0 || colon == endpoint.length() - 1) {
            return null;
        }
        try {
            int port = Integer.parseInt(endpoint.substring(colon + 1));
            if (port <= 0 || port > 0xFFFF) {
                return null;
            }
            return InetSocketAddress.createUnresolved(endpoint.substring(0, colon), port);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
