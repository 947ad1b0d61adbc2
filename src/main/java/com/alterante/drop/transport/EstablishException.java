package com.alterante.drop.transport;

/**
 * A live channel could not be established. The {@link Failure} decides what the
 * sender does next: only {@link Failure#PEER_UNREACHABLE} falls back to the queue.
 */
public class EstablishException extends Exception {

    public enum Failure {
        /** Signaling worked, but the remote peer is not present right now. */
        PEER_UNREACHABLE,
        /** Transient network or signaling failure. */
        CONNECTION_ERROR,
        /** No identity or presence exists for the peer id. */
        PEER_UNKNOWN
    }

    private final Failure failure;

    public EstablishException(Failure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public EstablishException(Failure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public Failure failure() {
        return failure;
    }
}
