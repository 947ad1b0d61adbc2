package com.alterante.drop.error;

/**
 * Transient network or signaling failure while reaching a peer.
 * Never a trigger for the queued fallback; the caller decides whether to retry.
 */
public class ConnectionException extends DropException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int status() {
        return 503;
    }
}
