package com.alterante.drop.error;

/**
 * An external collaborator (blob store, remote API) failed or timed out.
 */
public class UpstreamException extends DropException {

    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int status() {
        return 500;
    }
}
