package com.alterante.drop.error;

/**
 * Base of the checked error taxonomy. Each subtype carries the status code the
 * HTTP API answers with, so callers can map failures without instanceof chains.
 */
public abstract class DropException extends Exception {

    protected DropException(String message) {
        super(message);
    }

    protected DropException(String message, Throwable cause) {
        super(message, cause);
    }

    /** HTTP status used when this error crosses the API boundary. */
    public abstract int status();
}
