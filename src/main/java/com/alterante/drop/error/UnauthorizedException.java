package com.alterante.drop.error;

/**
 * The requesting peer does not own the record it tried to change.
 * The record is left untouched.
 */
public class UnauthorizedException extends DropException {

    public UnauthorizedException(String message) {
        super(message);
    }

    @Override
    public int status() {
        return 403;
    }
}
