package com.alterante.drop.error;

/**
 * Missing or malformed input. Raised before any side effect takes place.
 */
public class ValidationException extends DropException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public int status() {
        return 400;
    }
}
