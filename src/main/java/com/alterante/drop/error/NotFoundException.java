package com.alterante.drop.error;

/**
 * Unknown peer or unknown transfer record.
 */
public class NotFoundException extends DropException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public int status() {
        return 404;
    }
}
