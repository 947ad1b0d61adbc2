package com.alterante.drop.protocol;

/**
 * Thrown when a datagram cannot be decoded or fails authentication.
 */
public class PacketException extends Exception {

    public PacketException(String message) {
        super(message);
    }

    public PacketException(String message, Throwable cause) {
        super(message, cause);
    }
}
