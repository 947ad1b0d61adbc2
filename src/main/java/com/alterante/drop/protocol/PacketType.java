package com.alterante.drop.protocol;

/**
 * Message types of the presence protocol.
 * Single byte type code in the packet header.
 */
public enum PacketType {

    // Peer → server
    ONLINE      ((byte) 0x01),
    HEARTBEAT   ((byte) 0x02),
    OFFLINE     ((byte) 0x03),

    // Server → peer
    ACK         ((byte) 0x04),
    NOTIFY      ((byte) 0x10),

    // Peer → server, acknowledging a NOTIFY
    NOTIFY_ACK  ((byte) 0x11),

    // Liveness check, no session required
    PING        ((byte) 0x20),
    PONG        ((byte) 0x21),

    ERROR       ((byte) 0xFF);

    private final byte code;

    PacketType(byte code) {
        this.code = code;
    }

    public byte code() {
        return code;
    }

    private static final PacketType[] LOOKUP = new PacketType[256];

    static {
        for (PacketType t : values()) {
            LOOKUP[Byte.toUnsignedInt(t.code)] = t;
        }
    }

    /**
     * Look up a PacketType by its wire code.
     * @return the PacketType, or null if unknown
     */
    public static PacketType fromCode(byte code) {
        return LOOKUP[Byte.toUnsignedInt(code)];
    }
}
