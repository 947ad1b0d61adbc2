package com.alterante.drop.protocol;

import java.util.Arrays;

/**
 * Immutable presence protocol packet.
 *
 * Wire format (16-byte header + payload + optional tag):
 * <pre>
 * Offset  Field            Size
 * 0-1     Magic            2 bytes (0xA1 0xD7)
 * 2       Version          1 byte
 * 3       Type             1 byte
 * 4       Flags            1 byte
 * 5-8     Sequence         4 bytes
 * 9-10    Payload Length   2 bytes (max 1024)
 * 11      Reserved         1 byte (0x00)
 * 12-15   CRC-32           4 bytes (over bytes 0-11)
 * 16+     Payload          0-1024 bytes
 * end     HMAC-SHA256 tag  32 bytes, only when FLAG_SIGNED is set
 * </pre>
 */
public final class Packet {

    public static final int HEADER_SIZE = 16;
    public static final int MAX_PAYLOAD = 1024;
    public static final int TAG_SIZE = 32;
    public static final int MAX_DATAGRAM = HEADER_SIZE + MAX_PAYLOAD + TAG_SIZE;

    public static final byte VERSION = 0x01;

    public static final byte FLAG_SIGNED = 0x01;

    private final PacketType type;
    private final byte flags;
    private final int sequence;
    private final byte[] payload;

    public Packet(PacketType type, byte flags, int sequence, byte[] payload) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (payload != null && payload.length > MAX_PAYLOAD) {
            throw new IllegalArgumentException("payload too large: " + payload.length + " > " + MAX_PAYLOAD);
        }
        this.type = type;
        this.flags = flags;
        this.sequence = sequence;
        this.payload = payload != null ? Arrays.copyOf(payload, payload.length) : new byte[0];
    }

    public Packet(PacketType type, int sequence, byte[] payload) {
        this(type, (byte) 0, sequence, payload);
    }

    public Packet(PacketType type, byte[] payload) {
        this(type, (byte) 0, 0, payload);
    }

    public Packet(PacketType type) {
        this(type, (byte) 0, 0, null);
    }

    public PacketType type()        { return type; }
    public byte flags()             { return flags; }
    public int sequence()           { return sequence; }
    public byte[] payload()         { return Arrays.copyOf(payload, payload.length); }
    public int payloadLength()      { return payload.length; }

    public boolean isSigned() {
        return (flags & FLAG_SIGNED) != 0;
    }

    @Override
    public String toString() {
        return String.format("Packet[type=%s, flags=0x%02X, seq=%d, payload=%d bytes]",
                type, flags, sequence, payload.length);
    }
}
