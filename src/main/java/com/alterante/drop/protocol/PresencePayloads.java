package com.alterante.drop.protocol;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Payload layouts carried inside presence packets. Strings are a 2-byte
 * big-endian length followed by UTF-8 bytes.
 *
 * <pre>
 * ONLINE:     peerId, displayName, contact, directPort (2 bytes, 0 = none)
 * HEARTBEAT:  peerId
 * OFFLINE:    peerId
 * NOTIFY:     transferId, senderDisplayName, fileName, fileSize (8 bytes)
 * NOTIFY_ACK: transferId
 * ERROR:      code (2 bytes), message (rest, UTF-8)
 * </pre>
 */
public final class PresencePayloads {

    private PresencePayloads() {}

    public record Online(String peerId, String displayName, String contact, int directPort) {
    }

    public record Notify(String transferId, String senderDisplayName, String fileName, long fileSize) {
    }

    public record ErrorInfo(int code, String message) {
    }

    public static byte[] encodeOnline(Online online) {
        Writer w = new Writer();
        w.string(online.peerId());
        w.string(online.displayName());
        w.string(online.contact());
        w.buf.putShort((short) online.directPort());
        return w.toBytes();
    }

    public static Online decodeOnline(byte[] payload) throws PacketException {
        try {
            ByteBuffer buf = wrap(payload);
            String peerId = readString(buf);
            String displayName = readString(buf);
            String contact = readString(buf);
            int port = Short.toUnsignedInt(buf.getShort());
            return new Online(peerId, displayName, contact, port);
        } catch (BufferUnderflowException e) {
            throw new PacketException("truncated ONLINE payload", e);
        }
    }

    public static byte[] encodePeerId(String peerId) {
        Writer w = new Writer();
        w.string(peerId);
        return w.toBytes();
    }

    public static String decodePeerId(byte[] payload) throws PacketException {
        try {
            return readString(wrap(payload));
        } catch (BufferUnderflowException e) {
            throw new PacketException("truncated peer id payload", e);
        }
    }

    public static byte[] encodeNotify(Notify notify) {
        Writer w = new Writer();
        w.string(notify.transferId());
        w.string(notify.senderDisplayName());
        w.string(notify.fileName());
        w.buf.putLong(notify.fileSize());
        return w.toBytes();
    }

    public static Notify decodeNotify(byte[] payload) throws PacketException {
        try {
            ByteBuffer buf = wrap(payload);
            return new Notify(readString(buf), readString(buf), readString(buf), buf.getLong());
        } catch (BufferUnderflowException e) {
            throw new PacketException("truncated NOTIFY payload", e);
        }
    }

    public static byte[] encodeError(int code, String message) {
        byte[] msgBytes = message.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(2 + msgBytes.length).order(ByteOrder.BIG_ENDIAN);
        buf.putShort((short) code);
        buf.put(msgBytes);
        return buf.array();
    }

    public static ErrorInfo decodeError(byte[] payload) {
        if (payload.length < 2) {
            return new ErrorInfo(0, "(empty error)");
        }
        int code = ((payload[0] & 0xFF) << 8) | (payload[1] & 0xFF);
        return new ErrorInfo(code, new String(payload, 2, payload.length - 2, StandardCharsets.UTF_8));
    }

    private static ByteBuffer wrap(byte[] payload) {
        return ByteBuffer.wrap(payload).order(ByteOrder.BIG_ENDIAN);
    }

    private static String readString(ByteBuffer buf) throws PacketException {
        int len = Short.toUnsignedInt(buf.getShort());
        if (len > buf.remaining()) {
            throw new PacketException("string length " + len + " exceeds payload");
        }
        byte[] bytes = new byte[len];
        buf.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static final class Writer {
        private final ByteBuffer buf = ByteBuffer.allocate(Packet.MAX_PAYLOAD).order(ByteOrder.BIG_ENDIAN);

        void string(String s) {
            byte[] bytes = (s == null ? "" : s).getBytes(StandardCharsets.UTF_8);
            if (bytes.length > 0xFFFF || bytes.length + 2 > buf.remaining()) {
                throw new IllegalArgumentException("string too long for payload: " + bytes.length + " bytes");
            }
            buf.putShort((short) bytes.length);
            buf.put(bytes);
        }

        byte[] toBytes() {
            byte[] out = new byte[buf.position()];
            buf.flip();
            buf.get(out);
            return out;
        }
    }
}
