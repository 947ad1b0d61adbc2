package com.alterante.drop.protocol;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.zip.CRC32;

/**
 * Encodes and decodes {@link Packet} instances to/from datagrams.
 *
 * <p>When a pre-shared key is configured every packet is signed: the sender
 * sets {@link Packet#FLAG_SIGNED} and appends HMAC-SHA256(psk, header + payload).
 * A receiver holding a key rejects unsigned packets and bad tags. Without a key
 * tags are ignored.
 */
public final class PacketCodec {

    public static final byte MAGIC_0 = (byte) 0xA1;
    public static final byte MAGIC_1 = (byte) 0xD7;

    private static final int CRC_INPUT_LEN = 12; // bytes 0-11
    private static final int HEADER_SIZE = Packet.HEADER_SIZE;

    private PacketCodec() {}

    /** Encode without a tag. */
    public static byte[] encode(Packet packet) {
        return encode(packet, null);
    }

    /**
     * Encode a Packet into a datagram, signed when {@code psk} is non-null.
     */
    public static byte[] encode(Packet packet, String psk) {
        boolean sign = psk != null;
        byte flags = sign ? (byte) (packet.flags() | Packet.FLAG_SIGNED) : packet.flags();
        int payloadLen = packet.payloadLength();
        byte[] out = new byte[HEADER_SIZE + payloadLen + (sign ? Packet.TAG_SIZE : 0)];
        ByteBuffer buf = ByteBuffer.wrap(out).order(ByteOrder.BIG_ENDIAN);

        buf.put(MAGIC_0);
        buf.put(MAGIC_1);
        buf.put(Packet.VERSION);
        buf.put(packet.type().code());
        buf.put(flags);
        buf.putInt(packet.sequence());
        buf.putShort((short) payloadLen);
        buf.put((byte) 0x00);

        CRC32 crc = new CRC32();
        crc.update(out, 0, CRC_INPUT_LEN);
        buf.putInt((int) crc.getValue());

        if (payloadLen > 0) {
            buf.put(packet.payload());
        }
        if (sign) {
            buf.put(computeTag(psk, out, HEADER_SIZE + payloadLen));
        }
        return out;
    }

    /** Decode without verifying a tag. */
    public static Packet decode(byte[] data, int length) throws PacketException {
        return decode(data, length, null);
    }

    /**
     * Decode a datagram into a Packet.
     *
     * @param psk when non-null, the packet must be signed with this key
     * @throws PacketException if the data is malformed or fails authentication
     */
    public static Packet decode(byte[] data, int length, String psk) throws PacketException {
        if (length < HEADER_SIZE) {
            throw new PacketException("datagram too short: " + length + " < " + HEADER_SIZE);
        }

        ByteBuffer buf = ByteBuffer.wrap(data, 0, length).order(ByteOrder.BIG_ENDIAN);

        byte m0 = buf.get();
        byte m1 = buf.get();
        if (m0 != MAGIC_0 || m1 != MAGIC_1) {
            throw new PacketException(String.format("bad magic: 0x%02X%02X", m0, m1));
        }

        byte version = buf.get();
        if (version != Packet.VERSION) {
            throw new PacketException("unsupported version: " + version);
        }

        byte typeCode = buf.get();
        PacketType type = PacketType.fromCode(typeCode);
        if (type == null) {
            throw new PacketException(String.format("unknown type: 0x%02X", typeCode));
        }

        byte flags = buf.get();
        int sequence = buf.getInt();

        int payloadLen = Short.toUnsignedInt(buf.getShort());
        if (payloadLen > Packet.MAX_PAYLOAD) {
            throw new PacketException("payload length too large: " + payloadLen);
        }

        buf.get(); // reserved

        int receivedCrc = buf.getInt();
        CRC32 crc = new CRC32();
        crc.update(data, 0, CRC_INPUT_LEN);
        int computedCrc = (int) crc.getValue();
        if (receivedCrc != computedCrc) {
            throw new PacketException(String.format("CRC mismatch: received=0x%08X computed=0x%08X",
                    receivedCrc, computedCrc));
        }

        boolean signed = (flags & Packet.FLAG_SIGNED) != 0;
        int bodyLen = HEADER_SIZE + payloadLen;
        int needed = bodyLen + (signed ? Packet.TAG_SIZE : 0);
        if (needed > length) {
            throw new PacketException("packet extends beyond datagram: need " + needed + " but only " + length + " bytes");
        }

        if (psk != null) {
            if (!signed) {
                throw new PacketException("unsigned packet rejected");
            }
            byte[] expected = computeTag(psk, data, bodyLen);
            byte[] received = Arrays.copyOfRange(data, bodyLen, bodyLen + Packet.TAG_SIZE);
            if (!MessageDigest.isEqual(expected, received)) {
                throw new PacketException("authentication tag mismatch");
            }
        }

        byte[] payload = new byte[payloadLen];
        if (payloadLen > 0) {
            buf.get(payload);
        }

        return new Packet(type, flags, sequence, payload);
    }

    static byte[] computeTag(String psk, byte[] data, int length) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(psk.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            mac.update(data, 0, length);
            return mac.doFinal();
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new RuntimeException("HMAC-SHA256 unavailable", e);
        }
    }
}
