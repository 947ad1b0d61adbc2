package com.alterante.drop.transport;

import java.nio.file.Path;

/**
 * Stream framing for the TCP live channel (all integers big-endian, strings as
 * {@link java.io.DataOutput#writeUTF}).
 *
 * <pre>
 * HELLO  : magic (4) | version (1) | senderPeerId | receiverPeerId   → reply (1)
 * FILE   : 0x10 | fileName | size (8) | SHA-256 (32) | bytes          → reply (1)
 * BYE    : 0x7F
 * </pre>
 */
final class DirectFrames {

    static final int MAGIC = 0xA1D7D1;
    static final byte VERSION = 0x01;

    static final byte FRAME_FILE = 0x10;
    static final byte FRAME_BYE = 0x7F;

    static final byte REPLY_ACCEPT = 0x01;
    static final byte REPLY_WRONG_PEER = 0x02;
    static final byte REPLY_VERIFIED = 0x03;
    static final byte REPLY_CORRUPT = 0x04;

    static final int SHA256_LEN = 32;

    private DirectFrames() {}

    /**
     * Reduce an untrusted file name to a single safe path segment.
     */
    static String safeFileName(String fileName) {
        if (fileName == null) {
            return "unnamed";
        }
        String normalized = fileName.replace('\\', '/');
        Path last = Path.of(normalized).getFileName();
        String name = last == null ? "" : last.toString().trim();
        if (name.isEmpty() || name.equals(".") || name.equals("..")) {
            return "unnamed";
        }
        return name;
    }
}
