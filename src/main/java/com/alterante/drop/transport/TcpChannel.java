package com.alterante.drop.transport;

import com.alterante.drop.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One TCP connection to a peer's {@link DirectReceiver}. Sends are serialized.
 * Closing while a send is in flight drops the socket without a BYE frame, so
 * the receiver never sees one spliced into a file payload.
 */
class TcpChannel implements LiveChannel {

    private static final Logger log = LoggerFactory.getLogger(TcpChannel.class);

    private final String peerId;
    private final Socket socket;
    private final DataInputStream in;
    private final DataOutputStream out;
    private final ReentrantLock sendLock = new ReentrantLock();
    private volatile boolean open = true;

    TcpChannel(String peerId, Socket socket) throws IOException {
        this.peerId = peerId;
        this.socket = socket;
        this.in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
        this.out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()));
    }

    byte hello(String localPeerId) throws IOException {
        out.writeInt(DirectFrames.MAGIC);
        out.writeByte(DirectFrames.VERSION);
        out.writeUTF(localPeerId);
        out.writeUTF(peerId);
        out.flush();
        return in.readByte();
    }

    @Override
    public String peerId() {
        return peerId;
    }

    @Override
    public void send(Path file, String fileName) throws IOException {
        sendLock.lock();
        try {
            sendLocked(file, fileName);
        } finally {
            sendLock.unlock();
        }
    }

    private void sendLocked(Path file, String fileName) throws IOException {
        if (!open) {
            throw new IOException("Channel to " + peerId + " is closed");
        }
        long size = Files.size(file);
        byte[] sha = Hashing.sha256(file);
        try {
            out.writeByte(DirectFrames.FRAME_FILE);
            out.writeUTF(DirectFrames.safeFileName(fileName));
            out.writeLong(size);
            out.write(sha);
            try (InputStream data = Files.newInputStream(file)) {
                data.transferTo(out);
            }
            out.flush();

            byte reply = in.readByte();
            if (reply != DirectFrames.REPLY_VERIFIED) {
                throw new IOException("Peer " + peerId + " rejected " + fileName + " (reply " + reply + ")");
            }
            log.debug("Sent {} ({} bytes) to {}", fileName, size, peerId);
        } catch (IOException e) {
            open = false;
            closeSocket();
            throw e;
        }
    }

    @Override
    public boolean isOpen() {
        return open && !socket.isClosed();
    }

    @Override
    public void close() {
        if (!open) {
            return;
        }
        open = false;
        if (sendLock.tryLock()) {
            try {
                if (!socket.isClosed()) {
                    out.writeByte(DirectFrames.FRAME_BYE);
                    out.flush();
                }
            } catch (IOException e) {
                log.debug("BYE to {} not sent: {}", peerId, e.getMessage());
            } finally {
                sendLock.unlock();
            }
        } else {
            log.debug("Closing channel to {} with a send in flight", peerId);
        }
        closeSocket();
    }

    private void closeSocket() {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing channel to {}: {}", peerId, e.getMessage());
        }
    }
}
