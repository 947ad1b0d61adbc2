package com.alterante.drop.transport;

import com.alterante.drop.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * Accepts live channels addressed to the local peer and writes received files
 * into an output directory. Each file is verified against the SHA-256 the
 * sender announced before it becomes visible under its final name.
 */
public class DirectReceiver implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DirectReceiver.class);

    private static final int BUFFER_SIZE = 64 * 1024;

    public record ReceivedFile(String senderPeerId, String fileName, Path path, long size) {
    }

    private final String localPeerId;
    private final int port;
    private final Path outputDir;
    private final Consumer<ReceivedFile> listener;
    private final long maxFileSize;

    private ServerSocket serverSocket;
    private ExecutorService workers;
    private volatile boolean running;

    public DirectReceiver(String localPeerId, int port, Path outputDir, long maxFileSize,
                          Consumer<ReceivedFile> listener) {
        this.localPeerId = localPeerId;
        this.port = port;
        this.outputDir = outputDir;
        this.maxFileSize = maxFileSize;
        this.listener = listener;
    }

    /**
     * Bind and start accepting. Returns the bound port (useful with port 0).
     */
    public synchronized int start() throws IOException {
        Files.createDirectories(outputDir);
        serverSocket = new ServerSocket();
        serverSocket.setReuseAddress(true);
        serverSocket.bind(new InetSocketAddress(port));
        workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "direct-receiver");
            t.setDaemon(true);
            return t;
        });
        running = true;

        Thread acceptor = new Thread(this::acceptLoop, "direct-accept");
        acceptor.setDaemon(true);
        acceptor.start();
        log.info("Direct receiver for {} listening on port {}", localPeerId, serverSocket.getLocalPort());
        return serverSocket.getLocalPort();
    }

    public int localPort() {
        return serverSocket != null ? serverSocket.getLocalPort() : -1;
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public synchronized void close() {
        running = false;
        if (serverSocket != null) {
            try {
                serverSocket.close();
            } catch (IOException e) {
                log.debug("Error closing server socket: {}", e.getMessage());
            }
        }
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    private void acceptLoop() {
        while (running) {
            try {
                Socket socket = serverSocket.accept();
                workers.execute(() -> handle(socket));
            } catch (SocketException e) {
                if (running) {
                    log.warn("Accept failed: {}", e.getMessage());
                }
                return;
            } catch (IOException e) {
                log.warn("Accept failed: {}", e.getMessage());
            }
        }
    }

    private void handle(Socket socket) {
        String remote = String.valueOf(socket.getRemoteSocketAddress());
        try (socket) {
            DataInputStream in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
            DataOutputStream out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()));

            if (in.readInt() != DirectFrames.MAGIC || in.readByte() != DirectFrames.VERSION) {
                log.warn("Dropping connection from {}: bad handshake", remote);
                return;
            }
            String sender = in.readUTF();
            String receiver = in.readUTF();
            if (!localPeerId.equals(receiver)) {
                log.info("Connection from {} addressed to {}, not {}", remote, receiver, localPeerId);
                out.writeByte(DirectFrames.REPLY_WRONG_PEER);
                out.flush();
                return;
            }
            out.writeByte(DirectFrames.REPLY_ACCEPT);
            out.flush();
            log.debug("Accepted live channel from {} ({})", sender, remote);

            while (running) {
                byte frame;
                try {
                    frame = in.readByte();
                } catch (EOFException e) {
                    return;
                }
                if (frame == DirectFrames.FRAME_BYE) {
                    return;
                }
                if (frame != DirectFrames.FRAME_FILE) {
                    log.warn("Unknown frame 0x{} from {}", Integer.toHexString(frame & 0xFF), sender);
                    return;
                }
                out.writeByte(receiveFile(sender, in));
                out.flush();
            }
        } catch (IOException e) {
            if (running) {
                log.warn("Live channel from {} failed: {}", remote, e.getMessage());
            }
        }
    }

    private byte receiveFile(String sender, DataInputStream in) throws IOException {
        String fileName = DirectFrames.safeFileName(in.readUTF());
        long size = in.readLong();
        byte[] expected = new byte[DirectFrames.SHA256_LEN];
        in.readFully(expected);

        if (size < 0 || size > maxFileSize) {
            log.warn("Refusing {} from {}: size {}", fileName, sender, size);
            throw new IOException("Refused oversized file " + fileName);
        }

        Path part = Files.createTempFile(outputDir, ".recv-", ".part");
        try {
            MessageDigest digest = Hashing.sha256();
            byte[] buf = new byte[BUFFER_SIZE];
            long remaining = size;
            try (OutputStream file = Files.newOutputStream(part)) {
                while (remaining > 0) {
                    int n = in.read(buf, 0, (int) Math.min(buf.length, remaining));
                    if (n < 0) {
                        throw new EOFException("Stream ended with " + remaining + " bytes outstanding");
                    }
                    digest.update(buf, 0, n);
                    file.write(buf, 0, n);
                    remaining -= n;
                }
            }
            if (!Arrays.equals(expected, digest.digest())) {
                log.warn("Checksum mismatch for {} from {}", fileName, sender);
                return DirectFrames.REPLY_CORRUPT;
            }

            Path target = uniqueTarget(fileName);
            Files.move(part, target, StandardCopyOption.ATOMIC_MOVE);
            log.info("Received {} ({} bytes) from {}", target.getFileName(), size, sender);
            if (listener != null) {
                listener.accept(new ReceivedFile(sender, fileName, target, size));
            }
            return DirectFrames.REPLY_VERIFIED;
        } finally {
            Files.deleteIfExists(part);
        }
    }

    private Path uniqueTarget(String fileName) {
        Path target = outputDir.resolve(fileName);
        if (!Files.exists(target)) {
            return target;
        }
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        String ext = dot > 0 ? fileName.substring(dot) : "";
        for (int i = 1; ; i++) {
            target = outputDir.resolve(base + " (" + i + ")" + ext);
            if (!Files.exists(target)) {
                return target;
            }
        }
    }
}
