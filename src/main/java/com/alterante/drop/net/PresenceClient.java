package com.alterante.drop.net;

import com.alterante.drop.protocol.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.*;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Presence client: announces the peer to the {@link PresenceServer}, keeps the
 * session alive with periodic heartbeats and reports NOTIFY pushes.
 *
 * Thread model: {@link #connect()} blocks until the server acknowledges ONLINE.
 * After that a daemon thread reads server packets and a scheduler sends
 * heartbeats. If the server has forgotten the session (restart, idle expiry)
 * the client re-announces itself.
 */
public class PresenceClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PresenceClient.class);
    private static final int RECV_TIMEOUT_MS = 2000;
    private static final int MAX_RETRIES = 3;

    private final InetSocketAddress serverAddr;
    private final String psk;
    private final PresencePayloads.Online identity;
    private final long heartbeatIntervalMs;
    private final AtomicInteger sequence = new AtomicInteger();

    private DatagramSocket socket;
    private Thread receiveThread;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> heartbeatTask;
    private volatile boolean running;
    private volatile Consumer<PresencePayloads.Notify> notifyListener;

    public PresenceClient(InetSocketAddress serverAddr, String psk,
                          PresencePayloads.Online identity, long heartbeatIntervalMs) {
        this.serverAddr = serverAddr;
        this.psk = psk;
        this.identity = identity;
        this.heartbeatIntervalMs = heartbeatIntervalMs;
    }

    /** Set the callback for NOTIFY pushes. Runs on the receive thread. */
    public void setNotifyListener(Consumer<PresencePayloads.Notify> listener) {
        this.notifyListener = listener;
    }

    /**
     * Announce the peer and start heartbeats. Blocks until ONLINE is acknowledged.
     *
     * @throws PresenceException if the server rejects or never acknowledges ONLINE
     */
    public void connect() throws PresenceException {
        try {
            socket = new DatagramSocket();
            socket.setSoTimeout(RECV_TIMEOUT_MS);
        } catch (SocketException e) {
            throw new PresenceException("Cannot open socket: " + e.getMessage(), e);
        }

        announce();

        running = true;
        receiveThread = new Thread(this::receiveLoop, "presence-client");
        receiveThread.setDaemon(true);
        receiveThread.start();

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "presence-heartbeat");
            t.setDaemon(true);
            return t;
        });
        heartbeatTask = scheduler.scheduleWithFixedDelay(this::sendHeartbeat,
                heartbeatIntervalMs, heartbeatIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Presence established for '{}' via {}", identity.peerId(), serverAddr);
    }

    private void announce() throws PresenceException {
        Packet online = new Packet(PacketType.ONLINE, sequence.incrementAndGet(),
                PresencePayloads.encodeOnline(identity));

        for (int attempt = 1; attempt <= MAX_RETRIES; attempt++) {
            try {
                send(online);
                log.info("Sent ONLINE for '{}' (attempt {})", identity.peerId(), attempt);

                Packet response = receive();
                if (response.type() == PacketType.ACK) {
                    return;
                } else if (response.type() == PacketType.ERROR) {
                    PresencePayloads.ErrorInfo error = PresencePayloads.decodeError(response.payload());
                    throw new PresenceException("Server rejected ONLINE: " + error.message());
                } else {
                    log.warn("Unexpected response to ONLINE: {}", response.type());
                }
            } catch (SocketTimeoutException e) {
                log.warn("ONLINE timeout (attempt {})", attempt);
            }
        }
        throw new PresenceException("ONLINE failed after " + MAX_RETRIES + " attempts");
    }

    private void sendHeartbeat() {
        try {
            send(new Packet(PacketType.HEARTBEAT, sequence.incrementAndGet(),
                    PresencePayloads.encodePeerId(identity.peerId())));
            log.debug("Sent heartbeat");
        } catch (PresenceException e) {
            log.warn("Heartbeat failed: {}", e.getMessage());
        }
    }

    private void receiveLoop() {
        while (running) {
            try {
                Packet packet = receive();
                switch (packet.type()) {
                    case ACK, PONG -> log.debug("Received {}", packet.type());
                    case NOTIFY -> handleNotify(packet);
                    case ERROR -> handleError(packet);
                    default -> log.debug("Ignoring {}", packet.type());
                }
            } catch (SocketTimeoutException e) {
                log.trace("No packet within {}ms", RECV_TIMEOUT_MS);
            } catch (PresenceException e) {
                if (running) {
                    log.debug("Receive failed: {}", e.getMessage());
                }
            }
        }
        log.debug("Presence receive loop exited");
    }

    private void handleNotify(Packet packet) throws PresenceException {
        PresencePayloads.Notify notify;
        try {
            notify = PresencePayloads.decodeNotify(packet.payload());
        } catch (PacketException e) {
            log.debug("Malformed NOTIFY: {}", e.getMessage());
            return;
        }
        log.info("Pending transfer {} from {}: {}", notify.transferId(), notify.senderDisplayName(), notify.fileName());
        send(new Packet(PacketType.NOTIFY_ACK, packet.sequence(),
                PresencePayloads.encodePeerId(notify.transferId())));
        Consumer<PresencePayloads.Notify> l = notifyListener;
        if (l != null) {
            l.accept(notify);
        }
    }

    private void handleError(Packet packet) throws PresenceException {
        PresencePayloads.ErrorInfo error = PresencePayloads.decodeError(packet.payload());
        if (error.code() == PresenceServer.ERR_NO_SESSION) {
            log.info("Server lost our session, re-announcing");
            send(new Packet(PacketType.ONLINE, sequence.incrementAndGet(),
                    PresencePayloads.encodeOnline(identity)));
        } else {
            log.warn("Server error 0x{}: {}", String.format("%04X", error.code()), error.message());
        }
    }

    /**
     * Send OFFLINE, stop heartbeats and close the socket.
     */
    @Override
    public void close() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        if (socket != null && !socket.isClosed()) {
            try {
                send(new Packet(PacketType.OFFLINE, sequence.incrementAndGet(),
                        PresencePayloads.encodePeerId(identity.peerId())));
            } catch (PresenceException e) {
                log.debug("OFFLINE not sent: {}", e.getMessage());
            }
        }
        running = false;
        if (socket != null) {
            socket.close();
        }
        if (receiveThread != null) {
            try {
                receiveThread.join(RECV_TIMEOUT_MS + 500L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isRunning() {
        return running;
    }

    private void send(Packet packet) throws PresenceException {
        try {
            byte[] data = PacketCodec.encode(packet, psk);
            socket.send(new DatagramPacket(data, data.length, serverAddr.getAddress(), serverAddr.getPort()));
        } catch (IOException e) {
            throw new PresenceException("Send failed: " + e.getMessage(), e);
        }
    }

    private Packet receive() throws SocketTimeoutException, PresenceException {
        byte[] buf = new byte[Packet.MAX_DATAGRAM];
        DatagramPacket dgram = new DatagramPacket(buf, buf.length);
        try {
            socket.receive(dgram);
            return PacketCodec.decode(buf, dgram.getLength(), psk);
        } catch (SocketTimeoutException e) {
            throw e;
        } catch (IOException | PacketException e) {
            throw new PresenceException("Receive failed: " + e.getMessage(), e);
        }
    }

    /**
     * Exception for presence session failures.
     */
    public static class PresenceException extends Exception {
        public PresenceException(String message) { super(message); }
        public PresenceException(String message, Throwable cause) { super(message, cause); }
    }
}
