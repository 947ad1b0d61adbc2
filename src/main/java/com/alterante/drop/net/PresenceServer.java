package com.alterante.drop.net;

import com.alterante.drop.presence.PresenceEvent;
import com.alterante.drop.presence.PresenceSession;
import com.alterante.drop.presence.PresenceTracker;
import com.alterante.drop.protocol.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.*;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * UDP presence server. Each remote endpoint gets one {@link PresenceSession};
 * datagrams are decoded into {@link PresenceEvent}s and dispatched to it.
 *
 * Protocol flow per peer:
 * 1. Peer → ONLINE(peerId, displayName, contact, directPort) ← ACK
 * 2. Peer → HEARTBEAT(peerId) every few seconds ← ACK
 * 3. Peer → OFFLINE(peerId) on logout ← ACK, session dropped
 * 4. No traffic for the session timeout → session closed, peer marked offline
 *
 * The server also pushes NOTIFY to a connected peer and waits for NOTIFY_ACK.
 */
public class PresenceServer {

    private static final Logger log = LoggerFactory.getLogger(PresenceServer.class);

    public static final short ERR_MALFORMED = 0x0001;
    public static final short ERR_REJECTED = 0x0002;
    public static final short ERR_NO_SESSION = 0x0003;

    private final int port;
    private final String psk;
    private final long sessionTimeoutMs;
    private final PresenceTracker tracker;
    private final Map<InetSocketAddress, PresenceSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> pendingNotifies = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile DatagramSocket socket;
    private volatile boolean bound;
    private long lastSweep = System.currentTimeMillis();

    /**
     * @param psk pre-shared key for packet signing, or null to accept unsigned packets
     */
    public PresenceServer(int port, String psk, long sessionTimeoutMs, PresenceTracker tracker) {
        this.port = port;
        this.psk = psk;
        this.sessionTimeoutMs = sessionTimeoutMs;
        this.tracker = tracker;
    }

    /**
     * Bind the socket. Port 0 picks a free port; see {@link #localPort()}.
     */
    public synchronized int bind() throws SocketException {
        if (!bound) {
            socket = new DatagramSocket(port);
            socket.setSoTimeout(1000); // 1s timeout for clean shutdown checks
            running.set(true);
            bound = true;
        }
        return socket.getLocalPort();
    }

    /** Bind if needed and run the receive loop until {@link #stop()}. */
    public void start() throws IOException {
        bind();
        log.info("Presence server listening on UDP port {}", socket.getLocalPort());

        byte[] recvBuf = new byte[Packet.MAX_DATAGRAM];

        while (running.get()) {
            DatagramPacket dgram = new DatagramPacket(recvBuf, recvBuf.length);
            try {
                socket.receive(dgram);
            } catch (SocketTimeoutException e) {
                sweepIfDue();
                continue;
            } catch (SocketException e) {
                if (running.get()) {
                    throw e;
                }
                break;
            }

            InetSocketAddress sender = new InetSocketAddress(dgram.getAddress(), dgram.getPort());

            try {
                Packet packet = PacketCodec.decode(recvBuf, dgram.getLength(), psk);
                handlePacket(packet, sender);
            } catch (PacketException e) {
                log.debug("Bad packet from {}: {}", sender, e.getMessage());
            }
            sweepIfDue();
        }

        socket.close();
        log.info("Presence server stopped");
    }

    public void stop() {
        running.set(false);
        DatagramSocket s = socket;
        if (s != null) {
            s.close();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public int localPort() {
        return socket.getLocalPort();
    }

    public int sessionCount() {
        return sessions.size();
    }

    /**
     * Push a NOTIFY to the session currently bound to {@code peerId} and wait for
     * the peer to acknowledge it.
     *
     * @return true if the peer acknowledged within {@code timeoutMs}
     */
    public boolean notifyPeer(String peerId, PresencePayloads.Notify notify, long timeoutMs) {
        InetSocketAddress endpoint = findEndpoint(peerId);
        if (endpoint == null) {
            log.debug("No presence session for {}, cannot notify", peerId);
            return false;
        }
        CompletableFuture<Void> ack = pendingNotifies.computeIfAbsent(notify.transferId(),
                id -> new CompletableFuture<>());
        try {
            sendPacket(endpoint, new Packet(PacketType.NOTIFY, PresencePayloads.encodeNotify(notify)));
            ack.get(timeoutMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.debug("NOTIFY {} to {} not acknowledged in {}ms", notify.transferId(), peerId, timeoutMs);
            return false;
        } catch (ExecutionException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            pendingNotifies.remove(notify.transferId(), ack);
        }
    }

    private InetSocketAddress findEndpoint(String peerId) {
        for (Map.Entry<InetSocketAddress, PresenceSession> entry : sessions.entrySet()) {
            PresenceSession session = entry.getValue();
            if (!session.isClosed() && peerId.equals(session.boundPeerId())) {
                return entry.getKey();
            }
        }
        return null;
    }

    private void handlePacket(Packet packet, InetSocketAddress sender) {
        switch (packet.type()) {
            case ONLINE -> handleOnline(packet, sender);
            case HEARTBEAT -> handleHeartbeat(packet, sender);
            case OFFLINE -> handleOffline(packet, sender);
            case NOTIFY_ACK -> handleNotifyAck(packet);
            case PING -> sendPacket(sender, new Packet(PacketType.PONG, packet.sequence(), null));
            default -> log.debug("Unexpected type {} from {}", packet.type(), sender);
        }
    }

    private void handleOnline(Packet packet, InetSocketAddress sender) {
        PresencePayloads.Online online;
        try {
            online = PresencePayloads.decodeOnline(packet.payload());
        } catch (PacketException e) {
            sendError(sender, packet.sequence(), ERR_MALFORMED, e.getMessage());
            return;
        }
        String directEndpoint = online.directPort() > 0
                ? sender.getAddress().getHostAddress() + ":" + online.directPort()
                : null;

        PresenceSession session = sessions.computeIfAbsent(sender,
                s -> new PresenceSession(s.toString(), tracker));
        log.info("ONLINE from {} for peer '{}'", sender, online.peerId());
        boolean applied = session.handle(new PresenceEvent.UserOnline(
                online.peerId(), online.displayName(), online.contact(), directEndpoint));
        if (applied) {
            supersedeOthers(online.peerId(), sender);
        }
        reply(sender, packet.sequence(), applied, "Online rejected");
    }

    private void handleHeartbeat(Packet packet, InetSocketAddress sender) {
        PresenceSession session = sessions.get(sender);
        if (session == null) {
            sendError(sender, packet.sequence(), ERR_NO_SESSION, "No session, send ONLINE first");
            return;
        }
        try {
            String peerId = PresencePayloads.decodePeerId(packet.payload());
            boolean applied = session.handle(new PresenceEvent.Heartbeat(peerId));
            reply(sender, packet.sequence(), applied, "Heartbeat rejected");
        } catch (PacketException e) {
            sendError(sender, packet.sequence(), ERR_MALFORMED, e.getMessage());
        }
    }

    private void handleOffline(Packet packet, InetSocketAddress sender) {
        PresenceSession session = sessions.get(sender);
        if (session == null) {
            sendError(sender, packet.sequence(), ERR_NO_SESSION, "No session");
            return;
        }
        try {
            String peerId = PresencePayloads.decodePeerId(packet.payload());
            boolean applied = session.handle(new PresenceEvent.UserOffline(peerId));
            if (applied) {
                sessions.remove(sender, session);
            }
            reply(sender, packet.sequence(), applied, "Offline rejected");
        } catch (PacketException e) {
            sendError(sender, packet.sequence(), ERR_MALFORMED, e.getMessage());
        }
    }

    private void handleNotifyAck(Packet packet) {
        try {
            String transferId = PresencePayloads.decodePeerId(packet.payload());
            CompletableFuture<Void> ack = pendingNotifies.get(transferId);
            if (ack != null) {
                ack.complete(null);
            }
        } catch (PacketException e) {
            log.debug("Malformed NOTIFY_ACK: {}", e.getMessage());
        }
    }

    private void reply(InetSocketAddress dest, int sequence, boolean applied, String rejection) {
        if (applied) {
            sendPacket(dest, new Packet(PacketType.ACK, sequence, null));
        } else {
            sendError(dest, sequence, ERR_REJECTED, rejection);
        }
    }

    private void sendError(InetSocketAddress dest, int sequence, short code, String message) {
        sendPacket(dest, new Packet(PacketType.ERROR, sequence, PresencePayloads.encodeError(code, message)));
    }

    private void sendPacket(InetSocketAddress dest, Packet packet) {
        try {
            byte[] data = PacketCodec.encode(packet, psk);
            socket.send(new DatagramPacket(data, data.length, dest.getAddress(), dest.getPort()));
        } catch (IOException e) {
            log.error("Failed to send to {}: {}", dest, e.getMessage());
        }
    }

    /** One peer, one session: older sessions bound to the peer are dropped without marking it offline. */
    private void supersedeOthers(String peerId, InetSocketAddress current) {
        sessions.entrySet().removeIf(entry -> {
            if (entry.getKey().equals(current) || !peerId.equals(entry.getValue().boundPeerId())) {
                return false;
            }
            entry.getValue().supersede();
            return true;
        });
    }

    /** Expiry runs on a deadline, whether or not other traffic keeps the socket busy. */
    private void sweepIfDue() {
        long now = System.currentTimeMillis();
        if (now - lastSweep >= sweepIntervalMs()) {
            lastSweep = now;
            cleanExpiredSessions();
        }
    }

    private long sweepIntervalMs() {
        return Math.max(50, Math.min(1000, sessionTimeoutMs / 2));
    }

    private void cleanExpiredSessions() {
        long now = System.currentTimeMillis();
        sessions.entrySet().removeIf(entry -> {
            PresenceSession session = entry.getValue();
            boolean expired = (now - session.lastActivity()) > sessionTimeoutMs;
            if (expired) {
                log.debug("Session {} expired", entry.getKey());
                session.handle(new PresenceEvent.SessionClosed("idle for " + (now - session.lastActivity()) + "ms"));
            }
            return expired;
        });
    }
}
