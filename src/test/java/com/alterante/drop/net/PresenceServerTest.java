package com.alterante.drop.net;

import com.alterante.drop.identity.StoreIdentityDirectory;
import com.alterante.drop.presence.PresenceStatus;
import com.alterante.drop.presence.PresenceTracker;
import com.alterante.drop.protocol.*;
import com.alterante.drop.store.InMemoryRecordStore;
import org.junit.jupiter.api.*;

import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for PresenceServer and PresenceClient over loopback UDP.
 */
class PresenceServerTest {

    private static final String PSK = "test-secret";
    private static final int TIMEOUT_MS = 2000;

    private PresenceTracker tracker;
    private PresenceServer server;
    private Thread serverThread;
    private int serverPort;

    @BeforeEach
    void setUp() throws Exception {
        tracker = new PresenceTracker(new InMemoryRecordStore<>(),
                new StoreIdentityDirectory(new InMemoryRecordStore<>()),
                Clock.systemUTC(), Duration.ofMinutes(2));
        startServer(60_000);
    }

    private void startServer(long sessionTimeoutMs) throws Exception {
        server = new PresenceServer(0, PSK, sessionTimeoutMs, tracker);
        serverPort = server.bind();
        serverThread = new Thread(() -> {
            try {
                server.start();
            } catch (Exception e) {
                if (server.isRunning()) {
                    throw new RuntimeException(e);
                }
            }
        });
        serverThread.setDaemon(true);
        serverThread.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.stop();
        serverThread.join(3000);
    }

    private PresenceClient client(String peerId, int directPort) {
        return new PresenceClient(new InetSocketAddress(InetAddress.getLoopbackAddress(), serverPort), PSK,
                new PresencePayloads.Online(peerId, "Peer " + peerId, peerId + "@example.com", directPort),
                200);
    }

    @Test
    void connectMarksPeerOnlineWithDirectEndpoint() throws Exception {
        try (PresenceClient client = client("p1", 9701)) {
            client.connect();

            assertTrue(tracker.isReachable("p1"));
            assertEquals("127.0.0.1:9701", tracker.find("p1").orElseThrow().directEndpoint());
            assertEquals(1, server.sessionCount());
        }
    }

    @Test
    void closeSendsOffline() throws Exception {
        PresenceClient client = client("p1", 0);
        client.connect();
        client.close();

        assertTrue(waitFor(() -> tracker.find("p1").map(p -> p.status() == PresenceStatus.OFFLINE).orElse(false)),
                "peer should be offline after close");
        assertTrue(waitFor(() -> server.sessionCount() == 0));
    }

    @Test
    void heartbeatsRefreshTimestamp() throws Exception {
        try (PresenceClient client = client("p1", 0)) {
            client.connect();
            Instant first = tracker.find("p1").orElseThrow().lastHeartbeat();
            assertTrue(waitFor(() -> tracker.find("p1").orElseThrow().lastHeartbeat().isAfter(first)),
                    "heartbeat should move lastHeartbeat forward");
        }
    }

    @Test
    void notifyReachesClientAndIsAcknowledged() throws Exception {
        CompletableFuture<PresencePayloads.Notify> received = new CompletableFuture<>();
        try (PresenceClient client = client("p2", 0)) {
            client.setNotifyListener(received::complete);
            client.connect();

            PresencePayloads.Notify notify = new PresencePayloads.Notify("t-1", "Alice", "doc.pdf", 1024);
            assertTrue(server.notifyPeer("p2", notify, TIMEOUT_MS));
            assertEquals(notify, received.get(TIMEOUT_MS, TimeUnit.MILLISECONDS));
        }
    }

    @Test
    void notifyWithoutSessionFails() {
        assertFalse(server.notifyPeer("nobody", new PresencePayloads.Notify("t", "A", "f", 1), 100));
    }

    @Test
    void wrongKeyIsIgnored() {
        PresenceClient client = new PresenceClient(
                new InetSocketAddress(InetAddress.getLoopbackAddress(), serverPort), "wrong-key",
                new PresencePayloads.Online("p1", "Alice", "a", 0), 1000);
        try {
            assertThrows(PresenceClient.PresenceException.class, client::connect);
        } finally {
            client.close();
        }
        assertTrue(tracker.find("p1").isEmpty());
    }

    @Test
    void heartbeatWithoutSessionIsRejected() throws Exception {
        try (DatagramSocket raw = new DatagramSocket()) {
            raw.setSoTimeout(TIMEOUT_MS);
            send(raw, new Packet(PacketType.HEARTBEAT, 5, PresencePayloads.encodePeerId("p1")));
            Packet reply = receive(raw);
            assertEquals(PacketType.ERROR, reply.type());
            assertEquals(5, reply.sequence());
            assertEquals(PresenceServer.ERR_NO_SESSION, PresencePayloads.decodeError(reply.payload()).code());
        }
    }

    @Test
    void heartbeatForAnotherPeerIsRejected() throws Exception {
        try (DatagramSocket raw = new DatagramSocket()) {
            raw.setSoTimeout(TIMEOUT_MS);
            send(raw, new Packet(PacketType.ONLINE, 1,
                    PresencePayloads.encodeOnline(new PresencePayloads.Online("p1", "Alice", "a", 0))));
            assertEquals(PacketType.ACK, receive(raw).type());

            send(raw, new Packet(PacketType.HEARTBEAT, 2, PresencePayloads.encodePeerId("p9")));
            Packet reply = receive(raw);
            assertEquals(PacketType.ERROR, reply.type());
            assertEquals(PresenceServer.ERR_REJECTED, PresencePayloads.decodeError(reply.payload()).code());
        }
    }

    @Test
    void pingAnswered() throws Exception {
        try (DatagramSocket raw = new DatagramSocket()) {
            raw.setSoTimeout(TIMEOUT_MS);
            send(raw, new Packet(PacketType.PING, 77, null));
            Packet reply = receive(raw);
            assertEquals(PacketType.PONG, reply.type());
            assertEquals(77, reply.sequence());
        }
    }

    @Test
    void idleSessionExpiresAndMarksOffline() throws Exception {
        server.stop();
        serverThread.join(3000);
        startServer(300);

        try (DatagramSocket raw = new DatagramSocket()) {
            raw.setSoTimeout(TIMEOUT_MS);
            send(raw, new Packet(PacketType.ONLINE, 1,
                    PresencePayloads.encodeOnline(new PresencePayloads.Online("p1", "Alice", "a", 0))));
            assertEquals(PacketType.ACK, receive(raw).type());
            assertTrue(tracker.isReachable("p1"));

            assertTrue(waitFor(() -> !tracker.isReachable("p1")), "expired session should mark the peer offline");
            assertEquals(0, server.sessionCount());
        }
    }

    @Test
    void reannounceFromNewEndpointReplacesOldSession() throws Exception {
        server.stop();
        serverThread.join(3000);
        startServer(600);

        try (DatagramSocket old = new DatagramSocket();
             DatagramSocket fresh = new DatagramSocket()) {
            old.setSoTimeout(TIMEOUT_MS);
            fresh.setSoTimeout(TIMEOUT_MS);
            byte[] online = PresencePayloads.encodeOnline(new PresencePayloads.Online("p1", "Alice", "a", 0));

            send(old, new Packet(PacketType.ONLINE, 1, online));
            assertEquals(PacketType.ACK, receive(old).type());
            send(fresh, new Packet(PacketType.ONLINE, 1, online));
            assertEquals(PacketType.ACK, receive(fresh).type());
            assertEquals(1, server.sessionCount());

            // well past the old session's idle timeout
            for (int seq = 2; seq < 10; seq++) {
                Thread.sleep(200);
                send(fresh, new Packet(PacketType.HEARTBEAT, seq, PresencePayloads.encodePeerId("p1")));
                assertEquals(PacketType.ACK, receive(fresh).type());
            }

            assertTrue(tracker.isReachable("p1"));
            assertEquals(PresenceStatus.ONLINE, tracker.find("p1").orElseThrow().status());
            assertEquals(1, server.sessionCount());

            CompletableFuture<Packet> pushed = CompletableFuture.supplyAsync(() -> {
                try {
                    return receive(fresh);
                } catch (Exception e) {
                    throw new RuntimeException(e);
                }
            });
            server.notifyPeer("p1", new PresencePayloads.Notify("t-1", "Bob", "f.txt", 1), 200);
            assertEquals(PacketType.NOTIFY, pushed.get(TIMEOUT_MS, TimeUnit.MILLISECONDS).type(),
                    "NOTIFY goes to the newest session");
        }
    }

    @Test
    void idleSessionExpiresWhileOtherTrafficFlows() throws Exception {
        server.stop();
        serverThread.join(3000);
        startServer(300);

        try (DatagramSocket idle = new DatagramSocket();
             DatagramSocket chatty = new DatagramSocket()) {
            idle.setSoTimeout(TIMEOUT_MS);
            chatty.setSoTimeout(TIMEOUT_MS);
            send(idle, new Packet(PacketType.ONLINE, 1,
                    PresencePayloads.encodeOnline(new PresencePayloads.Online("p1", "Alice", "a", 0))));
            assertEquals(PacketType.ACK, receive(idle).type());

            long deadline = System.currentTimeMillis() + 3000;
            int seq = 0;
            while (System.currentTimeMillis() < deadline && server.sessionCount() > 0) {
                send(chatty, new Packet(PacketType.PING, ++seq, null));
                assertEquals(PacketType.PONG, receive(chatty).type());
                Thread.sleep(100);
            }

            assertEquals(0, server.sessionCount());
            assertFalse(tracker.isReachable("p1"));
        }
    }

    private void send(DatagramSocket socket, Packet packet) throws Exception {
        byte[] data = PacketCodec.encode(packet, PSK);
        socket.send(new DatagramPacket(data, data.length, InetAddress.getLoopbackAddress(), serverPort));
    }

    private Packet receive(DatagramSocket socket) throws Exception {
        byte[] buf = new byte[Packet.MAX_DATAGRAM];
        DatagramPacket dgram = new DatagramPacket(buf, buf.length);
        socket.receive(dgram);
        return PacketCodec.decode(buf, dgram.getLength(), PSK);
    }

    private static boolean waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(50);
        }
        return condition.getAsBoolean();
    }
}
