package com.alterante.drop.router;

import com.alterante.drop.error.ConnectionException;
import com.alterante.drop.error.NotFoundException;
import com.alterante.drop.error.UpstreamException;
import com.alterante.drop.transport.EstablishException;
import com.alterante.drop.transport.EstablishException.Failure;
import com.alterante.drop.transport.LiveChannel;
import com.alterante.drop.transport.LiveTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TransferRouterTest {

    private static final Duration TIMEOUT = Duration.ofMillis(500);

    @TempDir
    Path tempDir;

    private FakeTransport transport;
    private FakeStaging staging;
    private TransferRouter router;
    private Path file;

    @BeforeEach
    void setUp() throws Exception {
        transport = new FakeTransport();
        staging = new FakeStaging();
        router = new TransferRouter("p1", "Alice", transport, staging, TIMEOUT, TIMEOUT);
        file = Files.writeString(tempDir.resolve("doc.pdf"), "0123456789");
    }

    @AfterEach
    void tearDown() {
        router.close();
    }

    @Test
    void deliversLiveWhenChannelEstablishes() throws Exception {
        Outcome outcome = router.send("p2", file);

        assertEquals(new Outcome.DeliveredLive("p2", "doc.pdf", 10), outcome);
        assertEquals(List.of("doc.pdf"), transport.channel.sent);
        assertTrue(staging.requests.isEmpty());
    }

    @Test
    void reusesExistingChannel() throws Exception {
        transport.existing = transport.channel;
        transport.failure = Failure.CONNECTION_ERROR; // establish would fail

        assertInstanceOf(Outcome.DeliveredLive.class, router.send("p2", file));
        assertEquals(0, transport.establishCalls);
    }

    @Test
    void failedSendOnExistingChannelIsNotQueued() throws Exception {
        transport.existing = transport.channel;
        transport.channel.sendError = new IOException("reset by peer");

        Outcome outcome = router.send("p2", file);

        assertEquals(new Outcome.TransferFailed("reset by peer"), outcome);
        assertTrue(staging.requests.isEmpty());
        assertTrue(transport.discarded);
    }

    @Test
    void sendFailureWithoutMessageIsNamedByItsType() throws Exception {
        transport.existing = transport.channel;
        transport.channel.sendError = new IOException();

        Outcome outcome = router.send("p2", file);

        assertEquals(new Outcome.TransferFailed("IOException"), outcome);
        assertTrue(staging.requests.isEmpty());
    }

    @Test
    void unreachablePeerFallsBackToStaging() throws Exception {
        transport.failure = Failure.PEER_UNREACHABLE;

        Outcome outcome = router.send("p2", file);

        assertEquals(new Outcome.Queued("hash", "http://blobs/hash", "Bob", "t-1"), outcome);
        assertEquals(1, staging.requests.size());
        StagingRequest request = staging.requests.get(0);
        assertEquals("p1", request.senderPeerId());
        assertEquals("Alice", request.senderDisplayName());
        assertEquals("p2", request.receiverPeerId());
        assertEquals("doc.pdf", request.fileName());
    }

    @Test
    void failedUploadIsTransferFailed() throws Exception {
        transport.failure = Failure.PEER_UNREACHABLE;
        staging.error = new UpstreamException("pinning service down");

        Outcome outcome = router.send("p2", file);

        assertEquals(new Outcome.TransferFailed("pinning service down"), outcome);
    }

    @Test
    void connectionErrorIsThrownNotQueued() {
        transport.failure = Failure.CONNECTION_ERROR;
        assertThrows(ConnectionException.class, () -> router.send("p2", file));
        assertTrue(staging.requests.isEmpty());
    }

    @Test
    void unknownPeerIsThrownNotQueued() {
        transport.failure = Failure.PEER_UNKNOWN;
        assertThrows(NotFoundException.class, () -> router.send("ghost", file));
        assertTrue(staging.requests.isEmpty());
    }

    @Test
    void hangingEstablishmentTimesOut() {
        transport.establishDelay = Duration.ofSeconds(10);
        long start = System.nanoTime();

        assertThrows(ConnectionException.class, () -> router.send("p2", file));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(5)) < 0);
        assertTrue(staging.requests.isEmpty());
    }

    @Test
    void hangingSendTimesOut() {
        transport.channel.sendDelay = Duration.ofSeconds(10);

        assertThrows(ConnectionException.class, () -> router.send("p2", file));
        assertTrue(transport.discarded);
    }

    // --- fakes ---

    private static final class FakeChannel implements LiveChannel {
        final List<String> sent = new ArrayList<>();
        IOException sendError;
        Duration sendDelay = Duration.ZERO;
        boolean open = true;

        @Override
        public String peerId() {
            return "p2";
        }

        @Override
        public void send(Path file, String fileName) throws IOException {
            if (!sendDelay.isZero()) {
                try {
                    Thread.sleep(sendDelay.toMillis());
                } catch (InterruptedException e) {
                    throw new IOException("interrupted", e);
                }
            }
            if (sendError != null) {
                throw sendError;
            }
            sent.add(fileName);
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            open = false;
        }
    }

    private static final class FakeTransport implements LiveTransport {
        final FakeChannel channel = new FakeChannel();
        LiveChannel existing;
        Failure failure;
        Duration establishDelay = Duration.ZERO;
        volatile int establishCalls;
        volatile boolean discarded;

        @Override
        public Optional<LiveChannel> existing(String peerId) {
            return Optional.ofNullable(existing);
        }

        @Override
        public LiveChannel establish(String peerId, Duration timeout) throws EstablishException {
            establishCalls++;
            if (!establishDelay.isZero()) {
                try {
                    Thread.sleep(establishDelay.toMillis());
                } catch (InterruptedException e) {
                    throw new EstablishException(Failure.CONNECTION_ERROR, "interrupted", e);
                }
            }
            if (failure != null) {
                throw new EstablishException(failure, "simulated " + failure);
            }
            return channel;
        }

        @Override
        public void discard(LiveChannel channel) {
            discarded = true;
            channel.close();
        }

        @Override
        public void close() {
        }
    }

    private static final class FakeStaging implements OfflineStaging {
        final List<StagingRequest> requests = new ArrayList<>();
        UpstreamException error;

        @Override
        public Outcome.Queued stage(StagingRequest request) throws UpstreamException {
            requests.add(request);
            if (error != null) {
                throw error;
            }
            return new Outcome.Queued("hash", "http://blobs/hash", "Bob", "t-1");
        }
    }
}
