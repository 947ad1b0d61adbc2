package com.alterante.drop.router;

import com.alterante.drop.error.ConnectionException;
import com.alterante.drop.error.DropException;
import com.alterante.drop.error.NotFoundException;
import com.alterante.drop.error.UpstreamException;
import com.alterante.drop.transport.EstablishException;
import com.alterante.drop.transport.LiveChannel;
import com.alterante.drop.transport.LiveTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sender-side decision between the live channel and the queued fallback.
 *
 * <ol>
 *   <li>An open channel to the receiver is used as is. A failed send is
 *       {@link Outcome.TransferFailed}: the peer was reachable a moment ago, so
 *       nothing is queued.</li>
 *   <li>Otherwise a channel is established. Only
 *       {@link EstablishException.Failure#PEER_UNREACHABLE} falls back to
 *       {@link OfflineStaging}. Connection errors and unknown peers are thrown.</li>
 * </ol>
 *
 * Establishment and each send run on a worker thread and are abandoned once
 * their timeout expires.
 */
public class TransferRouter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TransferRouter.class);

    private final String senderPeerId;
    private final String senderDisplayName;
    private final LiveTransport transport;
    private final OfflineStaging staging;
    private final Duration establishTimeout;
    private final Duration sendTimeout;
    private final ExecutorService executor;

    public TransferRouter(String senderPeerId, String senderDisplayName, LiveTransport transport,
                          OfflineStaging staging, Duration establishTimeout, Duration sendTimeout) {
        this.senderPeerId = senderPeerId;
        this.senderDisplayName = senderDisplayName;
        this.transport = transport;
        this.staging = staging;
        this.establishTimeout = establishTimeout;
        this.sendTimeout = sendTimeout;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "transfer-router");
            t.setDaemon(true);
            return t;
        });
    }

    public Outcome send(String receiverPeerId, Path file) throws DropException {
        return send(receiverPeerId, file, file.getFileName().toString());
    }

    /**
     * @throws ConnectionException on a transient network or signaling failure, or a timeout
     * @throws NotFoundException   if the receiver is not a registered peer
     */
    public Outcome send(String receiverPeerId, Path file, String fileName) throws DropException {
        Optional<LiveChannel> open = transport.existing(receiverPeerId);
        if (open.isPresent()) {
            log.debug("Reusing live channel to {}", receiverPeerId);
            return sendLive(open.get(), file, fileName);
        }

        LiveChannel channel;
        try {
            channel = bounded(() -> transport.establish(receiverPeerId, establishTimeout), establishTimeout);
        } catch (TimeoutException e) {
            throw new ConnectionException("Timed out establishing a channel to " + receiverPeerId);
        } catch (ExecutionException e) {
            if (!(e.getCause() instanceof EstablishException failure)) {
                throw new ConnectionException("Establishing a channel to " + receiverPeerId + " failed", e.getCause());
            }
            switch (failure.failure()) {
                case PEER_UNKNOWN -> throw new NotFoundException(failure.getMessage());
                case CONNECTION_ERROR -> throw new ConnectionException(failure.getMessage(), failure);
                default -> {
                    return fallback(receiverPeerId, file, fileName, failure.getMessage());
                }
            }
        }
        return sendLive(channel, file, fileName);
    }

    private Outcome sendLive(LiveChannel channel, Path file, String fileName) throws ConnectionException {
        try {
            long size = Files.size(file);
            bounded(() -> {
                channel.send(file, fileName);
                return null;
            }, sendTimeout);
            log.info("Delivered {} to {} over live channel", fileName, channel.peerId());
            return new Outcome.DeliveredLive(channel.peerId(), fileName, size);
        } catch (TimeoutException e) {
            transport.discard(channel);
            throw new ConnectionException("Timed out sending " + fileName + " to " + channel.peerId());
        } catch (ExecutionException e) {
            transport.discard(channel);
            String reason = describe(e.getCause());
            log.warn("Live send of {} to {} failed: {}", fileName, channel.peerId(), reason);
            return new Outcome.TransferFailed(reason);
        } catch (IOException e) {
            return new Outcome.TransferFailed("Cannot read " + file + ": " + e.getMessage());
        }
    }

    private Outcome fallback(String receiverPeerId, Path file, String fileName, String reason) throws DropException {
        log.info("{} unreachable ({}), staging {} for later pickup", receiverPeerId, reason, fileName);
        try {
            return staging.stage(new StagingRequest(senderPeerId, senderDisplayName, receiverPeerId, file, fileName));
        } catch (UpstreamException e) {
            String failure = describe(e);
            log.warn("Staging {} for {} failed: {}", fileName, receiverPeerId, failure);
            return new Outcome.TransferFailed(failure);
        }
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getSimpleName();
    }

    private <T> T bounded(Callable<T> task, Duration timeout) throws TimeoutException, ExecutionException {
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExecutionException("Interrupted", e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
