package com.alterante.drop.reconcile;

import com.alterante.drop.queue.DeliveryQueue;
import com.alterante.drop.queue.TransferRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Periodic sweep over READY transfers that offers each one to the registered
 * {@link TransferSubscriber}s.
 *
 * <p>Only one sweep runs at a time; a cycle that finds the previous sweep still
 * running is skipped. The reconciler reads the queue but never changes a
 * record's status.
 */
public class Reconciler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    private final DeliveryQueue queue;
    private final List<TransferSubscriber> subscribers;
    private final Duration interval;
    private final AtomicBoolean sweeping = new AtomicBoolean(false);
    private final Set<String> completed = ConcurrentHashMap.newKeySet();
    private final ScheduledExecutorService scheduler;
    private volatile boolean closed;

    public Reconciler(DeliveryQueue queue, List<TransferSubscriber> subscribers, Duration interval) {
        this.queue = queue;
        this.subscribers = List.copyOf(subscribers);
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "reconciler");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        long ms = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::scheduledSweep, ms, ms, TimeUnit.MILLISECONDS);
        log.info("Reconciler started: interval={}ms, subscribers={}", ms,
                subscribers.stream().map(TransferSubscriber::name).collect(Collectors.joining(",")));
    }

    /**
     * Run one sweep on the calling thread.
     *
     * @return the sweep's counters, or empty if another sweep was already running
     */
    public Optional<SweepReport> sweep() {
        if (closed || !sweeping.compareAndSet(false, true)) {
            log.debug("Sweep skipped, previous sweep still running");
            return Optional.empty();
        }
        try {
            return Optional.of(doSweep());
        } finally {
            sweeping.set(false);
        }
    }

    private void scheduledSweep() {
        try {
            sweep().ifPresent(report -> {
                if (report.notified() > 0 || report.failed() > 0) {
                    log.info("Sweep: {}", report);
                } else {
                    log.debug("Sweep: {}", report);
                }
            });
        } catch (RuntimeException e) {
            // an exception here would cancel the schedule
            log.error("Sweep failed", e);
        }
    }

    private SweepReport doSweep() {
        List<TransferRecord> pending = queue.listAllPending();
        int notified = 0;
        int failed = 0;
        int skipped = 0;

        for (TransferRecord snapshot : pending) {
            if (closed || Thread.currentThread().isInterrupted()) {
                break;
            }
            for (TransferSubscriber subscriber : subscribers) {
                String key = completionKey(subscriber, snapshot.id());
                if (completed.contains(key)) {
                    continue;
                }
                Optional<TransferRecord> current = queue.find(snapshot.id()).filter(TransferRecord::isReady);
                if (current.isEmpty()) {
                    skipped++;
                    break;
                }
                try {
                    if (subscriber.onReady(current.get())) {
                        completed.add(key);
                        notified++;
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (Exception e) {
                    failed++;
                    log.warn("Subscriber {} failed for transfer {}: {}", subscriber.name(), snapshot.id(), e.getMessage());
                }
            }
        }

        Set<String> live = pending.stream().map(TransferRecord::id).collect(Collectors.toSet());
        completed.removeIf(key -> !live.contains(key.substring(key.indexOf('/') + 1)));

        return new SweepReport(pending.size(), notified, failed, skipped);
    }

    boolean isCompleted(TransferSubscriber subscriber, String transferId) {
        return completed.contains(completionKey(subscriber, transferId));
    }

    private static String completionKey(TransferSubscriber subscriber, String transferId) {
        return subscriber.name() + "/" + transferId;
    }

    /**
     * Stop scheduling, let an in-flight sweep finish within a grace period, then
     * interrupt it.
     */
    @Override
    public void close() {
        closed = true;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Sweep still running after {}s, interrupting", SHUTDOWN_GRACE.toSeconds());
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Reconciler stopped");
    }
}
