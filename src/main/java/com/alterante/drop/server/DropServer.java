package com.alterante.drop.server;

import com.alterante.drop.api.DropHttpServer;
import com.alterante.drop.blob.BlobStore;
import com.alterante.drop.blob.LocalBlobStore;
import com.alterante.drop.blob.PinataBlobStore;
import com.alterante.drop.config.DropConfig;
import com.alterante.drop.identity.PeerIdentity;
import com.alterante.drop.identity.StoreIdentityDirectory;
import com.alterante.drop.net.PresenceServer;
import com.alterante.drop.presence.PeerPresence;
import com.alterante.drop.presence.PresenceTracker;
import com.alterante.drop.queue.DeliveryQueue;
import com.alterante.drop.queue.TransferRecord;
import com.alterante.drop.reconcile.PresenceNotifier;
import com.alterante.drop.reconcile.Reconciler;
import com.alterante.drop.router.BlobStaging;
import com.alterante.drop.store.FileRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.time.Clock;
import java.util.List;

/**
 * Wires the server side together: file-backed stores, presence tracking over
 * UDP, the delivery queue, blob staging, the reconciler and the HTTP API.
 * Every collaborator is created here and passed down explicitly.
 */
public class DropServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DropServer.class);

    private final DropConfig config;
    private final StoreIdentityDirectory identities;
    private final PresenceTracker presence;
    private final DeliveryQueue queue;
    private final BlobStore blobs;
    private final PresenceServer presenceServer;
    private final Reconciler reconciler;
    private final DropHttpServer http;

    private Thread presenceThread;

    public DropServer(DropConfig config, Clock clock) {
        this.config = config;

        identities = new StoreIdentityDirectory(
                new FileRecordStore<>(config.identitiesFile(), PeerIdentity.class));
        for (PeerIdentity peer : config.peers()) {
            identities.register(peer);
        }

        presence = new PresenceTracker(new FileRecordStore<>(config.presenceFile(), PeerPresence.class),
                identities, clock, config.stalenessWindow());
        queue = new DeliveryQueue(new FileRecordStore<>(config.transfersFile(), TransferRecord.class),
                identities, clock);

        LocalBlobStore local = null;
        if (DropConfig.BACKEND_PINATA.equals(config.blobBackend())) {
            HttpClient client = HttpClient.newBuilder().connectTimeout(config.uploadTimeout()).build();
            blobs = new PinataBlobStore(client, config.pinataEndpoint(), config.pinataJwt(),
                    config.pinataGateway(), config.uploadTimeout());
        } else if (DropConfig.BACKEND_LOCAL.equals(config.blobBackend())) {
            local = new LocalBlobStore(config.blobDir(), config.publicUrl());
            blobs = local;
        } else {
            throw new IllegalArgumentException("Unknown blob backend: " + config.blobBackend());
        }

        presenceServer = new PresenceServer(config.presencePort(), config.psk(),
                config.sessionTimeout().toMillis(), presence);
        reconciler = new Reconciler(queue,
                List.of(new PresenceNotifier(presenceServer, presence, config.notifyAckTimeout().toMillis())),
                config.reconcileInterval());
        http = new DropHttpServer(config.httpPort(), config.maxUploadBytes(), config.spoolDir(), presence,
                queue, identities, new BlobStaging(blobs, queue, identities, clock), local);
    }

    public synchronized void start() throws IOException {
        Files.createDirectories(config.dataDir());
        presenceServer.bind();
        presenceThread = new Thread(() -> {
            try {
                presenceServer.start();
            } catch (IOException e) {
                log.error("Presence server failed", e);
            }
        }, "presence-server");
        presenceThread.setDaemon(true);
        presenceThread.start();

        http.start();
        reconciler.start();
        log.info("Drop server up: http={}, presence={}, blobs={}, peers={}",
                http.localPort(), presenceServer.localPort(), config.blobBackend(), identities.count());
    }

    public int httpPort() {
        return http.localPort();
    }

    public int presencePort() {
        return presenceServer.localPort();
    }

    public PresenceTracker presence() {
        return presence;
    }

    public DeliveryQueue queue() {
        return queue;
    }

    public StoreIdentityDirectory identities() {
        return identities;
    }

    public Reconciler reconciler() {
        return reconciler;
    }

    @Override
    public synchronized void close() {
        http.close();
        reconciler.close();
        presenceServer.stop();
        if (presenceThread != null) {
            try {
                presenceThread.join(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Drop server stopped");
    }
}
