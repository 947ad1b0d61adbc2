package com.alterante.drop.command;

import com.alterante.drop.client.DropClient;
import com.alterante.drop.error.DropException;
import com.alterante.drop.net.PresenceClient;
import com.alterante.drop.protocol.PresencePayloads;
import com.alterante.drop.queue.TransferRecord;
import com.alterante.drop.transport.DirectReceiver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * Stay online: announce presence, accept live channels and pick up staged
 * files as soon as the server pushes a NOTIFY.
 */
@CommandLine.Command(
        name = "online",
        description = "Go online and receive files until interrupted",
        mixinStandardHelpOptions = true
)
public class OnlineCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(OnlineCommand.class);

    @CommandLine.Option(names = {"--server", "-s"}, description = "Drop server URL (default: http://localhost:8080)",
            defaultValue = "http://localhost:8080")
    private String server;

    @CommandLine.Option(names = {"--presence"}, description = "Presence server (host:port)", required = true)
    private String presence;

    @CommandLine.Option(names = {"--psk"}, description = "Pre-shared key for presence packets")
    private String psk;

    @CommandLine.Option(names = {"--peer-id"}, description = "Your peer id", required = true)
    private String peerId;

    @CommandLine.Option(names = {"--name"}, description = "Your display name", required = true)
    private String displayName;

    @CommandLine.Option(names = {"--contact"}, description = "Contact address", required = true)
    private String contact;

    @CommandLine.Option(names = {"--output", "-o"}, description = "Download directory", required = true)
    private Path outputDir;

    @CommandLine.Option(names = {"--direct-port"}, description = "TCP port for live channels (default: 9701)",
            defaultValue = "9701")
    private int directPort;

    @CommandLine.Option(names = {"--heartbeat"}, description = "Heartbeat interval in seconds (default: 30)",
            defaultValue = "30")
    private int heartbeatSeconds;

    @CommandLine.Option(names = {"--max-size"}, description = "Largest live file accepted, in bytes (default: 100 MB)",
            defaultValue = "104857600")
    private long maxFileSize;

    @CommandLine.Option(names = {"--json"}, description = "Output newline-delimited JSON events instead of human-readable text")
    private boolean json;

    @Override
    public Integer call() throws Exception {
        try {
            return doOnline();
        } catch (Exception e) {
            if (json) {
                JsonOutput.error(e.getMessage());
                return 1;
            }
            throw e;
        }
    }

    private Integer doOnline() throws Exception {
        DropClient client = DropClient.create(server, Duration.ofSeconds(30));
        Inbox inbox = new Inbox(client, peerId, outputDir);

        DirectReceiver receiver = new DirectReceiver(peerId, directPort, outputDir, maxFileSize, file -> {
            if (json) {
                JsonOutput.received("live", file.senderPeerId(), file.path(), file.size());
            } else {
                System.out.println("Received " + file.path().getFileName() + " from " + file.senderPeerId());
            }
        });
        int boundPort = receiver.start();

        PresenceClient presenceClient = new PresenceClient(parseAddress(presence), psk,
                new PresencePayloads.Online(peerId, displayName, contact, boundPort),
                heartbeatSeconds * 1000L);
        presenceClient.setNotifyListener(notify -> pickUp(inbox, notify));

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (!json) System.out.println("\nGoing offline...");
            presenceClient.close();
            receiver.close();
            stopped.countDown();
        }));

        presenceClient.connect();
        if (json) {
            JsonOutput.status("online");
        } else {
            System.out.println("Online as " + peerId + ", live channels on port " + boundPort);
        }

        // anything staged while we were away
        for (TransferRecord record : client.pending(peerId)) {
            fetchQuietly(inbox, record);
        }

        stopped.await();
        return 0;
    }

    private void pickUp(Inbox inbox, PresencePayloads.Notify notify) {
        if (!json) {
            System.out.println(notify.senderDisplayName() + " sent " + notify.fileName()
                    + " (" + SendCommand.formatSize(notify.fileSize()) + ")");
        }
        try {
            inbox.fetch(notify.transferId()).ifPresent(path -> announce(notify.senderDisplayName(), path, notify.fileSize()));
        } catch (DropException | IOException e) {
            log.warn("Fetching transfer {} failed: {}", notify.transferId(), e.getMessage());
        }
    }

    private void fetchQuietly(Inbox inbox, TransferRecord record) {
        try {
            inbox.fetch(record).ifPresent(path -> announce(record.senderDisplayName(), path, record.fileSize()));
        } catch (DropException | IOException e) {
            log.warn("Fetching transfer {} failed: {}", record.id(), e.getMessage());
        }
    }

    private void announce(String from, Path path, long size) {
        if (json) {
            JsonOutput.received("queue", from, path, size);
        } else {
            System.out.println("Saved " + path);
        }
    }

    private InetSocketAddress parseAddress(String addr) {
        String[] parts = addr.split(":");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Presence address must be host:port, got: " + addr);
        }
        return new InetSocketAddress(parts[0], Integer.parseInt(parts[1]));
    }
}
