package com.alterante.drop.command;

import com.alterante.drop.client.DropClient;
import com.alterante.drop.client.RemoteSignaling;
import com.alterante.drop.client.RemoteStaging;
import com.alterante.drop.error.ConnectionException;
import com.alterante.drop.error.NotFoundException;
import com.alterante.drop.router.Outcome;
import com.alterante.drop.router.TransferRouter;
import com.alterante.drop.transport.TcpLiveTransport;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "send",
        description = "Send a file to a peer, live if it is reachable, otherwise staged for pickup",
        mixinStandardHelpOptions = true
)
public class SendCommand implements Callable<Integer> {

    static final int EXIT_FAILED = 1;
    static final int EXIT_UNKNOWN_PEER = 2;
    static final int EXIT_CONNECTION = 3;

    @CommandLine.Option(names = {"--server", "-s"}, description = "Drop server URL (default: http://localhost:8080)",
            defaultValue = "http://localhost:8080")
    private String server;

    @CommandLine.Option(names = {"--peer-id"}, description = "Your peer id", required = true)
    private String peerId;

    @CommandLine.Option(names = {"--name"}, description = "Your display name", required = true)
    private String displayName;

    @CommandLine.Option(names = {"--to", "-t"}, description = "Receiver peer id", required = true)
    private String receiver;

    @CommandLine.Option(names = {"--file", "-f"}, description = "File to send", required = true)
    private Path file;

    @CommandLine.Option(names = {"--timeout"}, description = "Connect and send timeout in seconds (default: 30)",
            defaultValue = "30")
    private int timeoutSeconds;

    @CommandLine.Option(names = {"--json"}, description = "Output newline-delimited JSON events instead of human-readable text")
    private boolean json;

    @Override
    public Integer call() throws Exception {
        try {
            return doSend();
        } catch (Exception e) {
            if (json) {
                JsonOutput.error(e.getMessage());
                return EXIT_FAILED;
            }
            throw e;
        }
    }

    private Integer doSend() throws Exception {
        if (!Files.isRegularFile(file)) {
            String msg = "not a regular file: " + file;
            if (json) { JsonOutput.error(msg); return EXIT_FAILED; }
            System.err.println("Error: " + msg);
            return EXIT_FAILED;
        }

        Duration timeout = Duration.ofSeconds(timeoutSeconds);
        DropClient client = DropClient.create(server, timeout);
        if (!json) {
            System.out.println("File: " + file.getFileName() + " (" + formatSize(Files.size(file)) + ")");
            System.out.println("Looking up " + receiver + "...");
        } else {
            JsonOutput.status("connecting");
        }

        try (TcpLiveTransport transport = new TcpLiveTransport(peerId, new RemoteSignaling(client));
             TransferRouter router = new TransferRouter(peerId, displayName, transport,
                     new RemoteStaging(client), timeout, timeout)) {
            Outcome outcome = router.send(receiver, file);
            return report(outcome);
        } catch (NotFoundException e) {
            if (json) { JsonOutput.error(e.getMessage()); return EXIT_UNKNOWN_PEER; }
            System.err.println("Error: " + e.getMessage());
            return EXIT_UNKNOWN_PEER;
        } catch (ConnectionException e) {
            if (json) { JsonOutput.error(e.getMessage()); return EXIT_CONNECTION; }
            System.err.println("Connection error: " + e.getMessage() + " (try again later)");
            return EXIT_CONNECTION;
        }
    }

    private int report(Outcome outcome) {
        if (json) {
            JsonOutput.outcome(outcome);
            return outcome instanceof Outcome.TransferFailed ? EXIT_FAILED : 0;
        }
        if (outcome instanceof Outcome.DeliveredLive live) {
            System.out.println("Delivered " + live.fileName() + " directly to " + live.receiverPeerId());
            return 0;
        }
        if (outcome instanceof Outcome.Queued queued) {
            String who = queued.receiverDisplayName() != null ? queued.receiverDisplayName() : receiver;
            System.out.println(who + " is offline. File staged for pickup.");
            System.out.println("  Transfer: " + queued.transferId());
            System.out.println("  Blob:     " + queued.blobReference());
            return 0;
        }
        Outcome.TransferFailed failed = (Outcome.TransferFailed) outcome;
        System.err.println("Transfer failed: " + failed.reason());
        return EXIT_FAILED;
    }

    static String formatSize(long bytes) {
        if (bytes >= 1_000_000_000) return String.format("%.1f GB", bytes / 1_000_000_000.0);
        if (bytes >= 1_000_000) return String.format("%.1f MB", bytes / 1_000_000.0);
        if (bytes >= 1_000) return String.format("%.1f KB", bytes / 1_000.0);
        return bytes + " B";
    }
}
