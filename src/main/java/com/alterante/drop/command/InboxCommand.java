package com.alterante.drop.command;

import com.alterante.drop.client.DropClient;
import com.alterante.drop.queue.TransferRecord;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "inbox",
        description = "List, fetch or acknowledge files staged for you",
        mixinStandardHelpOptions = true
)
public class InboxCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"--server", "-s"}, description = "Drop server URL (default: http://localhost:8080)",
            defaultValue = "http://localhost:8080")
    private String server;

    @CommandLine.Option(names = {"--peer-id"}, description = "Your peer id", required = true)
    private String peerId;

    @CommandLine.Option(names = {"--fetch"}, description = "Download every pending file and acknowledge it")
    private boolean fetch;

    @CommandLine.Option(names = {"--ack"}, description = "Acknowledge one transfer without downloading it")
    private String ackId;

    @CommandLine.Option(names = {"--output", "-o"}, description = "Download directory (default: .)", defaultValue = ".")
    private Path outputDir;

    @CommandLine.Option(names = {"--json"}, description = "Output newline-delimited JSON events instead of human-readable text")
    private boolean json;

    @Override
    public Integer call() throws Exception {
        try {
            return doInbox();
        } catch (Exception e) {
            if (json) {
                JsonOutput.error(e.getMessage());
                return 1;
            }
            throw e;
        }
    }

    private Integer doInbox() throws Exception {
        DropClient client = DropClient.create(server, Duration.ofSeconds(30));

        if (ackId != null) {
            TransferRecord record = client.acknowledge(ackId, peerId);
            if (json) {
                JsonOutput.status("acknowledged");
            } else {
                System.out.println("Acknowledged " + record.fileName() + " (" + record.id() + ")");
            }
            return 0;
        }

        List<TransferRecord> pending = client.pending(peerId);
        if (!fetch) {
            if (json) {
                pending.forEach(JsonOutput::pending);
            } else if (pending.isEmpty()) {
                System.out.println("No pending files.");
            } else {
                System.out.println(pending.size() + " pending:");
                for (TransferRecord r : pending) {
                    System.out.printf("  %s  %-30s %10s  from %s%n",
                            r.id(), r.fileName(), SendCommand.formatSize(r.fileSize()), r.senderDisplayName());
                }
            }
            return 0;
        }

        Inbox inbox = new Inbox(client, peerId, outputDir);
        for (TransferRecord record : pending) {
            Optional<Path> fetched = inbox.fetch(record);
            if (fetched.isEmpty()) {
                continue;
            }
            Path saved = fetched.get();
            if (json) {
                JsonOutput.received("queue", record.senderDisplayName(), saved, record.fileSize());
            } else {
                System.out.println("Saved " + saved + " from " + record.senderDisplayName());
            }
        }
        return 0;
    }
}
