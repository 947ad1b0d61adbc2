package com.alterante.drop.command;

import com.alterante.drop.client.DropClient;
import com.alterante.drop.error.DropException;
import com.alterante.drop.queue.TransferRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fetches staged transfers for one peer: download the blob, then acknowledge.
 * A transfer is only acknowledged after its bytes are on disk.
 *
 * <p>Safe to call from several threads: each transfer is claimed once, and a
 * claim is released only if the fetch fails.
 */
final class Inbox {

    private static final Logger log = LoggerFactory.getLogger(Inbox.class);

    private final DropClient client;
    private final String peerId;
    private final Path dir;
    private final Set<String> claimed = ConcurrentHashMap.newKeySet();

    Inbox(DropClient client, String peerId, Path dir) {
        this.client = client;
        this.peerId = peerId;
        this.dir = dir;
    }

    /** Fetch one transfer by id if it is still pending. */
    Optional<Path> fetch(String transferId) throws DropException, IOException {
        for (TransferRecord record : client.pending(peerId)) {
            if (record.id().equals(transferId)) {
                return fetch(record);
            }
        }
        log.debug("Transfer {} is no longer pending", transferId);
        return Optional.empty();
    }

    /**
     * @return the saved file, or empty if another caller already claimed the transfer
     */
    Optional<Path> fetch(TransferRecord record) throws DropException, IOException {
        if (!claimed.add(record.id())) {
            log.debug("Transfer {} already being fetched", record.id());
            return Optional.empty();
        }
        boolean done = false;
        Path target = null;
        try {
            target = reserveTarget(safeName(record.fileName()));
            client.download(record.blobUrl(), target);
            client.acknowledge(record.id(), peerId);
            done = true;
            log.info("Fetched {} from {} into {}", record.fileName(), record.senderDisplayName(), target);
            return Optional.of(target);
        } finally {
            if (!done) {
                claimed.remove(record.id());
                if (target != null) {
                    Files.deleteIfExists(target);
                }
            }
        }
    }

    // target names are picked under the inbox lock so concurrent fetches of same-named files differ
    private synchronized Path reserveTarget(String name) throws IOException {
        Files.createDirectories(dir);
        Path target = uniqueTarget(name);
        Files.createFile(target);
        return target;
    }

    private Path uniqueTarget(String name) {
        Path target = dir.resolve(name);
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : "";
        for (int i = 1; Files.exists(target); i++) {
            target = dir.resolve(base + " (" + i + ")" + ext);
        }
        return target;
    }

    static String safeName(String fileName) {
        if (fileName == null) {
            return "unnamed";
        }
        Path last = Path.of(fileName.replace('\\', '/')).getFileName();
        String name = last == null ? "" : last.toString().trim();
        return name.isEmpty() || name.equals(".") || name.equals("..") ? "unnamed" : name;
    }
}
