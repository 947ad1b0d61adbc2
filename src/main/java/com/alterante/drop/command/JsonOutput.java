package com.alterante.drop.command;

import com.alterante.drop.queue.TransferRecord;
import com.alterante.drop.router.Outcome;
import com.alterante.drop.util.Json;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Emits newline-delimited JSON events to stdout for machine-readable output.
 * Used by the client commands when --json flag is set.
 */
final class JsonOutput {

    private JsonOutput() {}

    static void status(String state) {
        emit(event("status").with("state", state));
    }

    static void outcome(Outcome outcome) {
        if (outcome instanceof Outcome.DeliveredLive live) {
            emit(event("delivered").with("receiver", live.receiverPeerId())
                    .with("file", live.fileName()).with("size", live.fileSize()));
        } else if (outcome instanceof Outcome.Queued queued) {
            emit(event("queued").with("transferId", queued.transferId())
                    .with("blobReference", queued.blobReference()).with("blobUrl", queued.blobUrl())
                    .with("receiverDisplayName", queued.receiverDisplayName()));
        } else if (outcome instanceof Outcome.TransferFailed failed) {
            emit(event("failed").with("reason", failed.reason()));
        }
    }

    static void pending(TransferRecord record) {
        emit(event("pending").with("transferId", record.id()).with("from", record.senderDisplayName())
                .with("file", record.fileName()).with("size", record.fileSize())
                .with("readyAt", record.readyAt().toString()));
    }

    static void received(String via, String from, Path path, long size) {
        emit(event("received").with("via", via).with("from", from)
                .with("path", path.toString()).with("size", size));
    }

    static void error(String message) {
        emit(event("error").with("message", message));
    }

    private static Event event(String name) {
        return new Event().with("event", name);
    }

    private static void emit(Event event) {
        System.out.println(Json.toJson(event.fields));
        System.out.flush();
    }

    private static final class Event {
        private final Map<String, Object> fields = new LinkedHashMap<>();

        Event with(String key, Object value) {
            fields.put(key, value);
            return this;
        }
    }
}
