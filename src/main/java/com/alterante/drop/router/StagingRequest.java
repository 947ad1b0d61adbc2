package com.alterante.drop.router;

import java.nio.file.Path;

/**
 * A file to be staged for a receiver that is not reachable right now.
 */
public record StagingRequest(String senderPeerId, String senderDisplayName, String receiverPeerId,
                             Path file, String fileName) {
}
