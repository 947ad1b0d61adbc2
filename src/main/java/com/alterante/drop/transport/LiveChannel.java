package com.alterante.drop.transport;

import java.io.IOException;
import java.nio.file.Path;

/**
 * An established point-to-point channel to one peer.
 */
public interface LiveChannel extends AutoCloseable {

    String peerId();

    /**
     * Send one file and block until the remote side confirms it.
     *
     * @throws IOException if the transfer fails or is not confirmed
     */
    void send(Path file, String fileName) throws IOException;

    boolean isOpen();

    @Override
    void close();
}
