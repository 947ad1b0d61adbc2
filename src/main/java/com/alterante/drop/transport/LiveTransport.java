package com.alterante.drop.transport;

import java.time.Duration;
import java.util.Optional;

/**
 * Source of live channels. Implementations classify every establishment
 * failure into exactly one {@link EstablishException.Failure}.
 */
public interface LiveTransport extends AutoCloseable {

    /** An already-established, still open channel to {@code peerId}. */
    Optional<LiveChannel> existing(String peerId);

    /**
     * Open a channel to {@code peerId}.
     *
     * @param timeout upper bound for the attempt
     */
    LiveChannel establish(String peerId, Duration timeout) throws EstablishException;

    /** Drop a channel that failed mid-transfer. */
    void discard(LiveChannel channel);

    @Override
    void close();
}
