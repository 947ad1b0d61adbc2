package com.alterante.drop.transport;

import com.alterante.drop.transport.EstablishException.Failure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Live channels over plain TCP to the peer's {@link DirectReceiver}.
 *
 * <p>Open channels are cached per peer and reused until they fail or the
 * transport is closed.
 */
public class TcpLiveTransport implements LiveTransport {

    private static final Logger log = LoggerFactory.getLogger(TcpLiveTransport.class);

    private final String localPeerId;
    private final Signaling signaling;
    private final ConcurrentMap<String, TcpChannel> channels = new ConcurrentHashMap<>();

    public TcpLiveTransport(String localPeerId, Signaling signaling) {
        this.localPeerId = localPeerId;
        this.signaling = signaling;
    }

    @Override
    public Optional<LiveChannel> existing(String peerId) {
        TcpChannel channel = channels.get(peerId);
        if (channel == null) {
            return Optional.empty();
        }
        if (!channel.isOpen()) {
            channels.remove(peerId, channel);
            return Optional.empty();
        }
        return Optional.of(channel);
    }

    @Override
    public LiveChannel establish(String peerId, Duration timeout) throws EstablishException {
        Signaling.Lookup lookup;
        try {
            lookup = signaling.locate(peerId);
        } catch (IOException e) {
            throw new EstablishException(Failure.CONNECTION_ERROR, "Signaling failed: " + e.getMessage(), e);
        }

        switch (lookup.state()) {
            case UNKNOWN -> throw new EstablishException(Failure.PEER_UNKNOWN, "Unknown peer " + peerId);
            case ABSENT -> throw new EstablishException(Failure.PEER_UNREACHABLE, "Peer " + peerId + " is not reachable");
            default -> { }
        }

        InetSocketAddress endpoint = new InetSocketAddress(lookup.endpoint().getHostString(), lookup.endpoint().getPort());
        if (endpoint.isUnresolved()) {
            throw new EstablishException(Failure.CONNECTION_ERROR, "Cannot resolve " + lookup.endpoint().getHostString());
        }

        int timeoutMs = (int) Math.max(1, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
        Socket socket = new Socket();
        try {
            socket.connect(endpoint, timeoutMs);
            socket.setSoTimeout(timeoutMs);
            socket.setTcpNoDelay(true);
            TcpChannel channel = new TcpChannel(peerId, socket);
            byte reply = channel.hello(localPeerId);
            if (reply == DirectFrames.REPLY_WRONG_PEER) {
                channel.close();
                throw new EstablishException(Failure.PEER_UNREACHABLE,
                        "Endpoint " + endpoint + " no longer belongs to " + peerId);
            }
            if (reply != DirectFrames.REPLY_ACCEPT) {
                channel.close();
                throw new EstablishException(Failure.CONNECTION_ERROR, "Unexpected handshake reply " + reply);
            }
            socket.setSoTimeout(0);

            TcpChannel previous = channels.put(peerId, channel);
            if (previous != null) {
                previous.close();
            }
            log.info("Live channel to {} at {}", peerId, endpoint);
            return channel;
        } catch (ConnectException e) {
            closeQuietly(socket);
            throw new EstablishException(Failure.PEER_UNREACHABLE, "Peer " + peerId + " refused connection", e);
        } catch (SocketTimeoutException e) {
            closeQuietly(socket);
            throw new EstablishException(Failure.CONNECTION_ERROR, "Timed out connecting to " + peerId, e);
        } catch (IOException e) {
            closeQuietly(socket);
            throw new EstablishException(Failure.CONNECTION_ERROR, "Connection to " + peerId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void discard(LiveChannel channel) {
        channels.remove(channel.peerId(), channel);
        channel.close();
    }

    @Override
    public void close() {
        for (TcpChannel channel : channels.values()) {
            channel.close();
        }
        channels.clear();
    }

    int openChannels() {
        return channels.size();
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing socket: {}", e.getMessage());
        }
    }
}
