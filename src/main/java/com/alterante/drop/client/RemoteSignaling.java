package com.alterante.drop.client;

import com.alterante.drop.error.ConnectionException;
import com.alterante.drop.error.DropException;
import com.alterante.drop.error.NotFoundException;
import com.alterante.drop.presence.PresenceView;
import com.alterante.drop.transport.Signaling;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * Signaling through {@code GET /api/user/status/{peerId}}.
 */
public class RemoteSignaling implements Signaling {

    private final DropClient client;

    public RemoteSignaling(DropClient client) {
        this.client = client;
    }

    @Override
    public Lookup locate(String peerId) throws IOException {
        PresenceView view;
        try {
            view = client.status(peerId);
        } catch (NotFoundException e) {
            return Lookup.unknown();
        } catch (ConnectionException e) {
            throw new IOException(e.getMessage(), e);
        } catch (DropException e) {
            throw new IOException("Presence lookup for " + peerId + " failed: " + e.getMessage(), e);
        }
        if (!view.reachable()) {
            return Lookup.absent();
        }
        InetSocketAddress endpoint = Signaling.parseEndpoint(view.directEndpoint());
        return endpoint == null ? Lookup.absent() : Lookup.present(endpoint);
    }
}
