package com.questrail.routing.core;

import com.questrail.routing.api.PeerStatus;
import com.questrail.routing.protocol.bgp.config.BgpPeerConfig;
import com.questrail.routing.protocol.bgp.model.UpdateMessage;

import java.util.List;

/**
 * PeerSessionHandle
 * -----------------------------------------------------------------------------
 * What the coordinator may do to one peer session.
 *
 * <p>Every method except {@link #stop()} only enqueues work for the session's
 * own thread and returns immediately.</p>
 */
public interface PeerSessionHandle
{
    BgpPeerConfig config();

    /**
     * Starts the session thread and administratively enables the peer.
     */
    void start();

    /** Administrative enable: leave IDLE and (re)connect. */
    void enable();

    /** Administrative disable: Cease / Administrative Shutdown, stay IDLE. */
    void disable();

    /**
     * Permanently stops the session: Cease / Peer De-configured if connected,
     * timers cancelled, transport closed. Blocks until the session thread has
     * finished.
     */
    void stop();

    /**
     * Hands UPDATEs to the Established session numbered {@code session}.
     * They are dropped if that session has ended in the meantime.
     */
    void advertise(long session, List<UpdateMessage> updates);

    PeerStatus status();
}
