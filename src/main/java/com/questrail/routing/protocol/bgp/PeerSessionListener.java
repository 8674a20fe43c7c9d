package com.questrail.routing.protocol.bgp;

import com.questrail.routing.protocol.bgp.config.BgpPeerConfig;
import com.questrail.routing.protocol.bgp.model.OpenMessage;
import com.questrail.routing.protocol.bgp.model.UpdateMessage;

/**
 * PeerSessionListener
 * -----------------------------------------------------------------------------
 * What a peer session reports upward, to whoever owns the routing table.
 *
 * <p>Callbacks are made from the session's driver thread. Implementations
 * must not block; the server coordinator only enqueues a message.</p>
 */
public interface PeerSessionListener
{
    /**
     * The session reached ESTABLISHED.
     *
     * @param session number of this Established session, to be quoted back
     *                when advertising routes to it
     */
    void onEstablished(BgpPeerConfig peer, OpenMessage peerOpen, long session);

    /**
     * An UPDATE was received on an Established session.
     */
    void onUpdate(BgpPeerConfig peer, UpdateMessage update);

    /**
     * An Established session ended. Everything learned from the peer must be
     * withdrawn.
     */
    void onSessionDown(BgpPeerConfig peer, String reason);

    /**
     * The peer asked for our routes again (ROUTE-REFRESH).
     */
    void onRefreshRequested(BgpPeerConfig peer);
}
