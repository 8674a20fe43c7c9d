package com.questrail.routing.protocol.bgp.transport;

/**
 * StreamTransportListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link StreamTransport}.
 *
 * <p>Callbacks for one channel are serialized (Netty delivers them on the
 * channel's event loop). Callbacks carry the channel they concern, so a
 * listener can ignore traffic from a connection it has already abandoned.</p>
 */
public interface StreamTransportListener
{
    /**
     * A connection is open, outbound or accepted.
     */
    void onConnected(StreamChannel channel);

    /**
     * An outbound connection attempt failed.
     */
    void onConnectFailed(Throwable cause);

    /**
     * One complete message (header included) was received.
     */
    void onMessage(StreamChannel channel, byte[] message);

    /**
     * The stream cannot be split into messages (length field out of range).
     * The connection is unusable; the listener decides what to tell the peer.
     */
    void onFramingError(StreamChannel channel, String reason);

    /**
     * The connection closed.
     *
     * @param cause the failure, or {@code null} for an orderly close
     */
    void onDisconnected(StreamChannel channel, Throwable cause);
}
