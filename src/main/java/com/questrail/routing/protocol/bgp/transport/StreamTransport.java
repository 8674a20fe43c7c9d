package com.questrail.routing.protocol.bgp.transport;

import java.net.InetSocketAddress;

/**
 * StreamTransport
 * -----------------------------------------------------------------------------
 * Port for a message-delimited stream transport (BGP over TCP).
 *
 * <p>Implementations split the byte stream into whole BGP messages using the
 * header length field and deliver each message as one {@code byte[]}.
 * Everything above this port is free of socket and buffer types.</p>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.</p>
 */
public interface StreamTransport
{
    /**
     * Start an outbound connection. The outcome is reported to
     * {@code listener}: {@link StreamTransportListener#onConnected} or
     * {@link StreamTransportListener#onConnectFailed}.
     */
    void connect(InetSocketAddress remote, StreamTransportListener listener);

    /**
     * Accept inbound connections on {@code bindAddress}. Each accepted
     * connection is offered to {@code acceptor}; a {@code null} listener
     * rejects (closes) it.
     *
     * @return the address actually bound (useful with port 0)
     */
    InetSocketAddress listen(InetSocketAddress bindAddress, InboundConnectionAcceptor acceptor);

    /**
     * Close every connection and release all transport resources.
     */
    void stop();

    /**
     * Chooses the listener for an inbound connection.
     */
    @FunctionalInterface
    interface InboundConnectionAcceptor {
        /**
         * @return the listener for this connection, or {@code null} to refuse it
         */
        StreamTransportListener accept(InetSocketAddress remote);
    }
}
