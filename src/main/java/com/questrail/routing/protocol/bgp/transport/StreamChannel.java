package com.questrail.routing.protocol.bgp.transport;

import java.net.InetSocketAddress;

/**
 * One open connection of a {@link StreamTransport}.
 *
 * <p>Writes and close are asynchronous but ordered: a message sent before
 * {@link #close()} is flushed before the connection closes.</p>
 */
public interface StreamChannel
{
    /**
     * Write one complete, encoded BGP message.
     */
    void send(byte[] message);

    void close();

    boolean isOpen();

    InetSocketAddress remoteAddress();
}
