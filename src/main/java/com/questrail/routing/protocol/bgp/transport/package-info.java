/**
 * Transport ports.
 *
 * <p>The session layer talks to TCP only through
 * {@link com.questrail.routing.protocol.bgp.transport.StreamTransport} and
 * {@link com.questrail.routing.protocol.bgp.transport.StreamChannel}. The
 * Netty implementation lives in {@code transport.tcp.netty} and its types never
 * leave that package.</p>
 */
package com.questrail.routing.protocol.bgp.transport;
