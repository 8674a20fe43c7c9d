package com.questrail.routing.protocol.bgp.model;

/**
 * KEEPALIVE: header only, no body.
 */
public final class KeepaliveMessage implements BgpMessage
{
    public static final KeepaliveMessage INSTANCE = new KeepaliveMessage();

    private KeepaliveMessage() {}

    @Override
    public BgpMessageType type() {
        return BgpMessageType.KEEPALIVE;
    }

    @Override
    public String toString() {
        return "KEEPALIVE";
    }
}
