package com.questrail.routing.protocol.bgp.config;

import com.questrail.routing.protocol.bgp.model.Ipv4Address;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Configuration of one neighbor.
 *
 * <p>{@code localAddress} is written as NEXT_HOP when routes are exported to an
 * external peer. {@code holdTimeSeconds} is the value offered in our OPEN; it
 * must be 0 (no keepalives) or at least 3.</p>
 */
public record BgpPeerConfig(
        Ipv4Address peerAddress,
        int peerPort,
        long remoteAs,
        long localAs,
        Ipv4Address localRouterId,
        Ipv4Address localAddress,
        int holdTimeSeconds,
        boolean passive,
        boolean routeReflectorClient
) {
    public static final int DEFAULT_PORT = 179;
    public static final int DEFAULT_HOLD_TIME_SECONDS = 90;

    public BgpPeerConfig {
        Objects.requireNonNull(peerAddress, "peerAddress");
        Objects.requireNonNull(localRouterId, "localRouterId");
        Objects.requireNonNull(localAddress, "localAddress");

        if (peerPort < 1 || peerPort > 0xFFFF) {
            throw new IllegalArgumentException("peerPort must be 1-65535");
        }
        checkAs(remoteAs, "remoteAs");
        checkAs(localAs, "localAs");
        if (localRouterId.isUnspecified()) {
            throw new IllegalArgumentException("localRouterId must not be 0.0.0.0");
        }
        if (holdTimeSeconds != 0 && (holdTimeSeconds < 3 || holdTimeSeconds > 0xFFFF)) {
            throw new IllegalArgumentException("holdTimeSeconds must be 0 or 3-65535");
        }
    }

    private static void checkAs(long as, String name) {
        if (as < 1 || as > 0xFFFFFFFFL) {
            throw new IllegalArgumentException(name + " must be 1-4294967295");
        }
    }

    /**
     * True for an eBGP session.
     */
    public boolean isExternal() {
        return remoteAs != localAs;
    }

    public InetSocketAddress remoteSocketAddress() {
        return new InetSocketAddress(peerAddress.toInetAddress(), peerPort);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Ipv4Address peerAddress;
        private int peerPort = DEFAULT_PORT;
        private long remoteAs;
        private long localAs;
        private Ipv4Address localRouterId;
        private Ipv4Address localAddress;
        private int holdTimeSeconds = DEFAULT_HOLD_TIME_SECONDS;
        private boolean passive;
        private boolean routeReflectorClient;

        public Builder withPeerAddress(Ipv4Address peerAddress) {
            this.peerAddress = peerAddress;
            return this;
        }

        public Builder withPeerAddress(String peerAddress) {
            return withPeerAddress(Ipv4Address.parse(peerAddress));
        }

        public Builder withPeerPort(int peerPort) {
            this.peerPort = peerPort;
            return this;
        }

        public Builder withRemoteAs(long remoteAs) {
            this.remoteAs = remoteAs;
            return this;
        }

        public Builder withLocalAs(long localAs) {
            this.localAs = localAs;
            return this;
        }

        public Builder withLocalRouterId(Ipv4Address localRouterId) {
            this.localRouterId = localRouterId;
            return this;
        }

        /**
         * Defaults to the router id when not set.
         */
        public Builder withLocalAddress(Ipv4Address localAddress) {
            this.localAddress = localAddress;
            return this;
        }

        public Builder withHoldTimeSeconds(int holdTimeSeconds) {
            this.holdTimeSeconds = holdTimeSeconds;
            return this;
        }

        public Builder withPassive(boolean passive) {
            this.passive = passive;
            return this;
        }

        public Builder withRouteReflectorClient(boolean routeReflectorClient) {
            this.routeReflectorClient = routeReflectorClient;
            return this;
        }

        public BgpPeerConfig build() {
            return new BgpPeerConfig(peerAddress, peerPort, remoteAs, localAs, localRouterId,
                    localAddress != null ? localAddress : localRouterId,
                    holdTimeSeconds, passive, routeReflectorClient);
        }
    }
}
