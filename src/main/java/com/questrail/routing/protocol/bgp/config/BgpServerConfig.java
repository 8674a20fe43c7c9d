package com.questrail.routing.protocol.bgp.config;

import com.questrail.routing.protocol.bgp.internal.exec.SessionTimingPolicy;
import com.questrail.routing.protocol.bgp.model.Ipv4Address;
import com.questrail.routing.rib.DecisionPolicy;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregated configuration for the BGP production runtime.
 *
 * <p>{@code listenAddress} is optional; without it the speaker only makes
 * outbound connections.</p>
 */
public record BgpServerConfig(
        long localAs,
        Ipv4Address routerId,
        InetSocketAddress listenAddress,
        List<BgpPeerConfig> peers,
        SessionTimingPolicy timingPolicy,
        DecisionPolicy decisionPolicy
) {
    public BgpServerConfig {
        Objects.requireNonNull(routerId, "routerId");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(decisionPolicy, "decisionPolicy");
        peers = List.copyOf(peers);

        if (localAs < 1 || localAs > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("localAs must be 1-4294967295");
        }
        Set<Ipv4Address> seen = new HashSet<>();
        for (BgpPeerConfig peer : peers) {
            checkPeer(localAs, peer);
            if (!seen.add(peer.peerAddress())) {
                throw new IllegalArgumentException("Duplicate peer " + peer.peerAddress());
            }
        }
    }

    /**
     * Rejects a peer whose local AS is not this speaker's: the RIB detects AS
     * path loops against the speaker's AS, so the two must agree.
     *
     * @throws IllegalArgumentException if the peer's local AS differs
     */
    public void checkPeer(BgpPeerConfig peer) {
        checkPeer(localAs, peer);
    }

    private static void checkPeer(long localAs, BgpPeerConfig peer) {
        Objects.requireNonNull(peer, "peer");
        if (peer.localAs() != localAs) {
            throw new IllegalArgumentException("Peer " + peer.peerAddress() + " has local AS "
                    + peer.localAs() + ", speaker AS is " + localAs);
        }
    }

    /**
     * Starts a peer builder pre-filled with this speaker's AS and router id.
     */
    public BgpPeerConfig.Builder peerBuilder() {
        return BgpPeerConfig.builder()
                .withLocalAs(localAs)
                .withLocalRouterId(routerId);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long localAs;
        private Ipv4Address routerId;
        private InetSocketAddress listenAddress;
        private final List<BgpPeerConfig> peers = new ArrayList<>();
        private SessionTimingPolicy timingPolicy = SessionTimingPolicy.defaults();
        private DecisionPolicy decisionPolicy = DecisionPolicy.defaults();

        public Builder withLocalAs(long localAs) {
            this.localAs = localAs;
            return this;
        }

        public Builder withRouterId(Ipv4Address routerId) {
            this.routerId = routerId;
            return this;
        }

        public Builder withListenAddress(InetSocketAddress listenAddress) {
            this.listenAddress = listenAddress;
            return this;
        }

        public Builder addPeer(BgpPeerConfig peer) {
            peers.add(Objects.requireNonNull(peer, "peer"));
            return this;
        }

        public Builder withTimingPolicy(SessionTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withDecisionPolicy(DecisionPolicy decisionPolicy) {
            this.decisionPolicy = decisionPolicy;
            return this;
        }

        public BgpServerConfig build() {
            return new BgpServerConfig(localAs, routerId, listenAddress, peers, timingPolicy, decisionPolicy);
        }
    }
}
