package com.questrail.routing.protocol.bgp.internal.state;

import com.questrail.routing.protocol.bgp.model.NotificationMessage;
import com.questrail.routing.protocol.bgp.model.OpenMessage;
import com.questrail.routing.protocol.bgp.model.UpdateMessage;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * SessionIntents
 * -----------------------------------------------------------------------------
 * Immutable set of actions emitted by the {@link PeerSessionReducer}.
 *
 * <h2>Role in the architecture</h2>
 * The reducer decides <b>what</b> must happen; executors decide <b>how</b>.
 * No intent performs I/O on its own.
 *
 * <h2>Execution order</h2>
 * Executors carry out kinds in declaration order of {@link Kind}. The order
 * encodes protocol rules: timers are cancelled before a NOTIFICATION is
 * written, the NOTIFICATION is written before the connection is closed, and
 * the coordinator hears about a lost session before any new connection
 * attempt begins.
 */
public final class SessionIntents
{
    public enum Kind {
        /** Cancel every armed session timer. */
        CANCEL_TIMERS,

        /** Write {@link #notification()} to the peer. */
        SEND_NOTIFICATION,

        /** Close the connection, or abandon a pending connection attempt. */
        CLOSE_TRANSPORT,

        /** Tell the coordinator the Established session is gone. */
        SESSION_DOWN,

        /** Start an outbound connection attempt. */
        CONNECT,

        /** Write {@link #localOpen()} to the peer. */
        SEND_OPEN,

        /** Write a KEEPALIVE to the peer. */
        SEND_KEEPALIVE,

        /** Write {@link #outboundUpdates()} to the peer. */
        SEND_UPDATE,

        /** Tell the coordinator the session is Established. */
        SESSION_ESTABLISHED,

        /** Hand {@link #inboundUpdate()} to the coordinator. */
        DELIVER_UPDATE,

        /** Ask the coordinator to re-send this peer's Adj-RIB-Out. */
        REQUEST_REFRESH,

        /** Arm the connect-retry timer per {@link #connectRetry()}. */
        ARM_CONNECT_RETRY,

        /** Arm the hold timer per {@link #hold()}. */
        ARM_HOLD,

        /** Arm the keepalive timer per {@link #keepalive()}. */
        ARM_KEEPALIVE
    }

    /**
     * A timer to arm: its delay and the generation expiries must carry.
     */
    public record TimerArm(Duration delay, long generation) {
        public TimerArm {
            Objects.requireNonNull(delay, "delay");
        }
    }

    private static final SessionIntents NONE = builder().build();

    private final Set<Kind> kinds;
    private final NotificationMessage notification;
    private final OpenMessage localOpen;
    private final OpenMessage peerOpen;
    private final long session;
    private final UpdateMessage inboundUpdate;
    private final List<UpdateMessage> outboundUpdates;
    private final String downReason;
    private final TimerArm connectRetry;
    private final TimerArm hold;
    private final TimerArm keepalive;

    private SessionIntents(Builder b) {
        this.kinds = Collections.unmodifiableSet(EnumSet.copyOf(b.kinds));
        this.notification = b.notification;
        this.localOpen = b.localOpen;
        this.peerOpen = b.peerOpen;
        this.session = b.session;
        this.inboundUpdate = b.inboundUpdate;
        this.outboundUpdates = b.outboundUpdates;
        this.downReason = b.downReason;
        this.connectRetry = b.connectRetry;
        this.hold = b.hold;
        this.keepalive = b.keepalive;
    }

    public static SessionIntents none() {
        return NONE;
    }

    /**
     * Kinds present, iterated in execution order.
     */
    public Set<Kind> kinds() {
        return kinds;
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    public boolean contains(Kind kind) {
        return kinds.contains(kind);
    }

    public Optional<NotificationMessage> notification() {
        return Optional.ofNullable(notification);
    }

    public Optional<OpenMessage> localOpen() {
        return Optional.ofNullable(localOpen);
    }

    public Optional<OpenMessage> peerOpen() {
        return Optional.ofNullable(peerOpen);
    }

    /**
     * Number of the Established session announced by {@link Kind#SESSION_ESTABLISHED}.
     */
    public long session() {
        return session;
    }

    public Optional<UpdateMessage> inboundUpdate() {
        return Optional.ofNullable(inboundUpdate);
    }

    public List<UpdateMessage> outboundUpdates() {
        return outboundUpdates;
    }

    public Optional<String> downReason() {
        return Optional.ofNullable(downReason);
    }

    public Optional<TimerArm> connectRetry() {
        return Optional.ofNullable(connectRetry);
    }

    public Optional<TimerArm> hold() {
        return Optional.ofNullable(hold);
    }

    public Optional<TimerArm> keepalive() {
        return Optional.ofNullable(keepalive);
    }

    @Override
    public String toString() {
        return "SessionIntents" + kinds;
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Setting a payload also adds the matching kind.
     */
    public static final class Builder {
        private final EnumSet<Kind> kinds = EnumSet.noneOf(Kind.class);
        private NotificationMessage notification;
        private OpenMessage localOpen;
        private OpenMessage peerOpen;
        private long session;
        private UpdateMessage inboundUpdate;
        private List<UpdateMessage> outboundUpdates = List.of();
        private String downReason;
        private TimerArm connectRetry;
        private TimerArm hold;
        private TimerArm keepalive;

        private Builder() {}

        public Builder add(Kind kind) {
            kinds.add(Objects.requireNonNull(kind, "kind"));
            return this;
        }

        public Builder sendNotification(NotificationMessage notification) {
            this.notification = Objects.requireNonNull(notification, "notification");
            return add(Kind.SEND_NOTIFICATION);
        }

        public Builder sendOpen(OpenMessage open) {
            this.localOpen = Objects.requireNonNull(open, "open");
            return add(Kind.SEND_OPEN);
        }

        public Builder sessionEstablished(OpenMessage peerOpen, long session) {
            this.peerOpen = Objects.requireNonNull(peerOpen, "peerOpen");
            this.session = session;
            return add(Kind.SESSION_ESTABLISHED);
        }

        public Builder sessionDown(String reason) {
            this.downReason = Objects.requireNonNull(reason, "reason");
            return add(Kind.SESSION_DOWN);
        }

        public Builder deliverUpdate(UpdateMessage update) {
            this.inboundUpdate = Objects.requireNonNull(update, "update");
            return add(Kind.DELIVER_UPDATE);
        }

        public Builder sendUpdates(List<UpdateMessage> updates) {
            this.outboundUpdates = List.copyOf(updates);
            return add(Kind.SEND_UPDATE);
        }

        public Builder armConnectRetry(Duration delay, long generation) {
            this.connectRetry = new TimerArm(delay, generation);
            return add(Kind.ARM_CONNECT_RETRY);
        }

        public Builder armHold(Duration delay, long generation) {
            this.hold = new TimerArm(delay, generation);
            return add(Kind.ARM_HOLD);
        }

        public Builder armKeepalive(Duration delay, long generation) {
            this.keepalive = new TimerArm(delay, generation);
            return add(Kind.ARM_KEEPALIVE);
        }

        public SessionIntents build() {
            return new SessionIntents(this);
        }
    }
}
