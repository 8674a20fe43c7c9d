package com.questrail.routing.protocol.bgp.transport;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * FakeStreamTransport
 * -----------------------------------------------------------------------------
 * Test-only {@link StreamTransport}. It contains no BGP semantics: it records
 * connection attempts and written messages, and lets tests complete connects,
 * inject inbound messages and drop connections.
 */
public final class FakeStreamTransport implements StreamTransport {

    public record ConnectAttempt(InetSocketAddress remote, StreamTransportListener listener) {}

    private final List<ConnectAttempt> attempts = new ArrayList<>();
    private final List<FakeChannel> channels = new ArrayList<>();
    private InboundConnectionAcceptor acceptor;
    private boolean stopped;

    @Override
    public synchronized void connect(InetSocketAddress remote, StreamTransportListener listener) {
        attempts.add(new ConnectAttempt(Objects.requireNonNull(remote), Objects.requireNonNull(listener)));
    }

    @Override
    public synchronized InetSocketAddress listen(InetSocketAddress bindAddress, InboundConnectionAcceptor acceptor) {
        this.acceptor = Objects.requireNonNull(acceptor, "acceptor");
        return bindAddress;
    }

    @Override
    public synchronized void stop() {
        stopped = true;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public synchronized List<ConnectAttempt> attempts() {
        return new ArrayList<>(attempts);
    }

    public synchronized List<FakeChannel> channels() {
        return new ArrayList<>(channels);
    }

    public synchronized boolean isStopped() {
        return stopped;
    }

    /**
     * Completes the most recent connect attempt successfully.
     */
    public FakeChannel completeLastConnect() {
        ConnectAttempt attempt;
        FakeChannel channel;
        synchronized (this) {
            attempt = attempts.get(attempts.size() - 1);
            channel = new FakeChannel(attempt.remote(), attempt.listener());
            channels.add(channel);
        }
        attempt.listener().onConnected(channel);
        return channel;
    }

    public void failLastConnect(Throwable cause) {
        ConnectAttempt attempt;
        synchronized (this) {
            attempt = attempts.get(attempts.size() - 1);
        }
        attempt.listener().onConnectFailed(cause);
    }

    /**
     * Simulates an inbound connection; returns null if the acceptor refused it.
     */
    public FakeChannel acceptInbound(InetSocketAddress remote) {
        InboundConnectionAcceptor a;
        synchronized (this) {
            a = acceptor;
        }
        if (a == null) {
            throw new IllegalStateException("listen() was not called");
        }
        StreamTransportListener listener = a.accept(remote);
        if (listener == null) {
            return null;
        }
        FakeChannel channel = new FakeChannel(remote, listener);
        synchronized (this) {
            channels.add(channel);
        }
        listener.onConnected(channel);
        return channel;
    }

    /**
     * One fake connection: records writes, lets the test play the peer.
     */
    public static final class FakeChannel implements StreamChannel {
        private final InetSocketAddress remote;
        private final StreamTransportListener listener;
        private final List<byte[]> sent = new ArrayList<>();
        private boolean open = true;

        FakeChannel(InetSocketAddress remote, StreamTransportListener listener) {
            this.remote = remote;
            this.listener = listener;
        }

        @Override
        public synchronized void send(byte[] message) {
            sent.add(message.clone());
        }

        @Override
        public synchronized void close() {
            open = false;
        }

        @Override
        public synchronized boolean isOpen() {
            return open;
        }

        @Override
        public InetSocketAddress remoteAddress() {
            return remote;
        }

        public synchronized List<byte[]> sent() {
            return Collections.unmodifiableList(new ArrayList<>(sent));
        }

        public void inject(byte[] message) {
            listener.onMessage(this, message);
        }

        public void injectFramingError(String reason) {
            listener.onFramingError(this, reason);
        }

        public void drop(Throwable cause) {
            synchronized (this) {
                open = false;
            }
            listener.onDisconnected(this, cause);
        }
    }
}
