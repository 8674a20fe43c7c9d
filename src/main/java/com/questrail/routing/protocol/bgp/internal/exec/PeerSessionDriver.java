package com.questrail.routing.protocol.bgp.internal.exec;

import com.questrail.routing.protocol.bgp.internal.events.BgpAdminEvent;
import com.questrail.routing.protocol.bgp.internal.events.BgpEvent;
import com.questrail.routing.protocol.bgp.internal.state.PeerSessionReducer;
import com.questrail.routing.protocol.bgp.internal.state.PeerSessionState;
import com.questrail.routing.protocol.bgp.internal.time.WallClock;
import com.questrail.routing.protocol.bgp.model.NotificationMessage;
import com.questrail.routing.protocol.bgp.observability.BgpErrorEvent;
import com.questrail.routing.protocol.bgp.observability.BgpObservabilitySink;
import com.questrail.routing.protocol.bgp.observability.NullObservabilitySink;
import com.questrail.routing.protocol.bgp.observability.SessionStateTransitionEvent;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * PeerSessionDriver
 * =============================================================================
 * Serialized event loop for one peer session.
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Owns the session's {@link PeerSessionState}; no other thread mutates it</li>
 *   <li>Applies events through {@link PeerSessionReducer}</li>
 *   <li>Hands the resulting intents to a {@link SessionIntentExecutor}
 *       (normally a {@link TimedSessionIntentExecutor})</li>
 * </ul>
 *
 * <h2>Threading Model</h2>
 * One thread per peer. Transport callbacks, timer expiries, coordinator
 * advertisements and administrative commands all arrive through
 * {@link #submitEvent(BgpEvent)} and are processed in arrival order.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   driver.start()           → starts the event loop thread
 *   driver.submitEvent(...)  → enqueues an event
 *   driver.stop()            → tears the session down and joins the thread
 * </pre>
 *
 * <p>{@link #stop()} does not interrupt the loop. It enqueues an
 * administrative stop (Cease / Peer De-configured) followed by an end marker,
 * so the NOTIFICATION is written and the connection closed before the thread
 * exits.</p>
 */
public final class PeerSessionDriver {

    private static final BgpEvent END_OF_STREAM = new BgpEvent.Base(Instant.EPOCH) {};

    private final PeerSessionReducer reducer;
    private final SessionIntentExecutor executor;
    private final WallClock wallClock;
    private final BgpObservabilitySink observabilitySink;
    private final String threadName;

    private final BlockingQueue<BgpEvent> eventQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object stateLock = new Object();

    private volatile PeerSessionState currentState;
    private volatile Thread eventLoopThread;

    public PeerSessionDriver(PeerSessionReducer reducer,
                             SessionIntentExecutor executor,
                             WallClock wallClock,
                             PeerSessionState initialState,
                             BgpObservabilitySink observabilitySink)
    {
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.currentState = Objects.requireNonNull(initialState, "initialState");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.threadName = "bgp-peer-" + initialState.config().peerAddress();
    }

    /**
     * Starts the event loop thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            eventLoopThread = new Thread(this::runEventLoop, threadName);
            eventLoopThread.setDaemon(true);
            eventLoopThread.start();
        }
    }

    /**
     * Stops the session and its thread. Blocks until the thread has finished
     * the teardown, up to five seconds.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            eventQueue.offer(new BgpAdminEvent.Stop(wallClock.now(), NotificationMessage.PEER_DECONFIGURED));
            eventQueue.offer(END_OF_STREAM);

            Thread t = eventLoopThread;
            if (t != null && t != Thread.currentThread()) {
                try {
                    t.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Submits an event for processing. Events submitted after {@link #stop()}
     * are discarded.
     *
     * @param event the event to process (must not be null)
     */
    public void submitEvent(BgpEvent event) {
        Objects.requireNonNull(event, "event");
        if (running.get()) {
            eventQueue.offer(event);
        }
    }

    /**
     * Returns the current session state.
     * Thread-safe: can be called from any thread.
     */
    public PeerSessionState currentState() {
        synchronized (stateLock) {
            return currentState;
        }
    }

    private void runEventLoop() {
        while (true) {
            final BgpEvent event;
            try {
                event = eventQueue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (event == END_OF_STREAM) {
                return;
            }
            try {
                processEvent(event);
            } catch (RuntimeException e) {
                observabilitySink.onError(new BgpErrorEvent(
                    wallClock.now(),
                    "Peer " + currentState.config().peerAddress() + ": error processing " + event,
                    e
                ));
            }
        }
    }

    private void processEvent(BgpEvent event) {
        final PeerSessionState oldState;
        final PeerSessionReducer.Result result;

        synchronized (stateLock) {
            oldState = currentState;
            result = reducer.apply(oldState, event);
            currentState = result.newState();
        }

        observabilitySink.onStateTransition(new SessionStateTransitionEvent(
            wallClock.now(),
            oldState,
            result.newState(),
            event,
            result.intents()
        ));

        if (!result.intents().isEmpty()) {
            executor.execute(result.intents());
        }
    }
}
