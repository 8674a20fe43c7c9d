package com.questrail.routing.protocol.bgp.internal.exec;

import com.questrail.routing.protocol.bgp.internal.state.SessionIntents;

/**
 * SessionIntentExecutor
 * -----------------------------------------------------------------------------
 * Execution boundary between the pure {@code PeerSessionReducer} and the
 * outside world: the peer's TCP connection, session timers and the server
 * coordinator.
 *
 * <p>Implementations are called from the session's driver thread only, one
 * intent set at a time. They must not block, and they report outcomes
 * (connection up, timer expiry) only by submitting new events.</p>
 */
public interface SessionIntentExecutor
{
    /**
     * Execute the supplied intents in {@link SessionIntents.Kind} order.
     *
     * @param intents immutable set of actions to perform
     */
    void execute(SessionIntents intents);
}
