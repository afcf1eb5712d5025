package com.questrail.coedit.protocol.internal.exec;

import com.questrail.coedit.protocol.internal.state.SessionIntents;
import com.questrail.coedit.protocol.internal.state.SessionState;

/**
 * SessionIntentExecutor
 * -----------------------------------------------------------------------------
 * Execution boundary between the pure session state machine and the impure
 * world of sockets, the editor and the user.
 *
 * <h2>Role in the architecture</h2>
 * Realizes the intentions produced by
 * {@link com.questrail.coedit.protocol.internal.state.SessionReducer}. It is
 * the ONLY layer allowed to:
 * <ul>
 *   <li>Listen, dial and close sockets</li>
 *   <li>Send messages to the peer</li>
 *   <li>Read or replace the editor's document</li>
 *   <li>Notify the application and ask the host's user for decisions</li>
 * </ul>
 *
 * <p>Execution is serialized by the caller and must not block. Outcomes
 * (bound, dialed, closed, decided) come back to the state machine only as
 * events.</p>
 */
public interface SessionIntentExecutor
{
    /**
     * Execute the intents produced by one transition, in order.
     *
     * @param state   the state the transition produced
     * @param intents actions to perform
     */
    void execute(SessionState state, SessionIntents intents);
}
