package com.questrail.coedit.api;

/**
 * CollabSession
 * -----------------------------------------------------------------------------
 * A two-party collaborative editing session over one TCP connection.
 *
 * <h2>Purpose</h2>
 * One host and one client share a single document. Exactly one of them holds
 * editing control at a time; the other is a read-only viewer. Every local edit
 * of the writer is sent as the whole document, and the viewer replaces its
 * copy with whatever arrives (last writer wins).
 *
 * <h2>Commands</h2>
 * All methods return immediately. Results are reported through
 * {@link SessionListener}: failures never throw and never end the process, they
 * end the session attempt and return it to {@link SessionStatus#idle()}.
 *
 * <h2>Control</h2>
 * The host starts as the writer. The client asks with {@link #requestControl()};
 * the host's {@link ControlRequestHandler} approves or declines. The host takes
 * control back at any time with {@link #onUserRequestedReclaim()}.
 */
public interface CollabSession
{
    /**
     * Start listening for a peer. Only valid while idle.
     *
     * @param port TCP port, {@code 0} for an ephemeral port
     */
    void startHosting(int port);

    /**
     * Dial a host. Only valid while idle.
     */
    void connectToHost(String host, int port);

    /**
     * End the session and close every socket. Safe in any state, idempotent.
     */
    void stopSession();

    /**
     * Client only: ask the host for editing control.
     */
    void requestControl();

    /**
     * Called by the editor after every change to the document. The session
     * decides whether to transmit.
     */
    void onLocalDocumentChanged();

    /**
     * Called by the editor when the user tries to type while read-only. On
     * the host this takes control back from the client.
     */
    void onUserRequestedReclaim();

    SessionStatus status();
}
