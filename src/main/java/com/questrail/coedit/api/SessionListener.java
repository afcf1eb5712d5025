package com.questrail.coedit.api;

/**
 * Observer for session changes the application should reflect (read-only
 * toggling, status line, dialogs).
 *
 * <p>Callbacks are delivered serially, possibly from a network thread.
 * Implementations that touch a UI must hand off to the UI thread.</p>
 */
public interface SessionListener
{
    SessionListener NONE = new SessionListener() {};

    default void onStatusChanged(SessionStatus previous, SessionStatus current) {}

    default void onNotification(SessionNotification notification) {}
}
