package com.questrail.coedit.api;

/**
 * A pending answer to a client's request for editing control.
 *
 * <p>Exactly one of {@link #approve()} or {@link #decline()} takes effect;
 * later calls are ignored. The decision may be made immediately or later from
 * any thread.</p>
 */
public interface ControlDecision
{
    void approve();

    void decline();

    /** True once either answer has been given. */
    boolean isDecided();
}
