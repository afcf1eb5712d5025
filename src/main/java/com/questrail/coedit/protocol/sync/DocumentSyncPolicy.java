package com.questrail.coedit.protocol.sync;

import com.questrail.coedit.api.DocumentEditor;
import com.questrail.coedit.api.EditorViewport;

import java.util.Objects;

/**
 * DocumentSyncPolicy
 * -----------------------------------------------------------------------------
 * Editor-side half of whole-document synchronization.
 *
 * <h2>Anti-echo</h2>
 * Replacing the editor's text makes the editor report a change. That change is
 * the peer's text coming back, not a local edit, and must never be sent. While
 * {@link #applyRemote(DocumentEditor, String)} runs, {@link #isApplyingRemote()}
 * is true and the session drops every change notification. The flag is cleared
 * on every exit path, including an editor that throws.
 *
 * <h2>No-op suppression</h2>
 * The last text exchanged with the peer (sent or applied) is remembered. A
 * local change whose text equals it carries no information and is not sent.
 * The initial push on connect is always sent.
 *
 * <p>Which side may transmit or apply is decided by the session state, not
 * here.</p>
 */
public final class DocumentSyncPolicy
{
    private volatile boolean applyingRemote;
    private volatile String lastSyncedText;

    /**
     * True while a remote update is being written into the editor.
     */
    public boolean isApplyingRemote()
    {
        return applyingRemote;
    }

    /**
     * Replaces the editor's document with {@code text}, keeping the caret,
     * selection and scroll position where they still fit.
     */
    public void applyRemote(DocumentEditor editor, String text)
    {
        Objects.requireNonNull(editor, "editor");
        Objects.requireNonNull(text, "text");

        applyingRemote = true;
        try {
            EditorViewport before = editor.viewport();
            editor.replaceText(text);
            editor.restoreViewport(before.clampedTo(text.length()));
            lastSyncedText = text;
        } finally {
            applyingRemote = false;
        }
    }

    /**
     * True if {@code text} differs from what the peer already has.
     */
    public boolean isNewerThanPeer(String text)
    {
        return !Objects.equals(text, lastSyncedText);
    }

    /**
     * Records that {@code text} was sent to the peer.
     */
    public void markSent(String text)
    {
        lastSyncedText = text;
    }

    /**
     * Forgets the peer's copy. Called whenever the peer link changes.
     */
    public void reset()
    {
        lastSyncedText = null;
    }
}
