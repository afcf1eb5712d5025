package com.questrail.coedit.api;

/**
 * DocumentEditor
 * -----------------------------------------------------------------------------
 * The editor component that owns the shared document.
 *
 * <p>The session core never keeps the document. It reads the text when it has
 * to send it and replaces the text when the peer's version arrives.</p>
 *
 * <h2>Threading</h2>
 * {@link #replaceText(String)} must complete synchronously. The editor is
 * expected to report the resulting change back through
 * {@link CollabSession#onLocalDocumentChanged()} from inside that call (as a
 * text widget's change signal would); the session recognises and drops that
 * echo.
 */
public interface DocumentEditor
{
    /** Current document text. */
    String text();

    /** Replace the entire document. */
    void replaceText(String text);

    /** Current caret, selection and scroll position. */
    default EditorViewport viewport()
    {
        return EditorViewport.ORIGIN;
    }

    /** Restore a previously captured position. Offsets are already clamped. */
    default void restoreViewport(EditorViewport viewport) {}
}
