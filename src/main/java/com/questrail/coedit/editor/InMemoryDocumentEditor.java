package com.questrail.coedit.editor;

import com.questrail.coedit.api.DocumentEditor;
import com.questrail.coedit.api.EditorViewport;

import java.util.Objects;

/**
 * A headless {@link DocumentEditor} holding the document in memory.
 *
 * <p>Behaves like a text widget with a change signal: every change, whether
 * typed through {@link #edit(String)} or written by
 * {@link #replaceText(String)}, runs the change callback synchronously on the
 * calling thread.</p>
 */
public final class InMemoryDocumentEditor implements DocumentEditor
{
    private final Object lock = new Object();

    private String text;
    private EditorViewport viewport = EditorViewport.ORIGIN;
    private volatile Runnable onChange = () -> {};

    public InMemoryDocumentEditor()
    {
        this("");
    }

    public InMemoryDocumentEditor(String initialText)
    {
        this.text = Objects.requireNonNull(initialText, "initialText");
    }

    /**
     * Set the callback run after every change, typically
     * {@code session::onLocalDocumentChanged}.
     */
    public void setChangeListener(Runnable onChange)
    {
        this.onChange = Objects.requireNonNull(onChange, "onChange");
    }

    /**
     * A local edit: the user replaced the document with {@code newText}.
     * The caret moves to the end of the new text.
     */
    public void edit(String newText)
    {
        Objects.requireNonNull(newText, "newText");
        synchronized (lock) {
            text = newText;
            viewport = new EditorViewport(newText.length(), newText.length(),
                    viewport.horizontalScroll(), viewport.verticalScroll());
        }
        onChange.run();
    }

    @Override
    public String text()
    {
        synchronized (lock) {
            return text;
        }
    }

    @Override
    public void replaceText(String newText)
    {
        Objects.requireNonNull(newText, "newText");
        synchronized (lock) {
            text = newText;
            // A widget resets its cursor when the whole content is replaced.
            viewport = EditorViewport.ORIGIN;
        }
        onChange.run();
    }

    @Override
    public EditorViewport viewport()
    {
        synchronized (lock) {
            return viewport;
        }
    }

    @Override
    public void restoreViewport(EditorViewport restored)
    {
        Objects.requireNonNull(restored, "restored");
        synchronized (lock) {
            viewport = restored.clampedTo(text.length());
        }
    }

    /**
     * Move the caret and selection, as a user clicking or scrolling would.
     */
    public void setViewport(EditorViewport newViewport)
    {
        Objects.requireNonNull(newViewport, "newViewport");
        synchronized (lock) {
            viewport = newViewport.clampedTo(text.length());
        }
    }
}
