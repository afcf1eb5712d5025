package com.questrail.coedit.editor;

import com.questrail.coedit.api.EditorViewport;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class InMemoryDocumentEditorTest
{
    @Test
    void bothEditPathsFireTheChangeSignalSynchronously()
    {
        InMemoryDocumentEditor editor = new InMemoryDocumentEditor();
        AtomicInteger changes = new AtomicInteger();
        editor.setChangeListener(changes::incrementAndGet);

        editor.edit("typed");
        assertEquals(1, changes.get());

        editor.replaceText("replaced");
        assertEquals(2, changes.get());
        assertEquals("replaced", editor.text());
    }

    @Test
    void editMovesTheCaretToTheEnd()
    {
        InMemoryDocumentEditor editor = new InMemoryDocumentEditor();

        editor.edit("four");

        assertEquals(new EditorViewport(4, 4, 0, 0), editor.viewport());
    }

    @Test
    void replaceResetsTheViewportLikeAWidget()
    {
        InMemoryDocumentEditor editor = new InMemoryDocumentEditor("abcdef");
        editor.setViewport(new EditorViewport(3, 1, 5, 5));

        editor.replaceText("xyz");

        assertEquals(EditorViewport.ORIGIN, editor.viewport());
    }

    @Test
    void viewportIsClampedToTheText()
    {
        InMemoryDocumentEditor editor = new InMemoryDocumentEditor("ab");

        editor.restoreViewport(new EditorViewport(10, -1, 0, 0));

        assertEquals(2, editor.viewport().caret());
        assertEquals(0, editor.viewport().anchor());
    }
}
