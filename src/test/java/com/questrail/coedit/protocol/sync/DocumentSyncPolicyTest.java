package com.questrail.coedit.protocol.sync;

import com.questrail.coedit.api.DocumentEditor;
import com.questrail.coedit.api.EditorViewport;
import com.questrail.coedit.editor.InMemoryDocumentEditor;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DocumentSyncPolicyTest
{
    private final DocumentSyncPolicy policy = new DocumentSyncPolicy();

    @Test
    void changeSignalDuringApplyIsMarkedAsRemote()
    {
        InMemoryDocumentEditor editor = new InMemoryDocumentEditor("old");
        List<Boolean> seen = new ArrayList<>();
        editor.setChangeListener(() -> seen.add(policy.isApplyingRemote()));

        policy.applyRemote(editor, "new");

        assertEquals(List.of(true), seen);
        assertFalse(policy.isApplyingRemote());
        assertEquals("new", editor.text());
    }

    @Test
    void localEditsAreNotMarkedAsRemote()
    {
        InMemoryDocumentEditor editor = new InMemoryDocumentEditor();
        List<Boolean> seen = new ArrayList<>();
        editor.setChangeListener(() -> seen.add(policy.isApplyingRemote()));

        editor.edit("typed");

        assertEquals(List.of(false), seen);
    }

    @Test
    void flagIsClearedWhenTheEditorThrows()
    {
        DocumentEditor broken = new DocumentEditor()
        {
            @Override
            public String text()
            {
                return "";
            }

            @Override
            public void replaceText(String text)
            {
                throw new IllegalStateException("widget disposed");
            }
        };

        assertThrows(IllegalStateException.class, () -> policy.applyRemote(broken, "x"));
        assertFalse(policy.isApplyingRemote());
    }

    @Test
    void caretSelectionAndScrollSurviveTheReplacement()
    {
        InMemoryDocumentEditor editor = new InMemoryDocumentEditor("hello world");
        editor.setViewport(new EditorViewport(3, 8, 2, 40));

        policy.applyRemote(editor, "hello there, world");

        assertEquals(new EditorViewport(3, 8, 2, 40), editor.viewport());
    }

    @Test
    void caretAndAnchorAreClampedToAShorterDocument()
    {
        InMemoryDocumentEditor editor = new InMemoryDocumentEditor("a long document");
        editor.setViewport(new EditorViewport(15, 10, 0, 7));

        policy.applyRemote(editor, "short");

        EditorViewport v = editor.viewport();
        assertEquals(5, v.caret());
        assertEquals(5, v.anchor());
        assertEquals(7, v.verticalScroll());
    }

    @Test
    void emptyRemoteTextEmptiesTheDocument()
    {
        InMemoryDocumentEditor editor = new InMemoryDocumentEditor("something");
        editor.setViewport(new EditorViewport(4, 4, 0, 0));

        policy.applyRemote(editor, "");

        assertEquals("", editor.text());
        assertEquals(0, editor.viewport().caret());
    }

    @Test
    void textAlreadyExchangedIsNotNewer()
    {
        assertTrue(policy.isNewerThanPeer("draft"));

        policy.markSent("draft");
        assertFalse(policy.isNewerThanPeer("draft"));
        assertTrue(policy.isNewerThanPeer("draft 2"));

        policy.applyRemote(new InMemoryDocumentEditor(), "from peer");
        assertFalse(policy.isNewerThanPeer("from peer"));
    }

    @Test
    void resetForgetsThePeerCopy()
    {
        policy.markSent("draft");
        policy.reset();

        assertTrue(policy.isNewerThanPeer("draft"));
    }
}
