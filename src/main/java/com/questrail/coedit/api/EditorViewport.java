package com.questrail.coedit.api;

/**
 * Caret, selection anchor and scroll offsets of an editor view.
 *
 * <p>Offsets are character positions in the document text.</p>
 */
public record EditorViewport(int caret, int anchor, int horizontalScroll, int verticalScroll)
{
    public static final EditorViewport ORIGIN = new EditorViewport(0, 0, 0, 0);

    /**
     * Returns this viewport with caret and anchor clamped to {@code [0, length]}.
     * Scroll offsets are left for the view to clamp.
     */
    public EditorViewport clampedTo(int length)
    {
        int max = Math.max(0, length);
        return new EditorViewport(clamp(caret, max), clamp(anchor, max), horizontalScroll, verticalScroll);
    }

    private static int clamp(int value, int max)
    {
        return Math.max(0, Math.min(value, max));
    }
}
