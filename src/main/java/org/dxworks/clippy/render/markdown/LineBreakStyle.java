package org.dxworks.clippy.render.markdown;

public enum LineBreakStyle {
    /** Two trailing spaces before the newline. */
    SOFT("  \n"),
    /** A bare newline, for chat platforms that keep newlines as typed. */
    HARD("\n");

    private final String markup;

    LineBreakStyle(String markup) {
        this.markup = markup;
    }

    public String markup() {
        return markup;
    }
}
