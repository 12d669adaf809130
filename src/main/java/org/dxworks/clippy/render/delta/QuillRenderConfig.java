package org.dxworks.clippy.render.delta;

/**
 * @param maxListDepth lists at this depth and below are written as {@code "• "} lines
 */
public record QuillRenderConfig(
        boolean supportNestedLists,
        int maxListDepth,
        boolean preserveFormatting,
        boolean useCodeBlocks) {

    public static final QuillRenderConfig DEFAULTS = new QuillRenderConfig(true, 3, true, true);

    public QuillRenderConfig withMaxListDepth(int value) {
        return new QuillRenderConfig(supportNestedLists, value, preserveFormatting, useCodeBlocks);
    }

    public QuillRenderConfig withPreserveFormatting(boolean value) {
        return new QuillRenderConfig(supportNestedLists, maxListDepth, value, useCodeBlocks);
    }
}
