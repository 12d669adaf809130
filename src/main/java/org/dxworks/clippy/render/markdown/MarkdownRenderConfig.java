package org.dxworks.clippy.render.markdown;

import org.dxworks.clippy.model.ContentLimits;

public record MarkdownRenderConfig(
        MarkdownFlavor flavor,
        boolean preserveFormatting,
        boolean useCodeFences,
        int maxNestingLevel,
        LineBreakStyle lineBreakStyle,
        int maxUrlLength) {

    public static final int DEFAULT_MAX_NESTING_LEVEL = 5;

    public static final MarkdownRenderConfig DEFAULTS = new MarkdownRenderConfig(
            MarkdownFlavor.STANDARD, true, true, DEFAULT_MAX_NESTING_LEVEL, LineBreakStyle.SOFT,
            ContentLimits.DEFAULT_MAX_URL_LENGTH);

    public MarkdownRenderConfig {
        flavor = flavor == null ? MarkdownFlavor.STANDARD : flavor;
        lineBreakStyle = lineBreakStyle == null ? LineBreakStyle.SOFT : lineBreakStyle;
    }

    /**
     * Defaults for a flavor. Slack gets indented code and hard line breaks, the others
     * fenced code and soft breaks.
     */
    public static MarkdownRenderConfig forFlavor(MarkdownFlavor flavor) {
        boolean slack = flavor == MarkdownFlavor.SLACK;
        return new MarkdownRenderConfig(
                flavor,
                true,
                !slack,
                DEFAULT_MAX_NESTING_LEVEL,
                slack ? LineBreakStyle.HARD : LineBreakStyle.SOFT,
                ContentLimits.DEFAULT_MAX_URL_LENGTH);
    }

    public MarkdownRenderConfig withPreserveFormatting(boolean value) {
        return new MarkdownRenderConfig(flavor, value, useCodeFences, maxNestingLevel, lineBreakStyle, maxUrlLength);
    }

    public MarkdownRenderConfig withUseCodeFences(boolean value) {
        return new MarkdownRenderConfig(flavor, preserveFormatting, value, maxNestingLevel, lineBreakStyle, maxUrlLength);
    }

    public MarkdownRenderConfig withMaxNestingLevel(int value) {
        return new MarkdownRenderConfig(flavor, preserveFormatting, useCodeFences, value, lineBreakStyle, maxUrlLength);
    }
}
