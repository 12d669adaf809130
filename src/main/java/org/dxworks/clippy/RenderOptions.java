package org.dxworks.clippy;

import org.dxworks.clippy.platform.PreferredFormat;

/**
 * @param platformId          target platform; the configured default platform when null
 * @param format              output format; the platform's preferred format when null
 * @param preserveFormatting  keeps inline formatting in Markdown and delta output
 * @param maxLength           longest output before it is replaced by truncated plain text, 0 for no limit
 * @param fallbackToPlainText renders plain text when the chosen format fails
 */
public record RenderOptions(
        String platformId,
        PreferredFormat format,
        boolean preserveFormatting,
        int maxLength,
        boolean fallbackToPlainText) {

    public static final RenderOptions DEFAULTS = new RenderOptions(null, null, true, 0, true);

    public static RenderOptions forPlatform(String platformId) {
        return new RenderOptions(platformId, null, true, 0, true);
    }

    public RenderOptions withFormat(PreferredFormat value) {
        return new RenderOptions(platformId, value, preserveFormatting, maxLength, fallbackToPlainText);
    }

    public RenderOptions withMaxLength(int value) {
        return new RenderOptions(platformId, format, preserveFormatting, value, fallbackToPlainText);
    }

    public RenderOptions withPreserveFormatting(boolean value) {
        return new RenderOptions(platformId, format, value, maxLength, fallbackToPlainText);
    }

    public RenderOptions withFallbackToPlainText(boolean value) {
        return new RenderOptions(platformId, format, preserveFormatting, maxLength, value);
    }
}
