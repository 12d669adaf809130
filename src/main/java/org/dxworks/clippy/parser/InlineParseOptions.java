package org.dxworks.clippy.parser;

import org.dxworks.clippy.model.ContentLimits;

public record InlineParseOptions(
        boolean preserveWhitespace,
        boolean mergeAdjacentText,
        boolean validateUrls,
        int maxUrlLength,
        int maxTextLength) {

    public static final InlineParseOptions DEFAULTS = new InlineParseOptions(
            false, true, true, ContentLimits.DEFAULT_MAX_URL_LENGTH, ContentLimits.DEFAULT_MAX_TEXT_LENGTH);

    public static InlineParseOptions fromLimits(ContentLimits limits) {
        return new InlineParseOptions(false, true, true, limits.maxUrlLength(), limits.maxTextLength());
    }

    public InlineParseOptions withPreserveWhitespace(boolean value) {
        return new InlineParseOptions(value, mergeAdjacentText, validateUrls, maxUrlLength, maxTextLength);
    }

    public InlineParseOptions withMergeAdjacentText(boolean value) {
        return new InlineParseOptions(preserveWhitespace, value, validateUrls, maxUrlLength, maxTextLength);
    }
}
