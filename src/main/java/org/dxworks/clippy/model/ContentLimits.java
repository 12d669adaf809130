package org.dxworks.clippy.model;

/**
 * Size bounds every content tree is expected to respect. They keep parsing, validation
 * and rendering of untrusted captures bounded.
 */
public record ContentLimits(
        int maxBlocks,
        int maxTextLength,
        int maxNestingLevel,
        int maxListItems,
        int maxUrlLength,
        int maxCitationLength) {

    public static final int DEFAULT_MAX_BLOCKS = 1000;
    public static final int DEFAULT_MAX_TEXT_LENGTH = 50_000;
    public static final int DEFAULT_MAX_NESTING_LEVEL = 10;
    public static final int DEFAULT_MAX_LIST_ITEMS = 500;
    public static final int DEFAULT_MAX_URL_LENGTH = 2000;
    public static final int DEFAULT_MAX_CITATION_LENGTH = 500;

    public static final ContentLimits DEFAULTS = new ContentLimits(
            DEFAULT_MAX_BLOCKS,
            DEFAULT_MAX_TEXT_LENGTH,
            DEFAULT_MAX_NESTING_LEVEL,
            DEFAULT_MAX_LIST_ITEMS,
            DEFAULT_MAX_URL_LENGTH,
            DEFAULT_MAX_CITATION_LENGTH);

    public ContentLimits withMaxBlocks(int value) {
        return new ContentLimits(value, maxTextLength, maxNestingLevel, maxListItems, maxUrlLength, maxCitationLength);
    }

    public ContentLimits withMaxNestingLevel(int value) {
        return new ContentLimits(maxBlocks, maxTextLength, value, maxListItems, maxUrlLength, maxCitationLength);
    }

    public ContentLimits withMaxTextLength(int value) {
        return new ContentLimits(maxBlocks, value, maxNestingLevel, maxListItems, maxUrlLength, maxCitationLength);
    }
}
