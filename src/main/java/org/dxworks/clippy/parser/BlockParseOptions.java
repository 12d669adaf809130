package org.dxworks.clippy.parser;

import org.dxworks.clippy.model.ContentLimits;

public record BlockParseOptions(
        String sourceUrl,
        String sourceDomain,
        int nestingLimit,
        IdPolicy idPolicy,
        EmptyBlockPolicy emptyBlockPolicy,
        boolean includeMetadata,
        InlineParseOptions inlineOptions,
        ContentLimits limits) {

    // Lists are parsed recursively up to this depth
    public static final int MAX_NESTING_LIMIT = 100;

    public static final BlockParseOptions DEFAULTS = new BlockParseOptions(
            null,
            null,
            ContentLimits.DEFAULT_MAX_NESTING_LEVEL,
            IdPolicy.GENERATE,
            EmptyBlockPolicy.KEEP,
            true,
            InlineParseOptions.DEFAULTS,
            ContentLimits.DEFAULTS);

    public BlockParseOptions {
        nestingLimit = Math.max(1, Math.min(nestingLimit, MAX_NESTING_LIMIT));
        idPolicy = idPolicy == null ? IdPolicy.GENERATE : idPolicy;
        emptyBlockPolicy = emptyBlockPolicy == null ? EmptyBlockPolicy.KEEP : emptyBlockPolicy;
        inlineOptions = inlineOptions == null ? InlineParseOptions.DEFAULTS : inlineOptions;
        limits = limits == null ? ContentLimits.DEFAULTS : limits;
    }

    public BlockParseOptions withSource(String url, String domain) {
        return new BlockParseOptions(url, domain, nestingLimit, idPolicy, emptyBlockPolicy, includeMetadata, inlineOptions, limits);
    }

    public BlockParseOptions withNestingLimit(int value) {
        return new BlockParseOptions(sourceUrl, sourceDomain, value, idPolicy, emptyBlockPolicy, includeMetadata, inlineOptions, limits);
    }

    public BlockParseOptions withIdPolicy(IdPolicy value) {
        return new BlockParseOptions(sourceUrl, sourceDomain, nestingLimit, value, emptyBlockPolicy, includeMetadata, inlineOptions, limits);
    }

    public BlockParseOptions withEmptyBlockPolicy(EmptyBlockPolicy value) {
        return new BlockParseOptions(sourceUrl, sourceDomain, nestingLimit, idPolicy, value, includeMetadata, inlineOptions, limits);
    }

    public BlockParseOptions withIncludeMetadata(boolean value) {
        return new BlockParseOptions(sourceUrl, sourceDomain, nestingLimit, idPolicy, emptyBlockPolicy, value, inlineOptions, limits);
    }

    public BlockParseOptions withInlineOptions(InlineParseOptions value) {
        return new BlockParseOptions(sourceUrl, sourceDomain, nestingLimit, idPolicy, emptyBlockPolicy, includeMetadata, value, limits);
    }

    /**
     * Replaces the limits and derives the inline URL and text bounds from them.
     */
    public BlockParseOptions withLimits(ContentLimits value) {
        InlineParseOptions inline = new InlineParseOptions(
                inlineOptions.preserveWhitespace(),
                inlineOptions.mergeAdjacentText(),
                inlineOptions.validateUrls(),
                value.maxUrlLength(),
                value.maxTextLength());
        return new BlockParseOptions(sourceUrl, sourceDomain, value.maxNestingLevel(), idPolicy, emptyBlockPolicy, includeMetadata, inline, value);
    }
}
