package org.dxworks.clippy.render.html;

import org.dxworks.clippy.model.ContentLimits;

/**
 * @param includeIds          writes block and item ids as {@code id} attributes
 * @param cleanOutput         trims surrounding whitespace from the result
 * @param useSemanticElements {@code strong/em/del} instead of {@code b/i/s}
 * @param validateUrls        renders links with unsafe targets as plain formatted text
 * @param maxUrlLength        longest link target rendered as a link
 */
public record HtmlRenderConfig(
        boolean includeIds,
        boolean cleanOutput,
        boolean useSemanticElements,
        boolean validateUrls,
        int maxUrlLength) {

    public static final HtmlRenderConfig DEFAULTS = new HtmlRenderConfig(
            false, true, true, true, ContentLimits.DEFAULT_MAX_URL_LENGTH);

    public HtmlRenderConfig withIncludeIds(boolean value) {
        return new HtmlRenderConfig(value, cleanOutput, useSemanticElements, validateUrls, maxUrlLength);
    }

    public HtmlRenderConfig withSemanticElements(boolean value) {
        return new HtmlRenderConfig(includeIds, cleanOutput, value, validateUrls, maxUrlLength);
    }
}
