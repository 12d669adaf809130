package org.dxworks.clippy.model.inline;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.dxworks.clippy.model.TextFormatting;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LinkSpan(
        String url,
        String text,
        @JsonInclude(value = JsonInclude.Include.CUSTOM, valueFilter = TextFormatting.OmitWhenEmpty.class)
        TextFormatting formatting) implements InlineContent {

    public LinkSpan {
        text = text == null ? "" : text;
        formatting = formatting == null ? TextFormatting.NONE : formatting;
    }

    public static LinkSpan plain(String url, String text) {
        return new LinkSpan(url, text, TextFormatting.NONE);
    }

    /**
     * The same text and formatting without the link target.
     */
    public TextSpan asText() {
        return new TextSpan(text, formatting);
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visitLink(this);
    }
}
