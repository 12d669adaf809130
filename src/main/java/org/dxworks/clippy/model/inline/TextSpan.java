package org.dxworks.clippy.model.inline;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.dxworks.clippy.model.TextFormatting;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TextSpan(
        String text,
        @JsonInclude(value = JsonInclude.Include.CUSTOM, valueFilter = TextFormatting.OmitWhenEmpty.class)
        TextFormatting formatting) implements InlineContent {

    public TextSpan {
        text = text == null ? "" : text;
        formatting = formatting == null ? TextFormatting.NONE : formatting;
    }

    public static TextSpan plain(String text) {
        return new TextSpan(text, TextFormatting.NONE);
    }

    public TextSpan withText(String newText) {
        return new TextSpan(newText, formatting);
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visitText(this);
    }
}
