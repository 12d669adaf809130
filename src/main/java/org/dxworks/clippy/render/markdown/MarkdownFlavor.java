package org.dxworks.clippy.render.markdown;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Markdown dialects differ in their emphasis markers, link syntax and heading support.
 * A flavor without an underline marker renders underline with the italic marker.
 */
public enum MarkdownFlavor {
    STANDARD("standard", "**", "*", "~~", null, false, false, ""),
    GITHUB("github", "**", "*", "~~", null, false, false, ""),
    DISCORD("discord", "**", "*", "~~", "__", true, false, "~|"),
    SLACK("slack", "*", "_", "~", null, true, true, "");

    private final String name;
    private final String boldMarker;
    private final String italicMarker;
    private final String strikethroughMarker;
    private final String underlineMarker;
    private final boolean headingsAsBold;
    private final boolean angleBracketLinks;
    private final String extraEscapes;

    MarkdownFlavor(String name, String boldMarker, String italicMarker, String strikethroughMarker,
                   String underlineMarker, boolean headingsAsBold, boolean angleBracketLinks, String extraEscapes) {
        this.name = name;
        this.boldMarker = boldMarker;
        this.italicMarker = italicMarker;
        this.strikethroughMarker = strikethroughMarker;
        this.underlineMarker = underlineMarker;
        this.headingsAsBold = headingsAsBold;
        this.angleBracketLinks = angleBracketLinks;
        this.extraEscapes = extraEscapes;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    public String boldMarker() {
        return boldMarker;
    }

    public String italicMarker() {
        return italicMarker;
    }

    public String strikethroughMarker() {
        return strikethroughMarker;
    }

    public Optional<String> underlineMarker() {
        return Optional.ofNullable(underlineMarker);
    }

    public boolean headingsAsBold() {
        return headingsAsBold;
    }

    public boolean angleBracketLinks() {
        return angleBracketLinks;
    }

    public String extraEscapes() {
        return extraEscapes;
    }

    public static Optional<MarkdownFlavor> fromName(String name) {
        for (MarkdownFlavor flavor : values()) {
            if (flavor.name.equalsIgnoreCase(name)) {
                return Optional.of(flavor);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static MarkdownFlavor forJson(String name) {
        return fromName(name).orElseThrow(() -> new IllegalArgumentException("Unknown markdown flavor: " + name));
    }
}
