package org.dxworks.clippy.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.EnumSet;
import java.util.Set;

/**
 * Formatting set of a span. Every flag is a plain boolean; {@link #NONE} stands for
 * "no formatting". Only {@code true} flags are written to JSON.
 */
@JsonInclude(JsonInclude.Include.NON_DEFAULT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TextFormatting(boolean bold, boolean italic, boolean underline, boolean strikethrough, boolean code) {

    public static final TextFormatting NONE = new TextFormatting(false, false, false, false, false);

    public static TextFormatting of(FormattingKind... kinds) {
        TextFormatting formatting = NONE;
        for (FormattingKind kind : kinds) {
            formatting = formatting.with(kind);
        }
        return formatting;
    }

    public TextFormatting with(FormattingKind kind) {
        return switch (kind) {
            case BOLD -> new TextFormatting(true, italic, underline, strikethrough, code);
            case ITALIC -> new TextFormatting(bold, true, underline, strikethrough, code);
            case UNDERLINE -> new TextFormatting(bold, italic, true, strikethrough, code);
            case STRIKETHROUGH -> new TextFormatting(bold, italic, underline, true, code);
            case CODE -> new TextFormatting(bold, italic, underline, strikethrough, true);
        };
    }

    public TextFormatting union(TextFormatting other) {
        return new TextFormatting(
                bold || other.bold,
                italic || other.italic,
                underline || other.underline,
                strikethrough || other.strikethrough,
                code || other.code);
    }

    public TextFormatting intersect(TextFormatting other) {
        return new TextFormatting(
                bold && other.bold,
                italic && other.italic,
                underline && other.underline,
                strikethrough && other.strikethrough,
                code && other.code);
    }

    public boolean has(FormattingKind kind) {
        return switch (kind) {
            case BOLD -> bold;
            case ITALIC -> italic;
            case UNDERLINE -> underline;
            case STRIKETHROUGH -> strikethrough;
            case CODE -> code;
        };
    }

    @JsonIgnore
    public boolean hasAny() {
        return bold || italic || underline || strikethrough || code;
    }

    /**
     * Active flags in canonical order (code, bold, italic, underline, strikethrough).
     */
    public Set<FormattingKind> activeKinds() {
        EnumSet<FormattingKind> kinds = EnumSet.noneOf(FormattingKind.class);
        for (FormattingKind kind : FormattingKind.values()) {
            if (has(kind)) {
                kinds.add(kind);
            }
        }
        return kinds;
    }

    /**
     * Jackson value filter that leaves out an absent or all-false formatting set.
     */
    public static final class OmitWhenEmpty {
        @Override
        public boolean equals(Object other) {
            return other == null || (other instanceof TextFormatting formatting && !formatting.hasAny());
        }

        @Override
        public int hashCode() {
            return 0;
        }
    }
}
