package org.dxworks.clippy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * The formatting flags a text or link span can carry. Declaration order is the
 * canonical nesting order used by the renderers, innermost first.
 */
public enum FormattingKind {
    CODE("code"),
    BOLD("bold"),
    ITALIC("italic"),
    UNDERLINE("underline"),
    STRIKETHROUGH("strikethrough");

    private final String name;

    FormattingKind(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    public static Optional<FormattingKind> fromName(String name) {
        for (FormattingKind kind : values()) {
            if (kind.name.equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static FormattingKind forJson(String name) {
        return fromName(name).orElseThrow(() -> new IllegalArgumentException("Unknown formatting kind: " + name));
    }
}
