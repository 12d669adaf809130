package org.dxworks.clippy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum BlockKind {
    PARAGRAPH("paragraph"),
    HEADING("heading"),
    LIST("list"),
    QUOTE("quote"),
    CODE("code"),
    DIVIDER("divider");

    private final String name;

    BlockKind(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    public static Optional<BlockKind> fromName(String name) {
        for (BlockKind kind : values()) {
            if (kind.name.equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static BlockKind forJson(String name) {
        return fromName(name).orElseThrow(() -> new IllegalArgumentException("Unknown block kind: " + name));
    }
}
