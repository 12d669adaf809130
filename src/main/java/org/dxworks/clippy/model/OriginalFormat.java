package org.dxworks.clippy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum OriginalFormat {
    HTML("html"),
    TEXT("text");

    private final String name;

    OriginalFormat(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static OriginalFormat fromName(String name) {
        for (OriginalFormat format : values()) {
            if (format.name.equals(name)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown original format: " + name);
    }
}
