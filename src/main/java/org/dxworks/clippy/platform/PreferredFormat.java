package org.dxworks.clippy.platform;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum PreferredFormat {
    HTML("html"),
    MARKDOWN("markdown"),
    DELTA("delta"),
    PLAINTEXT("plaintext");

    private final String name;

    PreferredFormat(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    public static Optional<PreferredFormat> fromName(String name) {
        for (PreferredFormat format : values()) {
            if (format.name.equalsIgnoreCase(name)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static PreferredFormat forJson(String name) {
        return fromName(name).orElseThrow(() -> new IllegalArgumentException("Unknown format: " + name));
    }
}
