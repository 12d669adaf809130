package org.dxworks.clippy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ListType {
    BULLETED("bulleted"),
    NUMBERED("numbered");

    private final String name;

    ListType(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static ListType fromName(String name) {
        for (ListType type : values()) {
            if (type.name.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("List type must be \"bulleted\" or \"numbered\": " + name);
    }
}
