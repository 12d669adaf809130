package org.dxworks.clippy.render.delta;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An insert operation of a Quill delta. Attributes keep their insertion order so the
 * serialized form is stable.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record DeltaOp(String insert, Map<String, Object> attributes) {

    public DeltaOp {
        insert = insert == null ? "" : insert;
        attributes = attributes == null || attributes.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static DeltaOp text(String insert) {
        return new DeltaOp(insert, Map.of());
    }

    public static DeltaOp newline() {
        return text("\n");
    }

    public static DeltaOp newline(String attribute, Object value) {
        return new DeltaOp("\n", Map.of(attribute, value));
    }

    public DeltaOp append(String more) {
        return new DeltaOp(insert + more, attributes);
    }
}
