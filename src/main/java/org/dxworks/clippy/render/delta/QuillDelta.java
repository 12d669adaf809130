package org.dxworks.clippy.render.delta;

import java.util.List;

public record QuillDelta(List<DeltaOp> ops) {

    public static final QuillDelta EMPTY = new QuillDelta(List.of());

    public QuillDelta {
        ops = ops == null ? List.of() : List.copyOf(ops);
    }

    public String plainText() {
        StringBuilder text = new StringBuilder();
        for (DeltaOp op : ops) {
            text.append(op.insert());
        }
        return text.toString();
    }
}
