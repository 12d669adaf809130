package org.dxworks.clippy;

import org.dxworks.clippy.platform.PreferredFormat;
import org.dxworks.clippy.render.delta.QuillDelta;

import java.util.List;

/**
 * Rendered output. {@code content} always holds the text handed to the target; for
 * delta output it is the delta's JSON and {@code delta} holds the ops themselves.
 */
public record RenderResult(
        PreferredFormat format,
        String platformId,
        String content,
        QuillDelta delta,
        boolean success,
        List<String> warnings) {

    public RenderResult {
        content = content == null ? "" : content;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
