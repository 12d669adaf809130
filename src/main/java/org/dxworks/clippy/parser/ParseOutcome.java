package org.dxworks.clippy.parser;

import org.dxworks.clippy.model.ClippyContent;

import java.util.List;

/**
 * Parsed content together with the warnings recorded while degrading unsupported or
 * oversized input.
 */
public record ParseOutcome(ClippyContent content, List<String> warnings) {

    public ParseOutcome {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
