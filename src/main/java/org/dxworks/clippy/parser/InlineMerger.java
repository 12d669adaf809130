package org.dxworks.clippy.parser;

import org.dxworks.clippy.model.inline.InlineContent;
import org.dxworks.clippy.model.inline.TextSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Joins adjacent text spans whose formatting sets are equal. Running it on its own
 * output returns an equal list.
 */
public final class InlineMerger {

    private InlineMerger() {
    }

    public static List<InlineContent> merge(List<InlineContent> content) {
        List<InlineContent> merged = new ArrayList<>(content.size());
        for (InlineContent item : content) {
            if (item instanceof TextSpan span && !merged.isEmpty()
                    && merged.get(merged.size() - 1) instanceof TextSpan last
                    && last.formatting().equals(span.formatting())) {
                merged.set(merged.size() - 1, last.withText(last.text() + span.text()));
                continue;
            }
            merged.add(item);
        }
        return merged;
    }

    public static boolean isMerged(List<InlineContent> content) {
        for (int i = 1; i < content.size(); i++) {
            if (content.get(i - 1) instanceof TextSpan previous
                    && content.get(i) instanceof TextSpan current
                    && previous.formatting().equals(current.formatting())) {
                return false;
            }
        }
        return true;
    }
}
