package org.dxworks.clippy.model.block;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.dxworks.clippy.model.inline.InlineContent;

import java.util.List;

/**
 * A list entry owning at most one nested list.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ListItem(String id, List<InlineContent> content, ListBlock nested) {

    public ListItem {
        content = content == null ? List.of() : List.copyOf(content);
    }

    public ListItem withNested(ListBlock newNested) {
        return new ListItem(id, content, newNested);
    }
}
