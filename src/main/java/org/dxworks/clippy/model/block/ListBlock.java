package org.dxworks.clippy.model.block;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.dxworks.clippy.model.BlockKind;
import org.dxworks.clippy.model.ListType;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ListBlock(String id, ListType listType, List<ListItem> items) implements ContentBlock {

    public ListBlock {
        listType = listType == null ? ListType.BULLETED : listType;
        items = items == null ? List.of() : List.copyOf(items);
    }

    @Override
    public BlockKind kind() {
        return BlockKind.LIST;
    }

    @Override
    public ListBlock withId(String newId) {
        return new ListBlock(newId, listType, items);
    }

    /**
     * Depth of this list counting itself as 1.
     */
    public int depth() {
        int deepest = 0;
        for (ListItem item : items) {
            if (item.nested() != null) {
                deepest = Math.max(deepest, item.nested().depth());
            }
        }
        return deepest + 1;
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitList(this);
    }
}
