package org.dxworks.clippy.model.block;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.dxworks.clippy.model.BlockKind;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DividerBlock(String id) implements ContentBlock {

    @Override
    public BlockKind kind() {
        return BlockKind.DIVIDER;
    }

    @Override
    public DividerBlock withId(String newId) {
        return new DividerBlock(newId);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitDivider(this);
    }
}
