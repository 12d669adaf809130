package org.dxworks.clippy.model.block;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.dxworks.clippy.model.BlockKind;
import org.dxworks.clippy.model.inline.InlineContent;

import java.util.List;

/**
 * Heading of level 1-6. The level is not range-checked here; the validator reports it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HeadingBlock(String id, int level, List<InlineContent> content) implements ContentBlock {

    public HeadingBlock {
        content = content == null ? List.of() : List.copyOf(content);
    }

    @Override
    public BlockKind kind() {
        return BlockKind.HEADING;
    }

    @Override
    public HeadingBlock withId(String newId) {
        return new HeadingBlock(newId, level, content);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitHeading(this);
    }
}
