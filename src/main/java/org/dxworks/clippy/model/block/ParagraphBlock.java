package org.dxworks.clippy.model.block;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.dxworks.clippy.model.BlockKind;
import org.dxworks.clippy.model.inline.InlineContent;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ParagraphBlock(String id, List<InlineContent> content) implements ContentBlock {

    public ParagraphBlock {
        content = content == null ? List.of() : List.copyOf(content);
    }

    @Override
    public BlockKind kind() {
        return BlockKind.PARAGRAPH;
    }

    @Override
    public ParagraphBlock withId(String newId) {
        return new ParagraphBlock(newId, content);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitParagraph(this);
    }
}
