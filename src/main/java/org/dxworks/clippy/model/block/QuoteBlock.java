package org.dxworks.clippy.model.block;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.dxworks.clippy.model.BlockKind;
import org.dxworks.clippy.model.inline.InlineContent;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record QuoteBlock(String id, List<InlineContent> content, String citation) implements ContentBlock {

    public QuoteBlock {
        content = content == null ? List.of() : List.copyOf(content);
    }

    @Override
    public BlockKind kind() {
        return BlockKind.QUOTE;
    }

    @Override
    public QuoteBlock withId(String newId) {
        return new QuoteBlock(newId, content, citation);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitQuote(this);
    }
}
