package org.dxworks.clippy.model.block;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.dxworks.clippy.model.BlockKind;

/**
 * Preformatted code. {@code content} is the raw text, {@code language} may be null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CodeBlock(String id, String content, String language) implements ContentBlock {

    public CodeBlock {
        content = content == null ? "" : content;
    }

    @Override
    public BlockKind kind() {
        return BlockKind.CODE;
    }

    @Override
    public CodeBlock withId(String newId) {
        return new CodeBlock(newId, content, language);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitCode(this);
    }
}
