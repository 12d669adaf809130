package org.dxworks.clippy.model.block;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.dxworks.clippy.model.BlockKind;

/**
 * A structural unit of content. The set of variants is closed; dispatch goes through
 * {@link BlockVisitor} so every consumer handles each variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ParagraphBlock.class, name = "paragraph"),
        @JsonSubTypes.Type(value = HeadingBlock.class, name = "heading"),
        @JsonSubTypes.Type(value = ListBlock.class, name = "list"),
        @JsonSubTypes.Type(value = QuoteBlock.class, name = "quote"),
        @JsonSubTypes.Type(value = CodeBlock.class, name = "code"),
        @JsonSubTypes.Type(value = DividerBlock.class, name = "divider")
})
public sealed interface ContentBlock permits ParagraphBlock, HeadingBlock, ListBlock, QuoteBlock, CodeBlock, DividerBlock {

    String id();

    @JsonIgnore
    BlockKind kind();

    ContentBlock withId(String newId);

    <R> R accept(BlockVisitor<R> visitor);
}
