package org.dxworks.clippy.model.inline;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A run of text, a link or a line break inside a block.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextSpan.class, name = "text"),
        @JsonSubTypes.Type(value = LinkSpan.class, name = "link"),
        @JsonSubTypes.Type(value = LineBreak.class, name = "linebreak")
})
public sealed interface InlineContent permits TextSpan, LinkSpan, LineBreak {

    <R> R accept(InlineVisitor<R> visitor);
}
