package org.dxworks.clippy.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.dxworks.clippy.model.block.ContentBlock;

import java.util.List;

/**
 * Root of the content model: a version tag, the ordered blocks and optional capture
 * metadata. Instances are immutable; transformations return new instances.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClippyContent(String version, List<ContentBlock> blocks, ContentMetadata metadata) {

    public static final String CURRENT_VERSION = "1.0";

    public ClippyContent {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public static ClippyContent of(List<ContentBlock> blocks, ContentMetadata metadata) {
        return new ClippyContent(CURRENT_VERSION, blocks, metadata);
    }

    public static ClippyContent empty(ContentMetadata metadata) {
        return new ClippyContent(CURRENT_VERSION, List.of(), metadata);
    }
}
