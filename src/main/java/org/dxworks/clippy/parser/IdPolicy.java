package org.dxworks.clippy.parser;

public enum IdPolicy {
    /** Every block and list item gets a {@code block-<millis>-<n>} id. */
    GENERATE,
    /** Ids are left empty. */
    NONE
}
