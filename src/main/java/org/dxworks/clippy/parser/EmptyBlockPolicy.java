package org.dxworks.clippy.parser;

public enum EmptyBlockPolicy {
    KEEP,
    /** Removes blocks and list items without text, empty code and lists left without items. */
    DROP
}
