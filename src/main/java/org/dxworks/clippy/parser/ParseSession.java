package org.dxworks.clippy.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one parse call: id counter, current list depth and the warnings
 * collected so far. Created per call and discarded with it.
 */
final class ParseSession {

    private static final Logger logger = LoggerFactory.getLogger(ParseSession.class);

    private final BlockParseOptions options;
    private final BlockIdGenerator ids;
    private final InlineParser inlineParser;
    private final List<String> warnings = new ArrayList<>();
    private int listDepth;

    ParseSession(BlockParseOptions options, Clock clock) {
        this.options = options;
        this.ids = options.idPolicy() == IdPolicy.GENERATE
                ? BlockIdGenerator.fromClock(clock)
                : BlockIdGenerator.disabled();
        this.inlineParser = new InlineParser(options.inlineOptions());
    }

    BlockParseOptions options() {
        return options;
    }

    InlineParser inlineParser() {
        return inlineParser;
    }

    String nextId() {
        return ids.next();
    }

    void warn(String message) {
        warnings.add(message);
        logger.warn(message);
    }

    int enterList() {
        return ++listDepth;
    }

    void exitList() {
        listDepth--;
    }

    List<String> warnings() {
        return List.copyOf(warnings);
    }
}
