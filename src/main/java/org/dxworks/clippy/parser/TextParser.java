package org.dxworks.clippy.parser;

import org.dxworks.clippy.model.ClippyContent;
import org.dxworks.clippy.model.ContentMetadata;
import org.dxworks.clippy.model.OriginalFormat;
import org.dxworks.clippy.model.block.ContentBlock;
import org.dxworks.clippy.model.block.ParagraphBlock;
import org.dxworks.clippy.model.inline.InlineContent;
import org.dxworks.clippy.model.inline.LineBreak;
import org.dxworks.clippy.model.inline.TextSpan;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Plain text to content: blank lines separate paragraphs, single newlines inside a
 * paragraph become line breaks. No formatting is inferred.
 */
public class TextParser {

    private static final Pattern PARAGRAPH_SEPARATOR = Pattern.compile("\\n\\s*\\n");
    private static final Pattern LINE_SEPARATOR = Pattern.compile("\\n");

    private final Clock clock;

    public TextParser() {
        this(Clock.systemUTC());
    }

    public TextParser(Clock clock) {
        this.clock = clock;
    }

    public ClippyContent parseText(String text, BlockParseOptions options) {
        return parse(text, options).content();
    }

    public ParseOutcome parse(String text, BlockParseOptions options) {
        ParseSession session = new ParseSession(options, clock);
        List<ContentBlock> blocks = new ArrayList<>();
        if (text != null && !text.isBlank()) {
            String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
            for (String chunk : PARAGRAPH_SEPARATOR.split(normalized)) {
                String paragraph = chunk.strip();
                if (paragraph.isEmpty()) {
                    continue;
                }
                if (blocks.size() >= options.limits().maxBlocks()) {
                    session.warn("Text exceeds " + options.limits().maxBlocks() + " paragraphs, remaining text dropped");
                    break;
                }
                blocks.add(new ParagraphBlock(session.nextId(), lines(paragraph, options.limits().maxTextLength(), session)));
            }
        }
        ContentMetadata metadata = options.includeMetadata()
                ? new ContentMetadata(options.sourceUrl(), options.sourceDomain(), Instant.now(clock).toString(), OriginalFormat.TEXT)
                : null;
        return new ParseOutcome(ClippyContent.of(blocks, metadata), session.warnings());
    }

    private static List<InlineContent> lines(String paragraph, int maxTextLength, ParseSession session) {
        List<InlineContent> content = new ArrayList<>();
        for (String line : LINE_SEPARATOR.split(paragraph)) {
            if (!content.isEmpty()) {
                content.add(LineBreak.INSTANCE);
            }
            String text = line.strip();
            if (text.length() > maxTextLength) {
                session.warn("Text line of " + text.length() + " chars truncated to " + maxTextLength);
                text = text.substring(0, maxTextLength);
            }
            if (!text.isEmpty()) {
                content.add(TextSpan.plain(text));
            }
        }
        return content;
    }
}
