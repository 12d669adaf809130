package org.dxworks.clippy.render.text;

import org.dxworks.clippy.model.ClippyContent;
import org.dxworks.clippy.model.block.BlockVisitor;
import org.dxworks.clippy.model.block.CodeBlock;
import org.dxworks.clippy.model.block.DividerBlock;
import org.dxworks.clippy.model.block.HeadingBlock;
import org.dxworks.clippy.model.block.ListBlock;
import org.dxworks.clippy.model.block.ListItem;
import org.dxworks.clippy.model.block.ParagraphBlock;
import org.dxworks.clippy.model.block.QuoteBlock;
import org.dxworks.clippy.model.inline.InlineContent;
import org.dxworks.clippy.model.inline.LineBreak;
import org.dxworks.clippy.model.inline.LinkSpan;
import org.dxworks.clippy.model.inline.TextSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Formatting-free rendering, used for textareas, previews and as the fallback when a
 * richer format cannot be produced.
 */
public class PlainTextRenderer {

    private static final String ELLIPSIS = "...";

    public String render(ClippyContent content) {
        if (content == null || content.blocks().isEmpty()) {
            return "";
        }
        List<String> chunks = new ArrayList<>();
        Blocks blocks = new Blocks();
        content.blocks().forEach(block -> {
            String text = block.accept(blocks);
            if (!text.isBlank()) {
                chunks.add(text);
            }
        });
        return String.join("\n\n", chunks);
    }

    /**
     * Text of the content cut to {@code maxLength} characters, with {@code ...} appended
     * when something was cut.
     */
    public String preview(ClippyContent content, int maxLength) {
        String text = render(content);
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, Math.max(0, maxLength)).trim() + ELLIPSIS;
    }

    public static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, Math.max(0, maxLength)) + ELLIPSIS;
    }

    public static String inlineText(List<InlineContent> content) {
        StringBuilder text = new StringBuilder();
        for (InlineContent item : content) {
            if (item instanceof TextSpan span) {
                text.append(span.text());
            } else if (item instanceof LinkSpan link) {
                text.append(link.text());
            } else if (item instanceof LineBreak) {
                text.append('\n');
            }
        }
        return text.toString();
    }

    private static final class Blocks implements BlockVisitor<String> {

        @Override
        public String visitParagraph(ParagraphBlock block) {
            return inlineText(block.content());
        }

        @Override
        public String visitHeading(HeadingBlock block) {
            return inlineText(block.content());
        }

        @Override
        public String visitList(ListBlock block) {
            List<String> lines = new ArrayList<>();
            appendItems(block, "", lines);
            return String.join("\n", lines);
        }

        private void appendItems(ListBlock list, String indent, List<String> lines) {
            for (ListItem item : list.items()) {
                lines.add(indent + "• " + inlineText(item.content()).replace("\n", "\n" + indent + "  "));
                if (item.nested() != null) {
                    appendItems(item.nested(), indent + "  ", lines);
                }
            }
        }

        @Override
        public String visitQuote(QuoteBlock block) {
            return inlineText(block.content());
        }

        @Override
        public String visitCode(CodeBlock block) {
            return block.content();
        }

        @Override
        public String visitDivider(DividerBlock block) {
            return "---";
        }
    }
}
