package org.dxworks.clippy.render.markdown;

import org.dxworks.clippy.model.ClippyContent;
import org.dxworks.clippy.model.ListType;
import org.dxworks.clippy.model.TextFormatting;
import org.dxworks.clippy.model.block.BlockVisitor;
import org.dxworks.clippy.model.block.CodeBlock;
import org.dxworks.clippy.model.block.ContentBlock;
import org.dxworks.clippy.model.block.DividerBlock;
import org.dxworks.clippy.model.block.HeadingBlock;
import org.dxworks.clippy.model.block.ListBlock;
import org.dxworks.clippy.model.block.ListItem;
import org.dxworks.clippy.model.block.ParagraphBlock;
import org.dxworks.clippy.model.block.QuoteBlock;
import org.dxworks.clippy.model.inline.InlineContent;
import org.dxworks.clippy.model.inline.InlineVisitor;
import org.dxworks.clippy.model.inline.LineBreak;
import org.dxworks.clippy.model.inline.LinkSpan;
import org.dxworks.clippy.model.inline.TextSpan;
import org.dxworks.clippy.parser.UrlPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders content as Markdown in one of the supported flavors.
 */
public class MarkdownRenderer {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownRenderer.class);

    private static final String ESCAPED_CHARACTERS = "\\`*_{}[]()#+-.!";
    private static final String[] BULLETS = {"*", "-", "+"};
    private static final String FLAT_BULLET = "•";
    private static final String DISCORD_DIVIDER = "━".repeat(30);
    private static final String DIVIDER = "---";

    public String render(ClippyContent content) {
        return render(content, MarkdownRenderConfig.DEFAULTS);
    }

    public String render(ClippyContent content, MarkdownRenderConfig config) {
        if (content == null || content.blocks().isEmpty()) {
            return "";
        }
        Blocks blocks = new Blocks(config);
        List<String> chunks = new ArrayList<>();
        for (ContentBlock block : content.blocks()) {
            String markdown = block.accept(blocks);
            if (block instanceof HeadingBlock && config.flavor().headingsAsBold()) {
                markdown = headingAsBold(markdown, config.flavor());
            }
            if (!markdown.isBlank()) {
                chunks.add(markdown);
            }
        }
        return tidy(String.join("\n\n", chunks));
    }

    /**
     * Replaces the {@code #} prefix of a rendered heading with bold markers around each of
     * its lines.
     */
    static String headingAsBold(String heading, MarkdownFlavor flavor) {
        int start = 0;
        while (start < heading.length() && heading.charAt(start) == '#') {
            start++;
        }
        String body = heading.substring(start).strip();
        if (body.isEmpty()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        for (String line : body.split("\n")) {
            String text = line.strip();
            lines.add(text.isEmpty() ? "" : flavor.boldMarker() + text + flavor.boldMarker());
        }
        return String.join("\n", lines);
    }

    private static String tidy(String markdown) {
        int start = 0;
        while (start < markdown.length() && (markdown.charAt(start) == '\n' || markdown.charAt(start) == '\r')) {
            start++;
        }
        return markdown.substring(start).stripTrailing();
    }

    static String escape(String text, MarkdownFlavor flavor) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (ESCAPED_CHARACTERS.indexOf(c) >= 0 || flavor.extraEscapes().indexOf(c) >= 0) {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    static String encodeUrl(String url) {
        return url.replace("(", "%28").replace(")", "%29").replace(" ", "%20")
                .replace("<", "%3C").replace(">", "%3E");
    }

    // Slack reads <url|text> up to the first '>' and splits on the first '|'
    static String encodeSlackUrl(String url) {
        return url.replace(" ", "%20").replace("<", "%3C").replace(">", "%3E").replace("|", "%7C");
    }

    static String escapeSlackText(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    private static String codeSpan(String text) {
        if (text.indexOf('`') >= 0) {
            return "`` " + text + " ``";
        }
        return "`" + text + "`";
    }

    private static String fence(String code) {
        int longest = 0;
        int run = 0;
        for (int i = 0; i < code.length(); i++) {
            run = code.charAt(i) == '`' ? run + 1 : 0;
            longest = Math.max(longest, run);
        }
        return "`".repeat(Math.max(3, longest + 1));
    }

    private static final class Blocks implements BlockVisitor<String> {
        private final MarkdownRenderConfig config;
        private final Inlines inlines;

        private Blocks(MarkdownRenderConfig config) {
            this.config = config;
            this.inlines = new Inlines(config);
        }

        @Override
        public String visitParagraph(ParagraphBlock block) {
            return inlines.render(block.content());
        }

        @Override
        public String visitHeading(HeadingBlock block) {
            int level = Math.max(1, Math.min(6, block.level()));
            return "#".repeat(level) + " " + inlines.render(block.content());
        }

        @Override
        public String visitList(ListBlock block) {
            return renderList(block, 0, "");
        }

        private String renderList(ListBlock list, int depth, String indent) {
            if (depth >= config.maxNestingLevel()) {
                logger.warn("List nesting deeper than {} levels rendered as a flat list", config.maxNestingLevel());
                List<String> lines = new ArrayList<>();
                flatten(list, indent, lines);
                return String.join("\n", lines);
            }
            List<String> lines = new ArrayList<>();
            int number = 1;
            for (ListItem item : list.items()) {
                String marker = list.listType() == ListType.NUMBERED ? (number++) + "." : BULLETS[depth % BULLETS.length];
                String childIndent = indent + " ".repeat(marker.length() + 1);
                String text = inlines.render(item.content()).replace("\n", "\n" + childIndent);
                lines.add(indent + marker + " " + text);
                if (item.nested() != null) {
                    String nested = renderList(item.nested(), depth + 1, childIndent);
                    if (!nested.isBlank()) {
                        lines.add(nested);
                    }
                }
            }
            return String.join("\n", lines);
        }

        private void flatten(ListBlock list, String indent, List<String> lines) {
            for (ListItem item : list.items()) {
                String text = inlines.render(item.content()).replace("\n", "\n" + indent + "  ");
                lines.add(indent + FLAT_BULLET + " " + text);
                if (item.nested() != null) {
                    flatten(item.nested(), indent, lines);
                }
            }
        }

        @Override
        public String visitQuote(QuoteBlock block) {
            List<String> lines = new ArrayList<>();
            for (String line : inlines.render(block.content()).split("\n", -1)) {
                lines.add(line.isEmpty() ? ">" : "> " + line);
            }
            String quote = String.join("\n", lines);
            if (block.citation() != null && !block.citation().isBlank()) {
                quote += "\n>\n> — " + block.citation().strip();
            }
            return quote;
        }

        @Override
        public String visitCode(CodeBlock block) {
            String code = block.content().endsWith("\n")
                    ? block.content().substring(0, block.content().length() - 1)
                    : block.content();
            if (!config.useCodeFences()) {
                List<String> lines = new ArrayList<>();
                for (String line : code.split("\n", -1)) {
                    lines.add("    " + line);
                }
                return String.join("\n", lines);
            }
            String fence = fence(code);
            String language = block.language() == null ? "" : block.language().strip();
            return fence + language + "\n" + code + "\n" + fence;
        }

        @Override
        public String visitDivider(DividerBlock block) {
            return config.flavor() == MarkdownFlavor.DISCORD ? DISCORD_DIVIDER : DIVIDER;
        }
    }

    private static final class Inlines implements InlineVisitor<String> {
        private final MarkdownRenderConfig config;
        private final MarkdownFlavor flavor;

        private Inlines(MarkdownRenderConfig config) {
            this.config = config;
            this.flavor = config.flavor();
        }

        private String render(List<InlineContent> content) {
            StringBuilder markdown = new StringBuilder();
            for (InlineContent item : content) {
                markdown.append(item.accept(this));
            }
            return markdown.toString();
        }

        @Override
        public String visitText(TextSpan span) {
            return formatted(span.text(), span.formatting());
        }

        @Override
        public String visitLink(LinkSpan span) {
            String url = span.url() == null ? "" : span.url().trim();
            if (!UrlPolicy.isSafe(url, config.maxUrlLength())) {
                return visitText(span.asText());
            }
            // Code and underline markers do not survive inside link text
            TextFormatting linkFormatting = new TextFormatting(
                    span.formatting().bold(), span.formatting().italic(), false, span.formatting().strikethrough(), false);
            if (flavor.angleBracketLinks()) {
                String target = encodeSlackUrl(url);
                if (span.text().equals(span.url())) {
                    return "<" + target + ">";
                }
                return "<" + target + "|" + formatted(escapeSlackText(span.text()), linkFormatting) + ">";
            }
            String text = formatted(span.text(), linkFormatting);
            return "[" + text + "](" + encodeUrl(url) + ")";
        }

        @Override
        public String visitLineBreak(LineBreak lineBreak) {
            return config.lineBreakStyle().markup();
        }

        private String formatted(String text, TextFormatting formatting) {
            if (text.isEmpty()) {
                return "";
            }
            if (!config.preserveFormatting() || !formatting.hasAny()) {
                return escape(text, flavor);
            }
            int start = 0;
            while (start < text.length() && Character.isWhitespace(text.charAt(start))) {
                start++;
            }
            if (start == text.length()) {
                return text;
            }
            int end = text.length();
            while (Character.isWhitespace(text.charAt(end - 1))) {
                end--;
            }
            String core = text.substring(start, end);

            String body = formatting.code() ? codeSpan(core) : escape(core, flavor);
            if (formatting.bold()) {
                body = flavor.boldMarker() + body + flavor.boldMarker();
            }
            if (formatting.italic()) {
                body = flavor.italicMarker() + body + flavor.italicMarker();
            }
            if (formatting.underline()) {
                if (flavor.underlineMarker().isPresent()) {
                    String marker = flavor.underlineMarker().get();
                    body = marker + body + marker;
                } else if (!formatting.italic()) {
                    body = flavor.italicMarker() + body + flavor.italicMarker();
                }
            }
            if (formatting.strikethrough()) {
                body = flavor.strikethroughMarker() + body + flavor.strikethroughMarker();
            }
            return text.substring(0, start) + body + text.substring(end);
        }
    }
}
