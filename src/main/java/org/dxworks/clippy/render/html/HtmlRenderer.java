package org.dxworks.clippy.render.html;

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

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders content as HTML for contenteditable targets. Inline formatting is always
 * nested in the same order, code innermost and strikethrough outermost, so equal
 * formatting sets produce equal markup.
 */
public class HtmlRenderer {

    public String render(ClippyContent content) {
        return render(content, HtmlRenderConfig.DEFAULTS);
    }

    public String render(ClippyContent content, HtmlRenderConfig config) {
        if (content == null || content.blocks().isEmpty()) {
            return "";
        }
        Blocks blocks = new Blocks(config);
        String html = content.blocks().stream()
                .map(block -> block.accept(blocks))
                .filter(rendered -> !rendered.isBlank())
                .collect(Collectors.joining("\n"));
        return config.cleanOutput() ? html.trim() : html;
    }

    public String renderInline(List<InlineContent> content, HtmlRenderConfig config) {
        Inlines inlines = new Inlines(config);
        StringBuilder html = new StringBuilder();
        for (InlineContent item : content) {
            html.append(item.accept(inlines));
        }
        return html.toString();
    }

    public static String escape(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#39;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }

    private final class Blocks implements BlockVisitor<String> {
        private final HtmlRenderConfig config;

        private Blocks(HtmlRenderConfig config) {
            this.config = config;
        }

        @Override
        public String visitParagraph(ParagraphBlock block) {
            return "<p" + idAttribute(block.id()) + ">" + renderInline(block.content(), config) + "</p>";
        }

        @Override
        public String visitHeading(HeadingBlock block) {
            int level = Math.max(1, Math.min(6, block.level()));
            return "<h" + level + idAttribute(block.id()) + ">" + renderInline(block.content(), config) + "</h" + level + ">";
        }

        @Override
        public String visitList(ListBlock block) {
            String tag = block.listType() == ListType.NUMBERED ? "ol" : "ul";
            StringBuilder html = new StringBuilder();
            html.append('<').append(tag).append(idAttribute(block.id())).append('>');
            for (ListItem item : block.items()) {
                html.append("<li").append(idAttribute(item.id())).append('>');
                html.append(renderInline(item.content(), config));
                if (item.nested() != null) {
                    html.append(visitList(item.nested()));
                }
                html.append("</li>");
            }
            return html.append("</").append(tag).append('>').toString();
        }

        @Override
        public String visitQuote(QuoteBlock block) {
            String cite = block.citation() == null || block.citation().isBlank()
                    ? ""
                    : " cite=\"" + escape(block.citation()) + "\"";
            return "<blockquote" + idAttribute(block.id()) + cite + ">" + renderInline(block.content(), config) + "</blockquote>";
        }

        @Override
        public String visitCode(CodeBlock block) {
            String languageClass = block.language() == null || block.language().isBlank()
                    ? ""
                    : " class=\"language-" + escape(block.language()) + "\"";
            return "<pre" + idAttribute(block.id()) + "><code" + languageClass + ">" + escape(block.content()) + "</code></pre>";
        }

        @Override
        public String visitDivider(DividerBlock block) {
            return "<hr" + idAttribute(block.id()) + ">";
        }

        private String idAttribute(String id) {
            if (!config.includeIds() || id == null || id.isBlank()) {
                return "";
            }
            return " id=\"" + escape(id) + "\"";
        }
    }

    private static final class Inlines implements InlineVisitor<String> {
        private final HtmlRenderConfig config;

        private Inlines(HtmlRenderConfig config) {
            this.config = config;
        }

        @Override
        public String visitText(TextSpan span) {
            return wrap(escape(span.text()), span.formatting());
        }

        @Override
        public String visitLink(LinkSpan span) {
            String url = span.url() == null ? "" : span.url().trim();
            boolean renderable = config.validateUrls()
                    ? UrlPolicy.isSafe(url, config.maxUrlLength())
                    : !url.isEmpty();
            if (!renderable) {
                return visitText(span.asText());
            }
            return "<a href=\"" + escape(url) + "\">" + wrap(escape(span.text()), span.formatting()) + "</a>";
        }

        @Override
        public String visitLineBreak(LineBreak lineBreak) {
            return "<br>";
        }

        private String wrap(String html, TextFormatting formatting) {
            String result = html;
            if (formatting.code()) {
                result = "<code>" + result + "</code>";
            }
            if (formatting.bold()) {
                result = element(config.useSemanticElements() ? "strong" : "b", result);
            }
            if (formatting.italic()) {
                result = element(config.useSemanticElements() ? "em" : "i", result);
            }
            if (formatting.underline()) {
                result = element("u", result);
            }
            if (formatting.strikethrough()) {
                result = element(config.useSemanticElements() ? "del" : "s", result);
            }
            return result;
        }

        private static String element(String tag, String inner) {
            return "<" + tag + ">" + inner + "</" + tag + ">";
        }
    }
}
