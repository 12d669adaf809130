package org.dxworks.clippy.parser;

import org.dxworks.clippy.model.FormattingKind;
import org.dxworks.clippy.model.TextFormatting;
import org.dxworks.clippy.model.inline.InlineContent;
import org.dxworks.clippy.model.inline.LineBreak;
import org.dxworks.clippy.model.inline.LinkSpan;
import org.dxworks.clippy.model.inline.TextSpan;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Turns an inline markup fragment into an ordered sequence of text spans, links and
 * line breaks. Formatting is tracked on a stack that is pushed when a formatting
 * element is entered and popped when it is left.
 */
public class InlineParser {

    private static final Logger logger = LoggerFactory.getLogger(InlineParser.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MAX_ELEMENT_DEPTH = 256;
    private static final int MAX_LOGGED_URL_LENGTH = 80;

    private static final Map<String, FormattingKind> FORMATTING_TAGS = Map.ofEntries(
            Map.entry("strong", FormattingKind.BOLD),
            Map.entry("b", FormattingKind.BOLD),
            Map.entry("em", FormattingKind.ITALIC),
            Map.entry("i", FormattingKind.ITALIC),
            Map.entry("u", FormattingKind.UNDERLINE),
            Map.entry("ins", FormattingKind.UNDERLINE),
            Map.entry("s", FormattingKind.STRIKETHROUGH),
            Map.entry("del", FormattingKind.STRIKETHROUGH),
            Map.entry("strike", FormattingKind.STRIKETHROUGH),
            Map.entry("code", FormattingKind.CODE),
            Map.entry("kbd", FormattingKind.CODE),
            Map.entry("samp", FormattingKind.CODE)
    );

    // Elements whose edges separate lines when they appear inside inline content
    private static final Set<String> LINE_BOUNDARY_TAGS = Set.of(
            "p", "div", "h1", "h2", "h3", "h4", "h5", "h6", "li", "ul", "ol", "blockquote", "pre",
            "section", "article", "header", "footer", "aside", "nav", "main", "figure", "figcaption",
            "table", "tr", "dt", "dd", "address"
    );

    private final InlineParseOptions options;

    public InlineParser(InlineParseOptions options) {
        this.options = options;
    }

    /**
     * Parses an inline fragment. Problems such as rejected link targets are logged and
     * never abort the parse.
     */
    public static List<InlineContent> parseInline(String fragment, InlineParseOptions options) {
        return new InlineParser(options).parse(fragment, logger::warn);
    }

    public List<InlineContent> parse(String fragment, Consumer<String> warnings) {
        if (fragment == null || fragment.isEmpty()) {
            return List.of();
        }
        Element container = Jsoup.parseBodyFragment(fragment).body();
        return parseNodes(container.childNodes(), warnings);
    }

    public List<InlineContent> parseNodes(List<Node> nodes, Consumer<String> warnings) {
        InlineContext context = new InlineContext(warnings, TextFormatting.NONE);
        processNodes(nodes, context, 0);
        context.flush();
        return postProcess(context.result, warnings);
    }

    private void processNodes(List<Node> nodes, InlineContext context, int depth) {
        for (Node node : nodes) {
            processNode(node, context, depth);
        }
    }

    private void processNode(Node node, InlineContext context, int depth) {
        if (node instanceof TextNode textNode) {
            appendText(textNode.getWholeText(), context);
            return;
        }
        if (!(node instanceof Element element)) {
            return;
        }
        if (depth > MAX_ELEMENT_DEPTH) {
            appendText(element.text(), context);
            return;
        }

        String tag = element.normalName();
        FormattingKind kind = FORMATTING_TAGS.get(tag);
        if (kind != null && !(kind == FormattingKind.BOLD && declaresNormalWeight(element.attr("style")))) {
            processFormatted(element, TextFormatting.of(kind), context, depth);
            return;
        }

        switch (tag) {
            case "a" -> processLink(element, context, depth);
            case "br" -> {
                context.flush();
                context.emit(LineBreak.INSTANCE);
            }
            default -> {
                if (LINE_BOUNDARY_TAGS.contains(tag)) {
                    context.separateLine();
                    processStyled(element, context, depth);
                    context.separateLine();
                    return;
                }
                processStyled(element, context, depth);
            }
        }
    }

    private void processStyled(Element element, InlineContext context, int depth) {
        TextFormatting styled = formattingFromStyle(element.attr("style"));
        if (styled.hasAny()) {
            processFormatted(element, styled, context, depth);
        } else {
            processNodes(element.childNodes(), context, depth + 1);
        }
    }

    private void appendText(String raw, InlineContext context) {
        if (raw == null || raw.isEmpty()) {
            return;
        }
        String text = raw;
        if (!options.preserveWhitespace()) {
            text = WHITESPACE.matcher(text).replaceAll(" ");
            if (text.startsWith(" ") && context.bufferEndsWithSpace()) {
                text = text.substring(1);
            }
        }
        context.buffer.append(text);
    }

    private void processFormatted(Element element, TextFormatting added, InlineContext context, int depth) {
        context.flush();
        context.formatting.push(context.current().union(added));
        processNodes(element.childNodes(), context, depth + 1);
        context.flush();
        context.formatting.pop();
    }

    private void processLink(Element element, InlineContext context, int depth) {
        String href = element.attr("href");
        if (href.isBlank()) {
            processNodes(element.childNodes(), context, depth + 1);
            return;
        }
        if (href.length() > options.maxUrlLength()) {
            context.warnings.accept("Link target too long (" + href.length() + " chars), keeping link text only");
            processNodes(element.childNodes(), context, depth + 1);
            return;
        }
        if (options.validateUrls() && !UrlPolicy.hasAllowedTarget(href.trim())) {
            context.warnings.accept("Unsupported link target '" + abbreviate(href) + "', keeping link text only");
            processNodes(element.childNodes(), context, depth + 1);
            return;
        }

        context.flush();
        InlineContext inner = new InlineContext(context.warnings, context.current());
        processNodes(element.childNodes(), inner, depth + 1);
        inner.flush();

        String text = linkText(inner.result);
        if (!options.preserveWhitespace()) {
            text = WHITESPACE.matcher(text).replaceAll(" ").strip();
        }
        if (text.isEmpty()) {
            text = href;
        }
        context.emit(new LinkSpan(href, text, commonFormatting(inner.result, context.current())));
    }

    private static String linkText(List<InlineContent> content) {
        StringBuilder text = new StringBuilder();
        for (InlineContent item : content) {
            if (item instanceof TextSpan span) {
                text.append(span.text());
            } else if (item instanceof LinkSpan link) {
                text.append(link.text());
            } else {
                text.append(' ');
            }
        }
        return text.toString();
    }

    private static TextFormatting commonFormatting(List<InlineContent> content, TextFormatting base) {
        TextFormatting common = null;
        for (InlineContent item : content) {
            if (item instanceof TextSpan span && !span.text().isBlank()) {
                common = common == null ? span.formatting() : common.intersect(span.formatting());
            }
        }
        return common == null ? base : common;
    }

    private List<InlineContent> postProcess(List<InlineContent> raw, Consumer<String> warnings) {
        List<InlineContent> items = options.preserveWhitespace() ? raw : normalizeWhitespace(raw);
        items = dropEmptyText(items);
        if (options.mergeAdjacentText()) {
            items = InlineMerger.merge(items);
        }
        return List.copyOf(enforceTextLimit(items, warnings));
    }

    /**
     * Trims the sequence at its ends and around line breaks and keeps a space shared by
     * two neighbouring spans only once.
     */
    private static List<InlineContent> normalizeWhitespace(List<InlineContent> items) {
        List<InlineContent> out = new ArrayList<>(items.size());
        boolean lineStart = true;
        for (InlineContent item : items) {
            if (item instanceof TextSpan span) {
                String text = span.text();
                if ((lineStart || endsWithSpace(out)) && text.startsWith(" ")) {
                    text = text.substring(1);
                }
                if (text.isEmpty()) {
                    continue;
                }
                out.add(span.withText(text));
                lineStart = false;
            } else if (item instanceof LineBreak) {
                trimTrailingSpace(out);
                out.add(item);
                lineStart = true;
            } else {
                out.add(item);
                lineStart = false;
            }
        }
        trimTrailingSpace(out);
        return out;
    }

    private static boolean endsWithSpace(List<InlineContent> out) {
        return !out.isEmpty() && out.get(out.size() - 1) instanceof TextSpan last && last.text().endsWith(" ");
    }

    private static void trimTrailingSpace(List<InlineContent> out) {
        while (!out.isEmpty() && out.get(out.size() - 1) instanceof TextSpan last && last.text().endsWith(" ")) {
            String trimmed = last.text().substring(0, last.text().length() - 1);
            if (trimmed.isEmpty()) {
                out.remove(out.size() - 1);
            } else {
                out.set(out.size() - 1, last.withText(trimmed));
            }
        }
    }

    private static List<InlineContent> dropEmptyText(List<InlineContent> items) {
        List<InlineContent> out = new ArrayList<>(items.size());
        for (InlineContent item : items) {
            if (item instanceof TextSpan span && span.text().isEmpty()) {
                continue;
            }
            out.add(item);
        }
        return out;
    }

    private List<InlineContent> enforceTextLimit(List<InlineContent> items, Consumer<String> warnings) {
        int max = options.maxTextLength();
        List<InlineContent> out = new ArrayList<>(items.size());
        for (InlineContent item : items) {
            if (item instanceof TextSpan span && span.text().length() > max) {
                warnings.accept("Text span of " + span.text().length() + " chars truncated to " + max);
                out.add(span.withText(span.text().substring(0, max)));
            } else if (item instanceof LinkSpan link && link.text().length() > max) {
                warnings.accept("Link text of " + link.text().length() + " chars truncated to " + max);
                out.add(new LinkSpan(link.url(), link.text().substring(0, max), link.formatting()));
            } else {
                out.add(item);
            }
        }
        return out;
    }

    static TextFormatting formattingFromStyle(String style) {
        TextFormatting formatting = TextFormatting.NONE;
        if (style == null || style.isBlank()) {
            return formatting;
        }
        for (String declaration : style.split(";")) {
            int colon = declaration.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String property = declaration.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = cssValue(declaration.substring(colon + 1));
            switch (property) {
                case "font-weight" -> {
                    if (isBoldWeight(value)) {
                        formatting = formatting.with(FormattingKind.BOLD);
                    }
                }
                case "font-style" -> {
                    if (value.startsWith("italic") || value.startsWith("oblique")) {
                        formatting = formatting.with(FormattingKind.ITALIC);
                    }
                }
                case "text-decoration", "text-decoration-line" -> {
                    if (value.contains("underline")) {
                        formatting = formatting.with(FormattingKind.UNDERLINE);
                    }
                    if (value.contains("line-through")) {
                        formatting = formatting.with(FormattingKind.STRIKETHROUGH);
                    }
                }
                default -> {
                }
            }
        }
        return formatting;
    }

    // Editors such as Google Docs wrap whole documents in <b style="font-weight:normal">
    private static boolean declaresNormalWeight(String style) {
        if (style == null || style.isBlank()) {
            return false;
        }
        for (String declaration : style.split(";")) {
            int colon = declaration.indexOf(':');
            if (colon > 0 && "font-weight".equals(declaration.substring(0, colon).trim().toLowerCase(Locale.ROOT))) {
                String value = cssValue(declaration.substring(colon + 1));
                return !isBoldWeight(value);
            }
        }
        return false;
    }

    private static String cssValue(String raw) {
        String value = raw.trim().toLowerCase(Locale.ROOT);
        int important = value.indexOf('!');
        return important >= 0 ? value.substring(0, important).trim() : value;
    }

    private static boolean isBoldWeight(String value) {
        if (value.equals("bold") || value.equals("bolder")) {
            return true;
        }
        try {
            return Integer.parseInt(value) >= 600;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String abbreviate(String url) {
        return url.length() <= MAX_LOGGED_URL_LENGTH ? url : url.substring(0, MAX_LOGGED_URL_LENGTH) + "...";
    }

    private static final class InlineContext {
        private final Consumer<String> warnings;
        private final Deque<TextFormatting> formatting = new ArrayDeque<>();
        private final StringBuilder buffer = new StringBuilder();
        private final List<InlineContent> result = new ArrayList<>();
        private boolean pendingLineBreak;

        private InlineContext(Consumer<String> warnings, TextFormatting base) {
            this.warnings = warnings;
            this.formatting.push(base);
        }

        private TextFormatting current() {
            return formatting.peek();
        }

        private boolean bufferEndsWithSpace() {
            if (buffer.length() > 0) {
                return buffer.charAt(buffer.length() - 1) == ' ';
            }
            return !result.isEmpty() && result.get(result.size() - 1) instanceof TextSpan last && last.text().endsWith(" ");
        }

        private void flush() {
            if (buffer.length() == 0) {
                return;
            }
            String text = buffer.toString();
            buffer.setLength(0);
            if (pendingLineBreak && text.isBlank()) {
                return;
            }
            emit(new TextSpan(text, current()));
        }

        private void emit(InlineContent item) {
            if (pendingLineBreak) {
                pendingLineBreak = false;
                if (!result.isEmpty() && !(result.get(result.size() - 1) instanceof LineBreak) && !(item instanceof LineBreak)) {
                    result.add(LineBreak.INSTANCE);
                }
            }
            result.add(item);
        }

        // The break is only materialized once more content follows
        private void separateLine() {
            flush();
            pendingLineBreak = true;
        }
    }
}
