package org.dxworks.clippy.parser;

import org.dxworks.clippy.model.ClippyContent;
import org.dxworks.clippy.model.ContentMetadata;
import org.dxworks.clippy.model.ListType;
import org.dxworks.clippy.model.OriginalFormat;
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
import org.dxworks.clippy.model.inline.LinkSpan;
import org.dxworks.clippy.model.inline.TextSpan;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Converts captured HTML into {@link ClippyContent}. Unsupported constructs are degraded
 * to paragraphs and reported as warnings; parsing never fails on malformed markup.
 */
public class BlockParser {

    private static final int MAX_CONTAINER_DEPTH = 100;

    private static final Set<String> CONTAINER_TAGS = Set.of(
            "div", "section", "article", "main", "header", "footer", "aside", "nav");

    private static final Set<String> BLOCK_TAGS = Set.of(
            "p", "h1", "h2", "h3", "h4", "h5", "h6", "ul", "ol", "blockquote", "pre", "hr",
            "div", "section", "article", "main", "header", "footer", "aside", "nav");

    // Phrasing content that joins an implicit paragraph at top level; code is a block there
    private static final Set<String> PHRASING_TAGS = Set.of(
            "a", "abbr", "b", "bdi", "bdo", "cite", "data", "del", "dfn", "em", "font", "i", "ins",
            "kbd", "label", "mark", "q", "s", "samp", "small", "span", "strike", "strong", "sub",
            "sup", "time", "u", "var", "wbr");

    private final Clock clock;
    private final TextParser textParser;

    public BlockParser() {
        this(Clock.systemUTC());
    }

    public BlockParser(Clock clock) {
        this.clock = clock;
        this.textParser = new TextParser(clock);
    }

    public ClippyContent parseDocument(String markup, BlockParseOptions options) {
        return parse(markup, options).content();
    }

    public ParseOutcome parse(String markup, BlockParseOptions options) {
        ParseSession session = new ParseSession(options, clock);
        List<ContentBlock> blocks = new ArrayList<>();
        if (markup != null && !markup.isBlank()) {
            Element body = Jsoup.parseBodyFragment(markup).body();
            parseChildren(body, session, blocks, 0);
        }
        List<ContentBlock> finished = finish(blocks, session);
        return new ParseOutcome(ClippyContent.of(finished, metadata(options)), session.warnings());
    }

    public ClippyContent parseText(String text, BlockParseOptions options) {
        return textParser.parseText(text, options);
    }

    private void parseChildren(Element parent, ParseSession session, List<ContentBlock> out, int containerDepth) {
        List<Node> run = new ArrayList<>();
        for (Node node : parent.childNodes()) {
            if (node instanceof TextNode || (node instanceof Element element && PHRASING_TAGS.contains(element.normalName()))) {
                run.add(node);
                continue;
            }
            if (node instanceof Element element) {
                flushImplicitParagraph(run, session, out);
                if (!"br".equals(element.normalName())) {
                    parseElement(element, session, out, containerDepth);
                }
            }
        }
        flushImplicitParagraph(run, session, out);
    }

    private void flushImplicitParagraph(List<Node> run, ParseSession session, List<ContentBlock> out) {
        if (run.isEmpty()) {
            return;
        }
        List<InlineContent> content = session.inlineParser().parseNodes(List.copyOf(run), session::warn);
        run.clear();
        if (!content.isEmpty()) {
            out.add(new ParagraphBlock(session.nextId(), content));
        }
    }

    private void parseElement(Element element, ParseSession session, List<ContentBlock> out, int containerDepth) {
        String tag = element.normalName();
        switch (tag) {
            case "p" -> out.add(new ParagraphBlock(session.nextId(), inline(element, session)));
            case "h1", "h2", "h3", "h4", "h5", "h6" ->
                    out.add(new HeadingBlock(session.nextId(), tag.charAt(1) - '0', inline(element, session)));
            case "ul", "ol" -> out.add(parseList(element, session));
            case "blockquote" -> out.add(parseQuote(element, session));
            case "pre", "code" -> out.add(parseCode(element, session));
            case "hr" -> out.add(new DividerBlock(session.nextId()));
            default -> {
                if (CONTAINER_TAGS.contains(tag)) {
                    parseContainer(element, session, out, containerDepth);
                } else {
                    session.warn("Unsupported element <" + tag + ">, converted to a paragraph");
                    out.add(new ParagraphBlock(session.nextId(), inline(element, session)));
                }
            }
        }
    }

    private void parseContainer(Element element, ParseSession session, List<ContentBlock> out, int containerDepth) {
        if (containerDepth >= MAX_CONTAINER_DEPTH) {
            session.warn("Containers nested deeper than " + MAX_CONTAINER_DEPTH + " levels, collapsed into one paragraph");
            out.add(new ParagraphBlock(session.nextId(), inline(element, session)));
            return;
        }
        if (hasBlockChildren(element)) {
            parseChildren(element, session, out, containerDepth + 1);
        } else {
            out.add(new ParagraphBlock(session.nextId(), inline(element, session)));
        }
    }

    private static boolean hasBlockChildren(Element element) {
        for (Element child : element.children()) {
            if (BLOCK_TAGS.contains(child.normalName())) {
                return true;
            }
        }
        return false;
    }

    private ListBlock parseList(Element element, ParseSession session) {
        String id = session.nextId();
        ListType listType = "ol".equals(element.normalName()) ? ListType.NUMBERED : ListType.BULLETED;
        int depth = session.enterList();
        try {
            int limit = session.options().nestingLimit();
            if (depth >= limit && containsNestedList(element)) {
                session.warn("List nesting exceeds " + limit + " levels, deeper items flattened");
                return new ListBlock(id, ListType.BULLETED, flatItems(element, session));
            }
            List<ListItem> items = new ArrayList<>();
            for (Element child : element.children()) {
                String tag = child.normalName();
                if ("li".equals(tag)) {
                    items.add(parseListItem(child, session));
                } else if (isList(child)) {
                    attachNestedList(items, parseList(child, session), session);
                } else {
                    session.warn("Unexpected <" + tag + "> inside a list, kept as a list item");
                    items.add(new ListItem(session.nextId(), inline(child, session), null));
                }
            }
            return new ListBlock(id, listType, items);
        } finally {
            session.exitList();
        }
    }

    private static boolean containsNestedList(Element list) {
        return list.select("ul, ol").size() > 1;
    }

    /**
     * Every item below {@code list} in document order, nested lists included, collected
     * without recursion so that arbitrarily deep markup cannot exhaust the stack.
     */
    private static List<ListItem> flatItems(Element list, ParseSession session) {
        List<ListItem> items = new ArrayList<>();
        Deque<Element> pending = new ArrayDeque<>();
        pushReversed(list.children(), pending);
        while (!pending.isEmpty()) {
            Element next = pending.pop();
            if (isList(next)) {
                pushReversed(next.children(), pending);
            } else if ("li".equals(next.normalName())) {
                List<Node> inlineNodes = new ArrayList<>();
                List<Element> nestedLists = new ArrayList<>();
                for (Node node : next.childNodes()) {
                    if (node instanceof Element child && isList(child)) {
                        nestedLists.add(child);
                    } else {
                        inlineNodes.add(node);
                    }
                }
                items.add(new ListItem(session.nextId(),
                        session.inlineParser().parseNodes(inlineNodes, session::warn), null));
                pushReversed(nestedLists, pending);
            } else {
                items.add(new ListItem(session.nextId(), inline(next, session), null));
            }
        }
        return items;
    }

    private static void pushReversed(List<Element> elements, Deque<Element> stack) {
        for (int i = elements.size() - 1; i >= 0; i--) {
            stack.push(elements.get(i));
        }
    }

    private static void attachNestedList(List<ListItem> items, ListBlock nested, ParseSession session) {
        int last = items.size() - 1;
        if (last >= 0 && items.get(last).nested() == null) {
            items.set(last, items.get(last).withNested(nested));
            return;
        }
        session.warn("Nested list without a parent item, its items were lifted to the enclosing list");
        items.addAll(nested.items());
    }

    private ListItem parseListItem(Element element, ParseSession session) {
        String id = session.nextId();
        List<Node> inlineNodes = new ArrayList<>();
        ListBlock nested = null;
        for (Node node : element.childNodes()) {
            if (node instanceof Element child && isList(child)) {
                if (nested == null) {
                    nested = parseList(child, session);
                } else {
                    session.warn("List item has more than one nested list, only the first one is kept");
                }
            } else {
                inlineNodes.add(node);
            }
        }
        return new ListItem(id, session.inlineParser().parseNodes(inlineNodes, session::warn), nested);
    }

    private static boolean isList(Element element) {
        String tag = element.normalName();
        return "ul".equals(tag) || "ol".equals(tag);
    }

    private QuoteBlock parseQuote(Element element, ParseSession session) {
        String cite = element.attr("cite").trim();
        return new QuoteBlock(session.nextId(), inline(element, session), cite.isEmpty() ? null : cite);
    }

    private CodeBlock parseCode(Element element, ParseSession session) {
        Optional<String> language = Optional.empty();
        if ("pre".equals(element.normalName())) {
            for (Element child : element.children()) {
                if ("code".equals(child.normalName())) {
                    language = CodeLanguageDetector.detectLanguage(child.className());
                    break;
                }
            }
        }
        if (language.isEmpty()) {
            language = CodeLanguageDetector.detectLanguage(element.className());
        }
        return new CodeBlock(session.nextId(), element.wholeText(), language.orElse(null));
    }

    private static List<InlineContent> inline(Element element, ParseSession session) {
        return session.inlineParser().parseNodes(element.childNodes(), session::warn);
    }

    private List<ContentBlock> finish(List<ContentBlock> blocks, ParseSession session) {
        List<ContentBlock> result = blocks;
        if (session.options().emptyBlockPolicy() == EmptyBlockPolicy.DROP) {
            EmptyBlockFilter filter = new EmptyBlockFilter();
            result = new ArrayList<>();
            for (ContentBlock block : blocks) {
                block.accept(filter).ifPresent(result::add);
            }
        }
        int maxBlocks = session.options().limits().maxBlocks();
        if (result.size() > maxBlocks) {
            session.warn("Content has " + result.size() + " blocks, truncated to " + maxBlocks);
            result = result.subList(0, maxBlocks);
        }
        return result;
    }

    private ContentMetadata metadata(BlockParseOptions options) {
        if (!options.includeMetadata()) {
            return null;
        }
        String domain = options.sourceDomain() != null ? options.sourceDomain() : hostOf(options.sourceUrl());
        return new ContentMetadata(options.sourceUrl(), domain, Instant.now(clock).toString(), OriginalFormat.HTML);
    }

    private static String hostOf(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim()).getHost();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    static boolean hasText(List<InlineContent> content) {
        for (InlineContent item : content) {
            if (item instanceof LinkSpan || (item instanceof TextSpan span && !span.text().isBlank())) {
                return true;
            }
        }
        return false;
    }

    private static final class EmptyBlockFilter implements BlockVisitor<Optional<ContentBlock>> {

        @Override
        public Optional<ContentBlock> visitParagraph(ParagraphBlock block) {
            return hasText(block.content()) ? Optional.of(block) : Optional.empty();
        }

        @Override
        public Optional<ContentBlock> visitHeading(HeadingBlock block) {
            return hasText(block.content()) ? Optional.of(block) : Optional.empty();
        }

        @Override
        public Optional<ContentBlock> visitList(ListBlock block) {
            return prune(block).map(ContentBlock.class::cast);
        }

        @Override
        public Optional<ContentBlock> visitQuote(QuoteBlock block) {
            return hasText(block.content()) ? Optional.of(block) : Optional.empty();
        }

        @Override
        public Optional<ContentBlock> visitCode(CodeBlock block) {
            return block.content().isBlank() ? Optional.empty() : Optional.of(block);
        }

        @Override
        public Optional<ContentBlock> visitDivider(DividerBlock block) {
            return Optional.of(block);
        }

        private Optional<ListBlock> prune(ListBlock list) {
            List<ListItem> kept = new ArrayList<>();
            for (ListItem item : list.items()) {
                ListBlock nested = item.nested() == null ? null : prune(item.nested()).orElse(null);
                if (nested != null || hasText(item.content())) {
                    kept.add(item.withNested(nested));
                }
            }
            return kept.isEmpty() ? Optional.empty() : Optional.of(new ListBlock(list.id(), list.listType(), kept));
        }
    }
}
