package org.dxworks.clippy.parser;

import org.dxworks.clippy.model.FormattingKind;
import org.dxworks.clippy.model.TextFormatting;
import org.dxworks.clippy.model.inline.InlineContent;
import org.dxworks.clippy.model.inline.LineBreak;
import org.dxworks.clippy.model.inline.LinkSpan;
import org.dxworks.clippy.model.inline.TextSpan;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.clippy.TestUtils.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InlineParserTest {

    private final List<String> warnings = new ArrayList<>();

    private List<InlineContent> parse(String fragment) {
        return new InlineParser(InlineParseOptions.DEFAULTS).parse(fragment, warnings::add);
    }

    @Test
    void nestedFormattingAccumulates() {
        List<InlineContent> result = parse("<b>bold <i>both</i></b> plain");

        assertEquals(List.of(
                text("bold ", FormattingKind.BOLD),
                text("both", FormattingKind.BOLD, FormattingKind.ITALIC),
                text(" plain")), result);
    }

    @Test
    void whitespaceIsCollapsedAndTrimmed() {
        List<InlineContent> result = parse("  hello   <b> world </b>  again ");

        assertEquals(List.of(
                text("hello "),
                text("world ", FormattingKind.BOLD),
                text("again")), result);
    }

    @Test
    void preserveWhitespaceKeepsRuns() {
        List<InlineContent> result = new InlineParser(InlineParseOptions.DEFAULTS.withPreserveWhitespace(true))
                .parse("a  b", warnings::add);

        assertEquals(List.of(text("a  b")), result);
    }

    @Test
    void emptyFragmentGivesEmptyList() {
        assertTrue(parse("").isEmpty());
        assertTrue(parse(null).isEmpty());
    }

    @Test
    void safeLinkBecomesLinkSpan() {
        List<InlineContent> result = parse("<a href=\"https://example.com\">Example</a>");

        assertEquals(List.of(LinkSpan.plain("https://example.com", "Example")), result);
        assertTrue(warnings.isEmpty());
    }

    @Test
    void parseInlineReadsAFragmentWithDefaults() {
        List<InlineContent> result = InlineParser.parseInline(
                "Read <strong>the <a href=\"https://example.com/search?q=a|b\">docs</a></strong><br>now",
                InlineParseOptions.DEFAULTS);

        assertEquals(List.of(
                text("Read "),
                text("the ", FormattingKind.BOLD),
                new LinkSpan("https://example.com/search?q=a|b", "docs", TextFormatting.of(FormattingKind.BOLD)),
                LineBreak.INSTANCE,
                text("now")), result);
    }

    @Test
    void linksWithLooselyWrittenTargetsAreKept() {
        List<String> targets = List.of(
                "https://my_site.example.com/x",
                "https://example.com/a b",
                "https://例え.jp/",
                "https://example.com/{id}");
        for (String target : targets) {
            assertEquals(List.of(LinkSpan.plain(target, "go")), parse("<a href=\"" + target + "\">go</a>"), target);
        }
    }

    @Test
    void scriptLinkKeepsOnlyItsText() {
        List<InlineContent> result = parse("<a href=\"javascript:alert(1)\">click</a>");

        assertEquals(List.of(text("click")), result);
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).contains("javascript:alert(1)"));
    }

    @Test
    void overlongLinkKeepsOnlyItsText() {
        InlineParseOptions options = new InlineParseOptions(false, true, true, 20, 1000);

        List<InlineContent> result = new InlineParser(options)
                .parse("<a href=\"https://example.com/a/very/long/path\">docs</a>", warnings::add);

        assertEquals(List.of(text("docs")), result);
        assertEquals(1, warnings.size());
    }

    @Test
    void linkTakesFormattingFromAroundAndInside() {
        assertEquals(List.of(new LinkSpan("https://x.com", "bold link", TextFormatting.of(FormattingKind.BOLD))),
                parse("<b><a href=\"https://x.com\">bold link</a></b>"));
        assertEquals(List.of(new LinkSpan("https://x.com", "x", TextFormatting.of(FormattingKind.ITALIC))),
                parse("<a href=\"https://x.com\"><i>x</i></a>"));
    }

    @Test
    void linkWithoutTextUsesItsTarget() {
        assertEquals(List.of(LinkSpan.plain("https://x.com", "https://x.com")),
                parse("<a href=\"https://x.com\"></a>"));
    }

    @Test
    void lineBreaksSplitText() {
        assertEquals(List.of(text("one"), LineBreak.INSTANCE, text("two")), parse("one<br>two"));
        assertEquals(List.of(text("one"), LineBreak.INSTANCE, text("two")), parse("one <br> two"));
    }

    @Test
    void blockElementsInsideInlineContentSeparateLines() {
        assertEquals(List.of(text("a"), LineBreak.INSTANCE, text("b")), parse("<p>a</p><p>b</p>"));
    }

    @Test
    void adjacentEqualFormattingIsMerged() {
        List<InlineContent> result = parse("<b>a</b><b>b</b>");

        assertEquals(List.of(text("ab", FormattingKind.BOLD)), result);
        assertTrue(InlineMerger.isMerged(result));
        assertEquals(result, InlineMerger.merge(result));
    }

    @Test
    void mergeIsIdempotent() {
        List<InlineContent> spans = List.of(
                text("a"), text("b"), text("c", FormattingKind.BOLD), text("d", FormattingKind.BOLD),
                LineBreak.INSTANCE, text("e"), text("f"));

        List<InlineContent> once = InlineMerger.merge(spans);

        assertEquals(List.of(text("ab"), text("cd", FormattingKind.BOLD), LineBreak.INSTANCE, text("ef")), once);
        assertEquals(once, InlineMerger.merge(once));
    }

    @Test
    void styleDeclarationsAddFormatting() {
        assertEquals(List.of(text("x", FormattingKind.BOLD)),
                parse("<span style=\"font-weight: 700\">x</span>"));
        assertEquals(List.of(text("y", FormattingKind.UNDERLINE, FormattingKind.STRIKETHROUGH)),
                parse("<span style=\"text-decoration: underline line-through\">y</span>"));
        assertEquals(List.of(text("z", FormattingKind.ITALIC)),
                parse("<span style=\"font-style:italic !important\">z</span>"));
    }

    @Test
    void normalWeightBoldWrapperIsNotBold() {
        assertEquals(List.of(text("plain")), parse("<b style=\"font-weight:normal\">plain</b>"));
    }

    @Test
    void codeElementsMarkCode() {
        assertEquals(List.of(text("run "), text("ls", FormattingKind.CODE)), parse("run <code>ls</code>"));
        assertEquals(List.of(text("Ctrl", FormattingKind.CODE)), parse("<kbd>Ctrl</kbd>"));
    }

    @Test
    void overlongTextIsTruncated() {
        InlineParseOptions options = new InlineParseOptions(false, true, true, 2000, 5);

        List<InlineContent> result = new InlineParser(options).parse("abcdefgh", warnings::add);

        assertEquals(List.of(TextSpan.plain("abcde")), result);
        assertEquals(1, warnings.size());
    }
}
