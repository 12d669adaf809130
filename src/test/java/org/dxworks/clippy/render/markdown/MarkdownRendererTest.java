package org.dxworks.clippy.render.markdown;

import org.commonmark.Extension;
import org.commonmark.ext.gfm.strikethrough.StrikethroughExtension;
import org.commonmark.parser.Parser;
import org.dxworks.clippy.model.ClippyContent;
import org.dxworks.clippy.model.FormattingKind;
import org.dxworks.clippy.model.ListType;
import org.dxworks.clippy.model.block.CodeBlock;
import org.dxworks.clippy.model.block.ContentBlock;
import org.dxworks.clippy.model.block.DividerBlock;
import org.dxworks.clippy.model.block.HeadingBlock;
import org.dxworks.clippy.model.block.ListBlock;
import org.dxworks.clippy.model.block.ListItem;
import org.dxworks.clippy.model.block.ParagraphBlock;
import org.dxworks.clippy.model.block.QuoteBlock;
import org.dxworks.clippy.model.inline.LineBreak;
import org.dxworks.clippy.model.inline.LinkSpan;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.clippy.TestUtils.plain;
import static org.dxworks.clippy.TestUtils.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MarkdownRendererTest {

    private final MarkdownRenderer renderer = new MarkdownRenderer();

    private static ClippyContent content(ContentBlock... blocks) {
        return ClippyContent.of(List.of(blocks), null);
    }

    private String render(MarkdownFlavor flavor, ContentBlock... blocks) {
        return renderer.render(content(blocks), MarkdownRenderConfig.forFlavor(flavor));
    }

    private static ListBlock nestedList() {
        ListBlock inner = new ListBlock("n", ListType.NUMBERED, List.of(new ListItem("i3", plain("Inner"), null)));
        return new ListBlock("l", ListType.BULLETED, List.of(
                new ListItem("i1", plain("One"), null),
                new ListItem("i2", plain("Two"), inner)));
    }

    @Test
    void headingsFollowTheFlavor() {
        HeadingBlock heading = new HeadingBlock("h", 1, plain("Hi"));

        assertEquals("# Hi", render(MarkdownFlavor.GITHUB, heading));
        assertEquals("**Hi**", render(MarkdownFlavor.DISCORD, heading));
        assertEquals("*Hi*", render(MarkdownFlavor.SLACK, heading));
        assertEquals("### Hi", render(MarkdownFlavor.STANDARD, new HeadingBlock("h", 3, plain("Hi"))));
    }

    @Test
    void markdownCharactersAreEscaped() {
        assertEquals("1\\.5 \\* 2 \\_x\\_", render(MarkdownFlavor.STANDARD, new ParagraphBlock("p", plain("1.5 * 2 _x_"))));
        assertEquals("a\\~b\\|c", render(MarkdownFlavor.DISCORD, new ParagraphBlock("p", plain("a~b|c"))));
    }

    @Test
    void formattingMarkersStayInsideWhitespace() {
        String markdown = render(MarkdownFlavor.GITHUB, new ParagraphBlock("p", List.of(
                text("bold ", FormattingKind.BOLD), text("and "), text("gone", FormattingKind.STRIKETHROUGH))));

        assertEquals("**bold** and ~~gone~~", markdown);
    }

    @Test
    void flavorsUseTheirOwnMarkers() {
        ParagraphBlock paragraph = new ParagraphBlock("p", List.of(
                text("b", FormattingKind.BOLD), text(" "), text("i", FormattingKind.ITALIC), text(" "),
                text("u", FormattingKind.UNDERLINE), text(" "), text("s", FormattingKind.STRIKETHROUGH)));

        assertEquals("**b** *i* *u* ~~s~~", render(MarkdownFlavor.GITHUB, paragraph));
        assertEquals("**b** *i* __u__ ~~s~~", render(MarkdownFlavor.DISCORD, paragraph));
        assertEquals("*b* _i_ _u_ ~s~", render(MarkdownFlavor.SLACK, paragraph));
    }

    @Test
    void codeSpansAreNotEscaped() {
        assertEquals("run `a_b*c`", render(MarkdownFlavor.GITHUB,
                new ParagraphBlock("p", List.of(text("run "), text("a_b*c", FormattingKind.CODE)))));
        assertEquals("`` a`b ``", render(MarkdownFlavor.GITHUB,
                new ParagraphBlock("p", List.of(text("a`b", FormattingKind.CODE)))));
    }

    @Test
    void linksFollowTheFlavor() {
        ParagraphBlock paragraph = new ParagraphBlock("p", List.of(LinkSpan.plain("https://example.com", "site")));

        assertEquals("[site](https://example.com)", render(MarkdownFlavor.GITHUB, paragraph));
        assertEquals("<https://example.com|site>", render(MarkdownFlavor.SLACK, paragraph));
        assertEquals("<https://example.com>", render(MarkdownFlavor.SLACK,
                new ParagraphBlock("p", List.of(LinkSpan.plain("https://example.com", "https://example.com")))));
        assertEquals("[x](https://e.com/a_%28b%29)", render(MarkdownFlavor.GITHUB,
                new ParagraphBlock("p", List.of(LinkSpan.plain("https://e.com/a_(b)", "x")))));
    }

    @Test
    void slackLinksCannotBeClosedByTheirTextOrTarget() {
        assertEquals("<https://example.com|a&gt;b &amp; c&lt;d>", render(MarkdownFlavor.SLACK,
                new ParagraphBlock("p", List.of(LinkSpan.plain("https://example.com", "a>b & c<d")))));
        assertEquals("<https://example.com/q?a%7Cb%3E|x>", render(MarkdownFlavor.SLACK,
                new ParagraphBlock("p", List.of(LinkSpan.plain("https://example.com/q?a|b>", "x")))));
    }

    @Test
    void unsafeLinksRenderAsText() {
        assertEquals("click", render(MarkdownFlavor.GITHUB,
                new ParagraphBlock("p", List.of(LinkSpan.plain("javascript:alert(1)", "click")))));
    }

    @Test
    void listsIndentUnderTheirMarker() {
        assertEquals("* One\n* Two\n  1. Inner", render(MarkdownFlavor.STANDARD, nestedList()));
    }

    @Test
    void listsBeyondTheNestingLimitAreFlattened() {
        String markdown = renderer.render(content(nestedList()), MarkdownRenderConfig.DEFAULTS.withMaxNestingLevel(1));

        assertEquals("* One\n* Two\n  • Inner", markdown);
    }

    @Test
    void quotesCarryTheirCitation() {
        assertEquals("> Quoted\n>\n> — Someone",
                render(MarkdownFlavor.GITHUB, new QuoteBlock("q", plain("Quoted"), "Someone")));
        assertEquals("> a  \n> b",
                render(MarkdownFlavor.GITHUB, new QuoteBlock("q", List.of(text("a"), LineBreak.INSTANCE, text("b")), null)));
    }

    @Test
    void codeBlocksAreFencedOrIndented() {
        CodeBlock code = new CodeBlock("c", "x = 1\n", "python");

        assertEquals("```python\nx = 1\n```", render(MarkdownFlavor.GITHUB, code));
        assertEquals("    x = 1", render(MarkdownFlavor.SLACK, code));
        assertEquals("````\n```\n````", render(MarkdownFlavor.GITHUB, new CodeBlock("c", "```", null)));
    }

    @Test
    void dividersFollowTheFlavor() {
        assertEquals("---", render(MarkdownFlavor.GITHUB, new DividerBlock("d")));
        assertEquals("━".repeat(30), render(MarkdownFlavor.DISCORD, new DividerBlock("d")));
    }

    @Test
    void lineBreaksFollowTheStyle() {
        ParagraphBlock paragraph = new ParagraphBlock("p", List.of(text("a"), LineBreak.INSTANCE, text("b")));

        assertEquals("a  \nb", render(MarkdownFlavor.GITHUB, paragraph));
        assertEquals("a\nb", render(MarkdownFlavor.SLACK, paragraph));
    }

    @Test
    void formattingCanBeDropped() {
        String markdown = renderer.render(
                content(new ParagraphBlock("p", List.of(text("bold", FormattingKind.BOLD)))),
                MarkdownRenderConfig.DEFAULTS.withPreserveFormatting(false));

        assertEquals("bold", markdown);
    }

    @Test
    void githubMarkdownIsReadBackByCommonMark() {
        String markdown = render(MarkdownFlavor.GITHUB,
                new HeadingBlock("h", 1, plain("Title")),
                new ParagraphBlock("p", List.of(
                        text("bold", FormattingKind.BOLD), text(" and "), text("gone", FormattingKind.STRIKETHROUGH),
                        text(" in v1.5 (see "), LinkSpan.plain("https://example.com", "site"), text(")"))),
                nestedList(),
                new CodeBlock("c", "x = 1", "python"));

        List<Extension> extensions = List.of(StrikethroughExtension.create());
        String html = org.commonmark.renderer.html.HtmlRenderer.builder().extensions(extensions).build()
                .render(Parser.builder().extensions(extensions).build().parse(markdown));

        assertTrue(html.contains("<h1>Title</h1>"), html);
        assertTrue(html.contains("<strong>bold</strong> and <del>gone</del> in v1.5 (see "
                + "<a href=\"https://example.com\">site</a>)"), html);
        assertTrue(html.contains("<li>Inner</li>"), html);
        assertTrue(html.contains("<code class=\"language-python\">x = 1"), html);
    }
}
