package org.dxworks.clippy;

import org.dxworks.clippy.model.ClippyContent;
import org.dxworks.clippy.model.FormattingKind;
import org.dxworks.clippy.model.OriginalFormat;
import org.dxworks.clippy.model.block.HeadingBlock;
import org.dxworks.clippy.model.block.ParagraphBlock;
import org.dxworks.clippy.parser.ParseOutcome;
import org.dxworks.clippy.platform.PlatformRegistry;
import org.dxworks.clippy.platform.PreferredFormat;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.clippy.TestUtils.FIXED_CLOCK;
import static org.dxworks.clippy.TestUtils.plain;
import static org.dxworks.clippy.TestUtils.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClippyProcessorTest {

    private final ClippyProcessor processor = new ClippyProcessor(ClippyConfig.defaults(), new PlatformRegistry(), FIXED_CLOCK);

    private static final ClippyContent SAMPLE = ClippyContent.of(List.of(
            new HeadingBlock("h", 1, plain("Hi")),
            new ParagraphBlock("p", List.of(text("bold", FormattingKind.BOLD)))), null);

    @Test
    void capturedHtmlIsSanitizedAndParsed() {
        ParseOutcome outcome = processor.processContent(
                "<p onclick=\"x()\">Hello <b>world</b></p><script>alert(1)</script>", InputFormat.AUTO,
                "https://example.com/a", null);

        ClippyContent content = outcome.content();
        assertEquals(1, content.blocks().size());
        assertEquals(List.of(text("Hello "), text("world", FormattingKind.BOLD)),
                ((ParagraphBlock) content.blocks().get(0)).content());
        assertEquals("example.com", content.metadata().sourceDomain());
        assertEquals(OriginalFormat.HTML, content.metadata().originalFormat());
        assertTrue(outcome.warnings().isEmpty());
    }

    @Test
    void plainTextIsSplitIntoParagraphs() {
        ParseOutcome outcome = processor.processContent("plain\n\ntext", InputFormat.AUTO, null, null);

        assertEquals(2, outcome.content().blocks().size());
        assertEquals(OriginalFormat.TEXT, outcome.content().metadata().originalFormat());
    }

    @Test
    void configuredEmptyBlockPolicyApplies() {
        ClippyProcessor dropping = new ClippyProcessor(
                ClippyConfig.with(null, null, true), new PlatformRegistry(), FIXED_CLOCK);

        assertEquals(1, dropping.processContent("<p></p><p>x</p>", InputFormat.HTML, null, null).content().blocks().size());
        assertEquals(2, processor.processContent("<p></p><p>x</p>", InputFormat.HTML, null, null).content().blocks().size());
    }

    @Test
    void renderUsesThePlatformsPreferredFormat() {
        RenderResult github = processor.render(SAMPLE, RenderOptions.forPlatform("github"));
        RenderResult discord = processor.render(SAMPLE, RenderOptions.forPlatform("discord"));
        RenderResult quill = processor.render(SAMPLE, RenderOptions.forPlatform("linkedin-quill"));
        RenderResult generic = processor.render(SAMPLE);

        assertEquals(PreferredFormat.MARKDOWN, github.format());
        assertEquals("# Hi\n\n**bold**", github.content());
        assertEquals("**Hi**\n\n**bold**", discord.content());
        assertEquals(PreferredFormat.DELTA, quill.format());
        assertNotNull(quill.delta());
        assertTrue(quill.content().contains("\"insert\""), quill.content());
        assertEquals("contenteditable-generic", generic.platformId());
        assertEquals("<h1>Hi</h1>\n<p><strong>bold</strong></p>", generic.content());
        assertTrue(generic.success());
    }

    @Test
    void unknownPlatformFallsBackToPlainText() {
        RenderResult result = processor.render(SAMPLE, RenderOptions.forPlatform("myspace"));

        assertEquals(PreferredFormat.PLAINTEXT, result.format());
        assertEquals("textarea", result.platformId());
        assertEquals("Hi\n\nbold", result.content());
        assertNull(result.delta());
        assertEquals(1, result.warnings().size());
    }

    @Test
    void explicitFormatOverridesThePlatform() {
        RenderResult result = processor.render(SAMPLE, RenderOptions.forPlatform("github").withFormat(PreferredFormat.HTML));

        assertEquals(PreferredFormat.HTML, result.format());
        assertEquals("<h1>Hi</h1>\n<p><strong>bold</strong></p>", result.content());
    }

    @Test
    void overlongOutputIsReplacedByTruncatedText() {
        ClippyContent content = ClippyContent.of(List.of(new ParagraphBlock("p", plain("Hello world"))), null);

        assertEquals("<p>Hello...</p>", processor.render(content,
                RenderOptions.forPlatform("gmail").withMaxLength(5)).content());
        assertEquals("Hello world", processor.render(content,
                RenderOptions.forPlatform("github").withMaxLength(11)).content());
        assertEquals("Hello...", processor.render(content,
                RenderOptions.forPlatform("textarea").withMaxLength(5)).content());
    }
}
