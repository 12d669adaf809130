package org.dxworks.clippy.validation;

import org.dxworks.clippy.model.ClippyContent;
import org.dxworks.clippy.model.ContentLimits;
import org.dxworks.clippy.model.ListType;
import org.dxworks.clippy.model.block.ContentBlock;
import org.dxworks.clippy.model.block.HeadingBlock;
import org.dxworks.clippy.model.block.ListBlock;
import org.dxworks.clippy.model.block.ListItem;
import org.dxworks.clippy.model.block.ParagraphBlock;
import org.dxworks.clippy.model.inline.LinkSpan;
import org.dxworks.clippy.parser.BlockParseOptions;
import org.dxworks.clippy.parser.BlockParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.clippy.TestUtils.FIXED_CLOCK;
import static org.dxworks.clippy.TestUtils.plain;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContentValidatorTest {

    private final ContentValidator validator = new ContentValidator();

    private static ClippyContent content(ContentBlock... blocks) {
        return ClippyContent.of(List.of(blocks), null);
    }

    @Test
    void parsedContentIsValid() {
        ClippyContent parsed = new BlockParser(FIXED_CLOCK).parseDocument(
                "<h1>T</h1><p>a <b>b</b></p><ul><li>x<ol><li>y</li></ol></li></ul><hr><pre>code</pre>",
                BlockParseOptions.DEFAULTS.withSource("https://example.com", null));

        ValidationResult result = validator.validate(parsed);

        assertTrue(result.valid(), () -> String.join("\n", result.errors()));
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void duplicateIdsAreErrors() {
        ValidationResult result = validator.validate(content(
                new ParagraphBlock("a", plain("one")),
                new ParagraphBlock("a", plain("two"))));

        assertFalse(result.valid());
        assertTrue(result.errors().stream().anyMatch(e -> e.contains("reuses id \"a\"")));
    }

    @Test
    void nestedListIdsTakePartInUniqueness() {
        ListBlock nested = new ListBlock("p1", ListType.BULLETED, List.of(new ListItem("i2", plain("y"), null)));
        ValidationResult result = validator.validate(content(
                new ParagraphBlock("p1", plain("x")),
                new ListBlock("l1", ListType.BULLETED, List.of(new ListItem("i1", plain("x"), nested)))));

        assertFalse(result.valid());
    }

    @Test
    void blankIdsAreErrors() {
        ValidationResult result = validator.validate(content(new ParagraphBlock("", plain("x"))));

        assertFalse(result.valid());
        assertTrue(result.errors().get(0).contains("has no id"));
    }

    @Test
    void headingLevelOutsideRangeIsError() {
        ValidationResult result = validator.validate(content(new HeadingBlock("h", 7, plain("x"))));

        assertFalse(result.valid());
        assertTrue(result.errors().get(0).startsWith("blocks[0] heading level"));
    }

    @Test
    void suspiciousLinkIsOnlyAWarning() {
        ValidationResult result = validator.validate(content(
                new ParagraphBlock("p", List.of(LinkSpan.plain("javascript:alert(1)", "x")))));

        assertTrue(result.valid());
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).contains("suspicious"));
    }

    @Test
    void deepNestingIsWarnedOnce() {
        ListBlock list = new ListBlock("l3", ListType.BULLETED, List.of(new ListItem("i3", plain("c"), null)));
        list = new ListBlock("l2", ListType.BULLETED, List.of(new ListItem("i2", plain("b"), list)));
        list = new ListBlock("l1", ListType.BULLETED, List.of(new ListItem("i1", plain("a"), list)));

        ValidationResult result = new ContentValidator(ContentLimits.DEFAULTS.withMaxNestingLevel(2)).validate(content(list));

        assertTrue(result.valid());
        assertEquals(1, result.warnings().size());
    }

    @Test
    void tooManyBlocksIsWarning() {
        ValidationResult result = new ContentValidator(ContentLimits.DEFAULTS.withMaxBlocks(1)).validate(content(
                new ParagraphBlock("a", plain("1")),
                new ParagraphBlock("b", plain("2"))));

        assertTrue(result.valid());
        assertEquals(1, result.warnings().size());
    }

    @Test
    void rawJsonIsChecked() {
        assertFalse(validator.validate("{not json").valid());
        assertFalse(validator.validate("{\"version\":\"2.0\",\"blocks\":[]}").valid());
        assertFalse(validator.validate("{\"version\":\"1.0\",\"blocks\":[{\"id\":\"x\",\"type\":\"table\"}]}").valid());
        assertFalse(validator.validate("{\"version\":\"1.0\",\"blocks\":[{\"id\":\"x\",\"type\":\"paragraph\","
                + "\"content\":[{\"type\":\"text\",\"text\":\"a\",\"formatting\":{\"bold\":\"yes\"}}]}]}").valid());
        assertTrue(validator.validate("{\"version\":\"1.0\",\"blocks\":[{\"id\":\"x\",\"type\":\"divider\"}]}").valid());
    }

    @Test
    void malformedTimestampIsWarning() {
        ValidationResult result = validator.validate(
                "{\"version\":\"1.0\",\"blocks\":[],\"metadata\":{\"capturedAt\":\"yesterday\"}}");

        assertTrue(result.valid());
        assertEquals(1, result.warnings().size());
    }
}
