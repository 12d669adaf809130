package org.dxworks.clippy.validation;

import org.dxworks.clippy.model.ClippyContent;
import org.dxworks.clippy.model.ContentLimits;
import org.dxworks.clippy.model.block.ContentBlock;
import org.dxworks.clippy.model.ListType;
import org.dxworks.clippy.model.block.ListBlock;
import org.dxworks.clippy.model.block.ListItem;
import org.dxworks.clippy.model.block.ParagraphBlock;
import org.dxworks.clippy.parser.BlockParseOptions;
import org.dxworks.clippy.parser.BlockParser;
import org.dxworks.clippy.parser.IdPolicy;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.dxworks.clippy.TestUtils.FIXED_CLOCK;
import static org.dxworks.clippy.TestUtils.ID_PREFIX;
import static org.dxworks.clippy.TestUtils.plain;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContentSanitizerTest {

    private final ContentSanitizer sanitizer = new ContentSanitizer(ContentLimits.DEFAULTS, FIXED_CLOCK);

    @Test
    void oversizedContentIsTruncatedAndGivenUniqueIds() {
        List<ContentBlock> blocks = new ArrayList<>();
        for (int i = 0; i < 1500; i++) {
            blocks.add(new ParagraphBlock("", plain("p" + i)));
        }

        ClippyContent sanitized = sanitizer.sanitize(ClippyContent.of(blocks, null));

        assertEquals(1000, sanitized.blocks().size());
        Set<String> ids = new HashSet<>();
        sanitized.blocks().forEach(block -> ids.add(block.id()));
        assertEquals(1000, ids.size());
        assertTrue(new ContentValidator().validate(sanitized).valid());
    }

    @Test
    void duplicateIdsAreReplacedWithoutClashing() {
        ClippyContent content = ClippyContent.of(List.of(
                new ParagraphBlock("a", plain("1")),
                new ParagraphBlock(ID_PREFIX + 0, plain("2")),
                new ParagraphBlock("a", plain("3"))), null);

        ClippyContent sanitized = sanitizer.sanitize(content);

        assertEquals("a", sanitized.blocks().get(0).id());
        assertEquals(ID_PREFIX + 0, sanitized.blocks().get(1).id());
        assertEquals(ID_PREFIX + 1, sanitized.blocks().get(2).id());
        assertTrue(new ContentValidator().validate(sanitized).valid());
    }

    @Test
    void contentParsedWithoutIdsBecomesValid() {
        ClippyContent parsed = new BlockParser(FIXED_CLOCK).parseDocument(
                "<ul><li>a<ol><li>a1</li></ol></li><li>b</li></ul><p>c</p>",
                BlockParseOptions.DEFAULTS.withIdPolicy(IdPolicy.NONE));

        ClippyContent sanitized = sanitizer.sanitize(parsed);

        ValidationResult result = new ContentValidator().validate(sanitized);
        assertTrue(result.valid(), () -> String.join(", ", result.errors()));
        ListBlock list = (ListBlock) sanitized.blocks().get(0);
        assertEquals(ID_PREFIX + 0, list.id());
        assertEquals(ID_PREFIX + 1, list.items().get(0).id());
        assertEquals(ID_PREFIX + 2, list.items().get(0).nested().id());
        assertEquals(ID_PREFIX + 3, list.items().get(0).nested().items().get(0).id());
        assertEquals(ID_PREFIX + 4, list.items().get(1).id());
        assertEquals(ID_PREFIX + 5, sanitized.blocks().get(1).id());
    }

    @Test
    void itemIdsRepeatingABlockIdAreReplaced() {
        ListBlock list = new ListBlock("list", ListType.BULLETED, List.of(
                new ListItem("p", plain("one"), null),
                new ListItem("i", plain("two"), null),
                new ListItem("i", plain("three"), null)));
        ClippyContent content = ClippyContent.of(List.of(new ParagraphBlock("p", plain("intro")), list), null);

        ClippyContent sanitized = sanitizer.sanitize(content);

        ListBlock repaired = (ListBlock) sanitized.blocks().get(1);
        assertEquals(List.of(ID_PREFIX + 0, "i", ID_PREFIX + 1),
                repaired.items().stream().map(ListItem::id).toList());
        assertEquals(plain("three"), repaired.items().get(2).content());
        assertTrue(new ContentValidator().validate(sanitized).valid());
    }

    @Test
    void versionIsReset() {
        ClippyContent sanitized = sanitizer.sanitize(new ClippyContent("0.9", List.of(), null));

        assertEquals("1.0", sanitized.version());
        assertTrue(sanitizer.sanitize(null).blocks().isEmpty());
    }
}
