package org.dxworks.clippy;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.clippy.model.ClippyContent;
import org.dxworks.clippy.parser.BlockParseOptions;
import org.dxworks.clippy.parser.BlockParser;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.dxworks.clippy.TestUtils.FIXED_CLOCK;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class ContentCodecTest {

    private static final String HTML = "<h1>Title</h1>"
            + "<p>Plain <b>bold</b> <a href=\"https://example.com\"><i>link</i></a><br>next</p>"
            + "<ul><li>One<ol><li>Inner</li></ol></li></ul>"
            + "<blockquote cite=\"Someone\">Quote</blockquote>"
            + "<pre><code class=\"language-java\">int x;</code></pre><hr>";

    @Test
    void jsonRoundTripKeepsContent() throws IOException {
        ClippyContent content = new BlockParser(FIXED_CLOCK)
                .parseDocument(HTML, BlockParseOptions.DEFAULTS.withSource("https://example.com/a", null));

        ClippyContent decoded = ContentCodec.fromJson(ContentCodec.toJson(content));

        assertEquals(content, decoded);
    }

    @Test
    void wireShapeUsesTypeTagsAndOmitsEmptyFormatting() throws IOException {
        ClippyContent content = new BlockParser(FIXED_CLOCK).parseDocument(HTML, BlockParseOptions.DEFAULTS);

        JsonNode tree = ContentCodec.readTree(ContentCodec.toJson(content));

        assertEquals("1.0", tree.get("version").asText());
        assertEquals("heading", tree.at("/blocks/0/type").asText());
        assertEquals(1, tree.at("/blocks/0/level").asInt());
        JsonNode paragraph = tree.at("/blocks/1/content");
        assertEquals("text", paragraph.at("/0/type").asText());
        assertFalse(paragraph.get(0).has("formatting"));
        assertEquals(true, paragraph.at("/1/formatting/bold").asBoolean());
        assertFalse(paragraph.at("/1/formatting").has("italic"));
        assertEquals("link", paragraph.at("/3/type").asText());
        assertEquals("linebreak", paragraph.at("/4/type").asText());
        assertEquals("numbered", tree.at("/blocks/2/items/0/nested/listType").asText());
        assertEquals("java", tree.at("/blocks/4/language").asText());
        assertEquals("divider", tree.at("/blocks/5/type").asText());
        assertEquals("html", tree.at("/metadata/originalFormat").asText());
    }

    @Test
    void unknownFieldsAreIgnored() throws IOException {
        ClippyContent content = ContentCodec.fromJson(
                "{\"version\":\"1.0\",\"extra\":1,\"blocks\":[{\"type\":\"paragraph\",\"id\":\"p\",\"color\":\"red\","
                        + "\"content\":[{\"type\":\"text\",\"text\":\"hi\"}]}]}");

        assertEquals(1, content.blocks().size());
        assertEquals("p", content.blocks().get(0).id());
    }
}
