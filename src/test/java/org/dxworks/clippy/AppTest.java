package org.dxworks.clippy;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.clippy.platform.PreferredFormat;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AppTest {

    private static final String CAPTURE = "<h1>Hi</h1><p>Some <b>bold</b> text</p>";

    @Test
    void convertsToTheRequestedFormat() throws IOException {
        assertEquals("# Hi\n\nSome **bold** text", App.convert(CAPTURE, PreferredFormat.MARKDOWN, "github"));
        assertEquals("Hi\n\nSome bold text", App.convert(CAPTURE, PreferredFormat.PLAINTEXT, null));
    }

    @Test
    void convertsToContentJsonWithoutAFormat() throws IOException {
        JsonNode json = ContentCodec.readTree(App.convert(CAPTURE, null, null));

        assertEquals("1.0", json.get("version").asText());
        assertEquals("heading", json.at("/blocks/0/type").asText());
        assertEquals("bold", json.at("/blocks/1/content/1/text").asText());
    }
}
