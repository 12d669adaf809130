package org.dxworks.clippy.platform;

import org.dxworks.clippy.model.BlockKind;
import org.dxworks.clippy.model.FormattingKind;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlatformRegistryTest {

    private final PlatformRegistry registry = new PlatformRegistry();

    @Test
    void bundledPlatformsAreLoaded() {
        assertEquals(Set.of("linkedin-quill", "linkedin-article", "gmail", "discord", "slack", "github", "notion",
                "contenteditable-generic", "textarea"), registry.platformIds());

        PlatformCapabilities github = registry.find("github").orElseThrow();
        assertEquals(PreferredFormat.MARKDOWN, github.preferredFormat());
        assertEquals(5, github.maxNestingLevel());
        assertTrue(github.supports(BlockKind.DIVIDER));
        assertFalse(github.supports(FormattingKind.UNDERLINE));

        assertEquals(PreferredFormat.DELTA, registry.find("linkedin-quill").orElseThrow().preferredFormat());
    }

    @Test
    void unknownPlatformsResolveToTheTextarea() {
        PlatformCapabilities capabilities = registry.capabilitiesFor("myspace");

        assertEquals("textarea", capabilities.id());
        assertEquals(PreferredFormat.PLAINTEXT, capabilities.preferredFormat());
        assertEquals(Set.of(BlockKind.PARAGRAPH), capabilities.supportedBlocks());
        assertTrue(capabilities.supportedFormatting().isEmpty());
        assertEquals("textarea", registry.capabilitiesFor(null).id());
    }

    @Test
    void registryCanBeReadFromYaml() throws IOException {
        String yaml = "platforms:\n"
                + "  - id: textarea\n"
                + "    name: Plain\n"
                + "    supportedBlocks: [paragraph]\n"
                + "    maxNestingLevel: 0\n"
                + "  - id: wiki\n"
                + "    name: Wiki\n"
                + "    supportedBlocks: [paragraph, heading]\n"
                + "    supportedFormatting: [bold]\n"
                + "    maxNestingLevel: 4\n"
                + "    hasLinkSupport: true\n"
                + "    preferredFormat: markdown\n";

        PlatformRegistry custom = PlatformRegistry.fromYaml(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

        assertEquals(1, custom.fallback().maxNestingLevel());
        assertEquals(PreferredFormat.PLAINTEXT, custom.fallback().preferredFormat());
        assertTrue(custom.find("wiki").orElseThrow().supports(BlockKind.HEADING));
        assertTrue(custom.find("wiki").orElseThrow().hasLinkSupport());
    }

    @Test
    void registryWithoutTextareaIsRejected() {
        PlatformCapabilities only = new PlatformCapabilities("wiki", "Wiki", Set.of(BlockKind.PARAGRAPH), Set.of(),
                1, false, false, PreferredFormat.HTML);

        assertThrows(IllegalArgumentException.class, () -> new PlatformRegistry(List.of(only)));
    }
}
