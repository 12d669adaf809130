package org.dxworks.clippy.platform;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.dxworks.clippy.model.BlockKind;
import org.dxworks.clippy.model.FormattingKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * What a target editor can display: block kinds, formatting flags, list depth, links,
 * code highlighting and the format content should be handed over in.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlatformCapabilities(
        String id,
        String name,
        Set<BlockKind> supportedBlocks,
        Set<FormattingKind> supportedFormatting,
        int maxNestingLevel,
        boolean hasLinkSupport,
        boolean hasCodeSyntaxHighlighting,
        PreferredFormat preferredFormat) {

    public PlatformCapabilities {
        supportedBlocks = supportedBlocks == null || supportedBlocks.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(supportedBlocks));
        supportedFormatting = supportedFormatting == null || supportedFormatting.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(supportedFormatting));
        maxNestingLevel = Math.max(1, maxNestingLevel);
        preferredFormat = preferredFormat == null ? PreferredFormat.PLAINTEXT : preferredFormat;
    }

    public boolean supports(BlockKind kind) {
        return supportedBlocks.contains(kind);
    }

    public boolean supports(FormattingKind kind) {
        return supportedFormatting.contains(kind);
    }
}
