package org.dxworks.clippy.platform;

import org.dxworks.clippy.model.BlockKind;
import org.dxworks.clippy.model.ClippyContent;
import org.dxworks.clippy.model.FormattingKind;
import org.dxworks.clippy.model.TextFormatting;
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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reports which parts of a content tree a platform cannot show. Unsupported blocks,
 * formatting and links are errors; deep list nesting and code languages on platforms
 * without highlighting are warnings. Each distinct issue is reported once.
 */
public class PlatformCompatibilityChecker {

    private final PlatformCapabilityProvider provider;

    public PlatformCompatibilityChecker() {
        this(new PlatformRegistry());
    }

    public PlatformCompatibilityChecker(PlatformCapabilityProvider provider) {
        this.provider = provider;
    }

    public CompatibilityReport validateForPlatform(ClippyContent content, String platformId) {
        PlatformCapabilities capabilities = provider.capabilitiesFor(platformId);
        Walker walker = new Walker(capabilities);
        if (content != null) {
            for (ContentBlock block : content.blocks()) {
                if (!capabilities.supports(block.kind())) {
                    walker.issues.add(CompatibilityIssue.error("block:" + block.kind().getName(),
                            "Block type " + block.kind().getName() + " is not supported on " + capabilities.name()));
                }
                block.accept(walker);
            }
        }
        return CompatibilityReport.of(capabilities.id(), new ArrayList<>(walker.issues));
    }

    private static final class Walker implements BlockVisitor<Void> {
        private final PlatformCapabilities capabilities;
        private final Set<CompatibilityIssue> issues = new LinkedHashSet<>();

        private Walker(PlatformCapabilities capabilities) {
            this.capabilities = capabilities;
        }

        @Override
        public Void visitParagraph(ParagraphBlock block) {
            checkInline(block.content());
            return null;
        }

        @Override
        public Void visitHeading(HeadingBlock block) {
            checkInline(block.content());
            return null;
        }

        @Override
        public Void visitList(ListBlock block) {
            int depth = block.depth();
            if (depth > capabilities.maxNestingLevel()) {
                issues.add(CompatibilityIssue.warning("nesting",
                        "List nesting " + depth + " exceeds the platform limit of " + capabilities.maxNestingLevel()));
            }
            checkItems(block);
            return null;
        }

        private void checkItems(ListBlock list) {
            for (ListItem item : list.items()) {
                checkInline(item.content());
                if (item.nested() != null) {
                    checkItems(item.nested());
                }
            }
        }

        @Override
        public Void visitQuote(QuoteBlock block) {
            checkInline(block.content());
            return null;
        }

        @Override
        public Void visitCode(CodeBlock block) {
            if (block.language() != null && !block.language().isBlank() && !capabilities.hasCodeSyntaxHighlighting()) {
                issues.add(CompatibilityIssue.warning("syntax-highlighting:" + block.language(),
                        "Syntax highlighting is not available for " + block.language()));
            }
            return null;
        }

        @Override
        public Void visitDivider(DividerBlock block) {
            return null;
        }

        private void checkInline(List<InlineContent> content) {
            for (InlineContent item : content) {
                if (item instanceof TextSpan span) {
                    checkFormatting(span.formatting());
                } else if (item instanceof LinkSpan link) {
                    checkFormatting(link.formatting());
                    if (!capabilities.hasLinkSupport()) {
                        issues.add(CompatibilityIssue.error("links", "Links are not supported on " + capabilities.name()));
                    }
                }
            }
        }

        private void checkFormatting(TextFormatting formatting) {
            for (FormattingKind kind : formatting.activeKinds()) {
                if (!capabilities.supports(kind)) {
                    issues.add(CompatibilityIssue.error("formatting:" + kind.getName(),
                            "Formatting " + kind.getName() + " is not supported on " + capabilities.name()));
                }
            }
        }
    }
}
