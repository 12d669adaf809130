package org.dxworks.clippy.render.delta;

import org.dxworks.clippy.model.ClippyContent;
import org.dxworks.clippy.model.ContentLimits;
import org.dxworks.clippy.model.ListType;
import org.dxworks.clippy.model.TextFormatting;
import org.dxworks.clippy.model.block.BlockVisitor;
import org.dxworks.clippy.model.block.CodeBlock;
import org.dxworks.clippy.model.block.DividerBlock;
import org.dxworks.clippy.model.block.HeadingBlock;
import org.dxworks.clippy.model.block.ListBlock;
import org.dxworks.clippy.model.block.ListItem;
import org.dxworks.clippy.model.block.ParagraphBlock;
import org.dxworks.clippy.model.block.QuoteBlock;
import org.dxworks.clippy.model.inline.InlineContent;
import org.dxworks.clippy.model.inline.InlineVisitor;
import org.dxworks.clippy.model.inline.LineBreak;
import org.dxworks.clippy.model.inline.LinkSpan;
import org.dxworks.clippy.model.inline.TextSpan;
import org.dxworks.clippy.parser.UrlPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders content as a Quill delta for Quill based editors. Block formats are carried by
 * the attributes of the newline that ends each line, the way Quill stores them.
 */
public class QuillDeltaRenderer {

    private static final Logger logger = LoggerFactory.getLogger(QuillDeltaRenderer.class);

    private static final String FLAT_BULLET = "• ";

    public QuillDelta render(ClippyContent content) {
        return render(content, QuillRenderConfig.DEFAULTS);
    }

    public QuillDelta render(ClippyContent content, QuillRenderConfig config) {
        if (content == null || content.blocks().isEmpty()) {
            return QuillDelta.EMPTY;
        }
        Blocks blocks = new Blocks(config);
        List<DeltaOp> ops = new ArrayList<>();
        for (int i = 0; i < content.blocks().size(); i++) {
            ops.addAll(content.blocks().get(i).accept(blocks));
            if (i < content.blocks().size() - 1) {
                ops.add(DeltaOp.newline());
            }
        }
        return new QuillDelta(merge(ops));
    }

    /**
     * Unformatted delta with one line per line of {@code text}.
     */
    public static QuillDelta fromText(String text) {
        if (text == null || text.isEmpty()) {
            return QuillDelta.EMPTY;
        }
        List<DeltaOp> ops = new ArrayList<>();
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (!lines[i].isEmpty()) {
                ops.add(DeltaOp.text(lines[i]));
            }
            if (i < lines.length - 1 || !lines[i].isEmpty()) {
                ops.add(DeltaOp.newline());
            }
        }
        return new QuillDelta(merge(ops));
    }

    static List<DeltaOp> merge(List<DeltaOp> ops) {
        List<DeltaOp> merged = new ArrayList<>(ops.size());
        for (DeltaOp op : ops) {
            if (!merged.isEmpty()) {
                DeltaOp last = merged.get(merged.size() - 1);
                if (last.attributes().equals(op.attributes())) {
                    merged.set(merged.size() - 1, last.append(op.insert()));
                    continue;
                }
            }
            merged.add(op);
        }
        return merged;
    }

    private static final class Blocks implements BlockVisitor<List<DeltaOp>> {
        private final QuillRenderConfig config;
        private final Inlines inlines;

        private Blocks(QuillRenderConfig config) {
            this.config = config;
            this.inlines = new Inlines(config);
        }

        @Override
        public List<DeltaOp> visitParagraph(ParagraphBlock block) {
            List<DeltaOp> ops = inlines.render(block.content());
            ops.add(DeltaOp.newline());
            return ops;
        }

        @Override
        public List<DeltaOp> visitHeading(HeadingBlock block) {
            List<DeltaOp> ops = inlines.render(block.content());
            ops.add(DeltaOp.newline("header", block.level()));
            return ops;
        }

        @Override
        public List<DeltaOp> visitList(ListBlock block) {
            List<DeltaOp> ops = new ArrayList<>();
            renderList(block, 0, ops);
            return ops;
        }

        private void renderList(ListBlock list, int depth, List<DeltaOp> ops) {
            if (depth >= config.maxListDepth()) {
                logger.warn("List depth {} exceeds the delta limit of {}, rendered as bullet lines", depth + 1, config.maxListDepth());
                flatten(list, ops);
                return;
            }
            String listFormat = list.listType() == ListType.NUMBERED ? "ordered" : "bullet";
            for (ListItem item : list.items()) {
                ops.addAll(inlines.render(item.content()));
                Map<String, Object> attributes = new LinkedHashMap<>();
                attributes.put("list", listFormat);
                if (depth > 0 && config.supportNestedLists()) {
                    attributes.put("indent", depth);
                }
                ops.add(new DeltaOp("\n", attributes));
                if (item.nested() != null && config.supportNestedLists()) {
                    renderList(item.nested(), depth + 1, ops);
                }
            }
        }

        private void flatten(ListBlock list, List<DeltaOp> ops) {
            for (ListItem item : list.items()) {
                ops.add(DeltaOp.text(FLAT_BULLET));
                ops.addAll(inlines.render(item.content()));
                ops.add(DeltaOp.newline());
                if (item.nested() != null) {
                    flatten(item.nested(), ops);
                }
            }
        }

        @Override
        public List<DeltaOp> visitQuote(QuoteBlock block) {
            List<DeltaOp> ops = inlines.render(block.content());
            ops.add(DeltaOp.newline("blockquote", true));
            return ops;
        }

        @Override
        public List<DeltaOp> visitCode(CodeBlock block) {
            List<DeltaOp> ops = new ArrayList<>();
            if (config.useCodeBlocks()) {
                ops.add(DeltaOp.text(block.content()));
                ops.add(DeltaOp.newline("code-block", true));
            } else {
                ops.add(new DeltaOp(block.content(), Map.of("code", true)));
                ops.add(DeltaOp.newline());
            }
            return ops;
        }

        @Override
        public List<DeltaOp> visitDivider(DividerBlock block) {
            List<DeltaOp> ops = new ArrayList<>();
            ops.add(DeltaOp.text("---"));
            ops.add(DeltaOp.newline());
            return ops;
        }
    }

    private static final class Inlines implements InlineVisitor<DeltaOp> {
        private final QuillRenderConfig config;

        private Inlines(QuillRenderConfig config) {
            this.config = config;
        }

        private List<DeltaOp> render(List<InlineContent> content) {
            List<DeltaOp> ops = new ArrayList<>();
            for (InlineContent item : content) {
                DeltaOp op = item.accept(this);
                if (!op.insert().isEmpty()) {
                    ops.add(op);
                }
            }
            return ops;
        }

        @Override
        public DeltaOp visitText(TextSpan span) {
            return new DeltaOp(span.text(), formatAttributes(span.formatting()));
        }

        @Override
        public DeltaOp visitLink(LinkSpan span) {
            Map<String, Object> attributes = formatAttributes(span.formatting());
            if (UrlPolicy.isSafe(span.url(), ContentLimits.DEFAULT_MAX_URL_LENGTH)) {
                attributes.put("link", span.url().trim());
            }
            return new DeltaOp(span.text(), attributes);
        }

        @Override
        public DeltaOp visitLineBreak(LineBreak lineBreak) {
            return DeltaOp.newline();
        }

        private Map<String, Object> formatAttributes(TextFormatting formatting) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            if (!config.preserveFormatting()) {
                return attributes;
            }
            if (formatting.bold()) {
                attributes.put("bold", true);
            }
            if (formatting.italic()) {
                attributes.put("italic", true);
            }
            if (formatting.underline()) {
                attributes.put("underline", true);
            }
            if (formatting.strikethrough()) {
                attributes.put("strike", true);
            }
            if (formatting.code()) {
                attributes.put("code", true);
            }
            return attributes;
        }
    }
}
