package org.dxworks.clippy.validation;

import org.dxworks.clippy.model.ClippyContent;
import org.dxworks.clippy.model.ContentLimits;
import org.dxworks.clippy.model.block.ContentBlock;
import org.dxworks.clippy.model.block.ListBlock;
import org.dxworks.clippy.model.block.ListItem;
import org.dxworks.clippy.parser.BlockIdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Best-effort repair of content that failed validation: the version is reset, the block
 * list is cut to the block limit and every block, list item or nested list without an id,
 * or repeating an id seen earlier in document order, gets a fresh one.
 */
public class ContentSanitizer {

    private static final Logger logger = LoggerFactory.getLogger(ContentSanitizer.class);

    private final ContentLimits limits;
    private final Clock clock;

    public ContentSanitizer() {
        this(ContentLimits.DEFAULTS, Clock.systemUTC());
    }

    public ContentSanitizer(ContentLimits limits, Clock clock) {
        this.limits = limits;
        this.clock = clock;
    }

    public ClippyContent sanitize(ClippyContent content) {
        if (content == null) {
            return ClippyContent.empty(null);
        }
        List<ContentBlock> blocks = content.blocks();
        if (blocks.size() > limits.maxBlocks()) {
            logger.warn("Truncating content from {} to {} blocks", blocks.size(), limits.maxBlocks());
            blocks = blocks.subList(0, limits.maxBlocks());
        }

        Set<String> taken = new HashSet<>();
        for (ContentBlock block : blocks) {
            collectIds(block, taken);
        }

        IdRepair repair = new IdRepair(BlockIdGenerator.fromClock(clock), taken);
        List<ContentBlock> sanitized = new ArrayList<>(blocks.size());
        for (ContentBlock block : blocks) {
            String id = repair.id(block.id());
            ContentBlock repaired = block instanceof ListBlock list ? repair.list(list) : block;
            sanitized.add(id.equals(block.id()) ? repaired : repaired.withId(id));
        }
        return new ClippyContent(ClippyContent.CURRENT_VERSION, sanitized, content.metadata());
    }

    private static void collectIds(ContentBlock block, Set<String> taken) {
        if (block.id() != null && !block.id().isBlank()) {
            taken.add(block.id());
        }
        if (block instanceof ListBlock list) {
            collectListIds(list, taken);
        }
    }

    private static void collectListIds(ListBlock list, Set<String> taken) {
        for (ListItem item : list.items()) {
            if (item.id() != null && !item.id().isBlank()) {
                taken.add(item.id());
            }
            if (item.nested() != null) {
                if (item.nested().id() != null && !item.nested().id().isBlank()) {
                    taken.add(item.nested().id());
                }
                collectListIds(item.nested(), taken);
            }
        }
    }

    private static final class IdRepair {

        private final BlockIdGenerator ids;
        private final Set<String> taken;
        private final Set<String> seen = new HashSet<>();

        private IdRepair(BlockIdGenerator ids, Set<String> taken) {
            this.ids = ids;
            this.taken = taken;
        }

        private String id(String current) {
            if (current != null && !current.isBlank() && seen.add(current)) {
                return current;
            }
            String fresh = ids.nextAvoiding(taken);
            taken.add(fresh);
            seen.add(fresh);
            return fresh;
        }

        private ListBlock list(ListBlock list) {
            List<ListItem> items = new ArrayList<>(list.items().size());
            for (ListItem item : list.items()) {
                String itemId = id(item.id());
                ListBlock nested = null;
                if (item.nested() != null) {
                    String nestedId = id(item.nested().id());
                    nested = list(item.nested()).withId(nestedId);
                }
                items.add(new ListItem(itemId, item.content(), nested));
            }
            return new ListBlock(list.id(), list.listType(), items);
        }
    }
}
