package org.dxworks.clippy.parser;

import java.time.Clock;
import java.util.Set;

/**
 * Produces ids of the form {@code block-<epochMillis>-<counter>}. The timestamp is taken
 * once, so ids from one generator differ only in their counter.
 */
public final class BlockIdGenerator {

    private static final String PREFIX = "block-";

    private final long epochMillis;
    private final boolean enabled;
    private int counter;

    private BlockIdGenerator(long epochMillis, boolean enabled) {
        this.epochMillis = epochMillis;
        this.enabled = enabled;
    }

    public static BlockIdGenerator fromClock(Clock clock) {
        return new BlockIdGenerator(clock.millis(), true);
    }

    public static BlockIdGenerator disabled() {
        return new BlockIdGenerator(0L, false);
    }

    public String next() {
        if (!enabled) {
            return "";
        }
        return PREFIX + epochMillis + "-" + counter++;
    }

    public String nextAvoiding(Set<String> taken) {
        String id = next();
        while (enabled && taken.contains(id)) {
            id = next();
        }
        return id;
    }
}
