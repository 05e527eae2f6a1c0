package com.nodeproxy.proxy.cache;

import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLongArray;

/**
 * Activation height per hard fork version (0..255). An entry is unknown until a non-zero height is recorded;
 * once known it never changes until {@link #clear()}.
 */
public class EarliestHeightTable {

    public static final int VERSION_COUNT = 256;

    private static final long UNKNOWN = 0L;

    private final AtomicLongArray heights = new AtomicLongArray(VERSION_COUNT);

    public OptionalLong find(int version) {
        long height = heights.get(checkVersion(version));
        return height == UNKNOWN ? OptionalLong.empty() : OptionalLong.of(height);
    }

    /**
     * Records the activation height for a version. A height of 0 carries no information and is not recorded.
     *
     * @return true if the entry is known after this call
     */
    public boolean record(int version, long earliestHeight) {
        int index = checkVersion(version);
        if (earliestHeight == UNKNOWN) {
            return heights.get(index) != UNKNOWN;
        }
        heights.compareAndSet(index, UNKNOWN, earliestHeight);
        return true;
    }

    public void clear() {
        for (int i = 0; i < VERSION_COUNT; i++) {
            heights.set(i, UNKNOWN);
        }
    }

    public static int checkVersion(int version) {
        if (version < 0 || version >= VERSION_COUNT) {
            throw new IllegalArgumentException("hard fork version must be in [0, " + (VERSION_COUNT - 1) + "]: " + version);
        }
        return version;
    }
}
