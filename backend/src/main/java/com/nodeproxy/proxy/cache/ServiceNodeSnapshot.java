package com.nodeproxy.proxy.cache;

import com.nodeproxy.domain.ServiceNodeEntry;

import java.util.List;

/**
 * Full service node registry as of {@code cachedAtHeight}.
 */
public record ServiceNodeSnapshot(List<ServiceNodeEntry> entries, long cachedAtHeight) {

    public ServiceNodeSnapshot {
        entries = List.copyOf(entries);
    }

    public boolean isValidFor(long height) {
        return cachedAtHeight == height;
    }
}
