package com.nodeproxy.proxy.cache;

import java.time.Instant;

/**
 * Most recently known chain height, tracked apart from the full info snapshot.
 */
public record HeightStamp(long height, Instant stampedAt) {
}
