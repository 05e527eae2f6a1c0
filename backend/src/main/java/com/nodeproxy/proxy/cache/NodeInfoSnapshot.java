package com.nodeproxy.proxy.cache;

import com.nodeproxy.domain.NodeInfo;

import java.time.Instant;

/**
 * Last get_info result and when it was fetched.
 */
public record NodeInfoSnapshot(NodeInfo info, Instant cachedAt) {
}
