package com.nodeproxy.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.nodeproxy.common.ExclusiveAccessGuard;
import com.nodeproxy.domain.NodeInfo;
import com.nodeproxy.domain.ServiceNodeEntry;
import com.nodeproxy.proxy.cache.EarliestHeightTable;
import com.nodeproxy.proxy.cache.FeeEstimate;
import com.nodeproxy.proxy.cache.FreshnessWindow;
import com.nodeproxy.proxy.cache.HeightStamp;
import com.nodeproxy.proxy.cache.NodeCacheStore;
import com.nodeproxy.proxy.cache.NodeInfoSnapshot;
import com.nodeproxy.proxy.cache.ServiceNodeSnapshot;
import com.nodeproxy.rpc.DaemonTransport;
import com.nodeproxy.rpc.RpcResponse;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Read-through cache in front of the daemon RPC interface. One instance per wallet session.
 * <p>
 * Freshness per field:
 * <ul>
 *     <li>info (height, target height, block weight limit): refreshed after {@code refreshInterval}</li>
 *     <li>height: separately stamped, also by {@link #setHeight(long)}; falls back to info</li>
 *     <li>rpc version, activation heights: fetched once per session</li>
 *     <li>fee estimate: keyed by (height, grace blocks); quantization mask keyed by height only</li>
 *     <li>service node registry: keyed by height; filtered lookups are never cached</li>
 * </ul>
 * Remote calls and cache writes run under the shared {@link ExclusiveAccessGuard}. A failed call never
 * touches cached state.
 */
@Slf4j
public class NodeRpcProxy {

    public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofSeconds(30);

    static final String GET_INFO = "get_info";
    static final String GET_VERSION = "get_version";
    static final String HARD_FORK_INFO = "hard_fork_info";
    static final String GET_FEE_ESTIMATE = "get_fee_estimate";
    static final String GET_SERVICE_NODES = "get_service_nodes";
    static final String GET_ALL_SERVICE_NODES = "get_all_service_nodes";

    private static final Map<String, Object> NO_PARAMS = Map.of();

    private final DaemonTransport transport;
    private final ExclusiveAccessGuard guard;
    private final boolean offline;
    private final FreshnessWindow freshness;
    private final NodeCacheStore store = new NodeCacheStore();

    public NodeRpcProxy(DaemonTransport transport, ExclusiveAccessGuard guard, boolean offline) {
        this(transport, guard, offline, Clock.systemUTC(), DEFAULT_REFRESH_INTERVAL);
    }

    public NodeRpcProxy(DaemonTransport transport, ExclusiveAccessGuard guard, boolean offline,
                        Clock clock, Duration refreshInterval) {
        this.transport = transport;
        this.guard = guard;
        this.offline = offline;
        this.freshness = new FreshnessWindow(clock, refreshInterval);
    }

    public boolean isOffline() {
        return offline;
    }

    /**
     * Clears every cached field, e.g. when the wallet switches to another daemon. Waits for an in-flight call.
     */
    public void reset() {
        guard.runExclusive(store::reset);
        log.info("Daemon RPC cache reset");
    }

    /**
     * Records a height learned elsewhere (e.g. from a block refresh); it is trusted for one refresh interval.
     */
    public void setHeight(long height) {
        store.putHeight(new HeightStamp(height, freshness.now()));
    }

    public ProxyResult<Integer> getRpcVersion() {
        if (offline) {
            return ProxyResult.failure(RpcFailure.offline());
        }
        Optional<Integer> cached = store.getRpcVersion();
        if (cached.isPresent()) {
            return ProxyResult.success(cached.get());
        }
        return guard.callExclusive(() -> {
            Optional<Integer> populated = store.getRpcVersion();
            if (populated.isPresent()) {
                return ProxyResult.success(populated.get());
            }
            return fetch(GET_VERSION, NO_PARAMS).map(result -> {
                int version = result.path("version").asInt();
                store.putRpcVersion(version);
                return version;
            });
        });
    }

    /**
     * Height, target height and block weight limit, refreshed at most once per refresh interval.
     */
    public ProxyResult<NodeInfo> getInfo() {
        if (offline) {
            return ProxyResult.failure(RpcFailure.offline());
        }
        Optional<NodeInfoSnapshot> cached = freshInfo();
        if (cached.isPresent()) {
            return ProxyResult.success(cached.get().info());
        }
        return guard.callExclusive(() -> {
            Optional<NodeInfoSnapshot> refreshed = freshInfo();
            if (refreshed.isPresent()) {
                return ProxyResult.success(refreshed.get().info());
            }
            return fetch(GET_INFO, NO_PARAMS).map(result -> {
                long blockWeightLimit = result.path("block_weight_limit").asLong();
                if (blockWeightLimit == 0) {
                    blockWeightLimit = result.path("block_size_limit").asLong();
                }
                NodeInfo info = new NodeInfo(
                        result.path("height").asLong(),
                        result.path("target_height").asLong(),
                        blockWeightLimit);
                store.putInfo(new NodeInfoSnapshot(info, freshness.now()));
                log.debug("Daemon info refreshed: height={} target={}", info.height(), info.targetHeight());
                return info;
            });
        });
    }

    public ProxyResult<Long> getHeight() {
        Optional<HeightStamp> stamp = store.getHeight().filter(s -> freshness.isFresh(s.stampedAt()));
        if (stamp.isPresent()) {
            return ProxyResult.success(stamp.get().height());
        }
        return getInfo().map(NodeInfo::height);
    }

    public ProxyResult<Long> getTargetHeight() {
        return getInfo().map(NodeInfo::targetHeight);
    }

    public ProxyResult<Long> getBlockWeightLimit() {
        return getInfo().map(NodeInfo::blockWeightLimit);
    }

    /**
     * Height at which the given hard fork version activates. Known heights are cached for the session;
     * a daemon answer of 0 is passed through but queried again next time.
     *
     * @param version hard fork version, 0..255
     */
    public ProxyResult<Long> getEarliestHeight(int version) {
        EarliestHeightTable.checkVersion(version);
        if (offline) {
            return ProxyResult.failure(RpcFailure.offline());
        }
        OptionalLong cached = store.getEarliestHeight(version);
        if (cached.isPresent()) {
            return ProxyResult.success(cached.getAsLong());
        }
        return guard.callExclusive(() -> {
            OptionalLong populated = store.getEarliestHeight(version);
            if (populated.isPresent()) {
                return ProxyResult.success(populated.getAsLong());
            }
            return fetch(HARD_FORK_INFO, Map.of("version", version)).map(result -> {
                long earliestHeight = result.path("earliest_height").asLong();
                if (!store.putEarliestHeight(version, earliestHeight)) {
                    log.debug("Daemon reports no activation height for hard fork version {}", version);
                }
                return earliestHeight;
            });
        });
    }

    /**
     * Current hard fork version of the daemon, always fetched.
     *
     * @throws HardForkVersionUnavailableException if offline or the daemon call fails
     */
    public int getHardForkVersion() {
        if (offline) {
            throw new HardForkVersionUnavailableException("Cannot read hard fork version: " + RpcFailure.OFFLINE_DESCRIPTION);
        }
        ProxyResult<JsonNode> result = fetch(HARD_FORK_INFO, NO_PARAMS);
        if (result.isFailure()) {
            throw new HardForkVersionUnavailableException("Failed to get hard fork status: "
                    + result.getFailureDescription().orElse(""));
        }
        return result.getValue().path("version").asInt();
    }

    /**
     * Base fee per byte/weight. Reused while both the chain height and {@code graceBlocks} are unchanged.
     */
    public ProxyResult<Long> getDynamicBaseFeeEstimate(long graceBlocks) {
        if (offline) {
            return ProxyResult.failure(RpcFailure.offline());
        }
        return getHeight().flatMap(height -> {
            Optional<FeeEstimate> cached = store.getFeeEstimate().filter(f -> f.isValidFor(height, graceBlocks));
            if (cached.isPresent()) {
                return ProxyResult.success(cached.get().fee());
            }
            return guard.callExclusive(() -> getHeight().flatMap(current -> {
                Optional<FeeEstimate> refreshed = store.getFeeEstimate().filter(f -> f.isValidFor(current, graceBlocks));
                if (refreshed.isPresent()) {
                    return ProxyResult.success(refreshed.get().fee());
                }
                return refreshFeeEstimate(current, graceBlocks).map(FeeEstimate::fee);
            }));
        });
    }

    /**
     * Fee quantization mask, never 0. Reused while the chain height is unchanged, whatever grace blocks the
     * cached estimate was requested with.
     */
    public ProxyResult<Long> getFeeQuantizationMask() {
        if (offline) {
            return ProxyResult.failure(RpcFailure.offline());
        }
        return getHeight().flatMap(height -> {
            Optional<FeeEstimate> cached = store.getFeeEstimate().filter(f -> f.isValidForHeight(height));
            if (cached.isPresent()) {
                return ProxyResult.success(cached.get().quantizationMask());
            }
            return guard.callExclusive(() -> getHeight().flatMap(current -> {
                Optional<FeeEstimate> estimate = store.getFeeEstimate();
                if (estimate.isPresent() && estimate.get().isValidForHeight(current)) {
                    return ProxyResult.success(estimate.get().quantizationMask());
                }
                long graceBlocks = estimate.map(FeeEstimate::cachedForGraceBlocks).orElse(0L);
                return refreshFeeEstimate(current, graceBlocks).map(FeeEstimate::quantizationMask);
            }));
        });
    }

    /**
     * Registry entries for the given pubkeys; always fetched. An empty pubkey collection asks for all entries.
     */
    public ProxyResult<List<ServiceNodeEntry>> getServiceNodes(Collection<String> pubkeys) {
        if (offline) {
            return ProxyResult.failure(RpcFailure.offline());
        }
        Map<String, Object> params = Map.of("service_node_pubkeys", List.copyOf(pubkeys));
        return fetch(GET_SERVICE_NODES, params).map(ServiceNodeEntry::listFromResult);
    }

    /**
     * Full registry, refreshed whenever the chain height changes.
     */
    public ProxyResult<List<ServiceNodeEntry>> getAllServiceNodes() {
        if (offline) {
            return ProxyResult.failure(RpcFailure.offline());
        }
        return guard.callExclusive(() -> getHeight().flatMap(height -> {
            Optional<ServiceNodeSnapshot> cached = store.getServiceNodes().filter(s -> s.isValidFor(height));
            if (cached.isPresent()) {
                return ProxyResult.success(cached.get().entries());
            }
            return fetch(GET_ALL_SERVICE_NODES, NO_PARAMS).map(result -> {
                ServiceNodeSnapshot snapshot = new ServiceNodeSnapshot(ServiceNodeEntry.listFromResult(result), height);
                store.putServiceNodes(snapshot);
                log.debug("Service node registry refreshed at height {}: {} entries", height, snapshot.entries().size());
                return snapshot.entries();
            });
        }));
    }

    private Optional<NodeInfoSnapshot> freshInfo() {
        return store.getInfo().filter(s -> freshness.isFresh(s.cachedAt()));
    }

    private ProxyResult<FeeEstimate> refreshFeeEstimate(long height, long graceBlocks) {
        return fetch(GET_FEE_ESTIMATE, Map.of("grace_blocks", graceBlocks)).flatMap(result -> {
            JsonNode fee = result.path("fee");
            JsonNode mask = result.path("quantization_mask");
            if (!fitsInLong(fee) || !fitsInLong(mask)) {
                RpcFailure failure = RpcFailure.errorStatus(GET_FEE_ESTIMATE,
                        "fee " + fee.asText() + " or quantization mask " + mask.asText() + " out of range");
                log.warn("Daemon RPC {} failed: {}", GET_FEE_ESTIMATE, failure.description());
                return ProxyResult.failure(failure);
            }
            FeeEstimate estimate = new FeeEstimate(
                    fee.asLong(),
                    coerceQuantizationMask(mask.asLong()),
                    height,
                    graceBlocks);
            store.putFeeEstimate(estimate);
            log.debug("Fee estimate refreshed at height {} (grace blocks {}): fee={} mask={}",
                    height, graceBlocks, estimate.fee(), estimate.quantizationMask());
            return ProxyResult.success(estimate);
        });
    }

    /** Daemon amounts are unsigned 64-bit; only values in 0..Long.MAX_VALUE are accepted. A missing field reads as 0. */
    private static boolean fitsInLong(JsonNode node) {
        return node.isMissingNode() || (node.canConvertToLong() && node.asLong() >= 0);
    }

    private static long coerceQuantizationMask(long mask) {
        if (mask == 0) {
            log.warn("Fee quantization mask is 0, forcing to 1");
            return 1;
        }
        return mask;
    }

    private ProxyResult<JsonNode> fetch(String method, Object params) {
        RpcResponse response = guard.callExclusive(() -> transport.invoke(method, params));
        Optional<RpcFailure> failure = DaemonResponseValidator.validate(method, response);
        if (failure.isPresent()) {
            log.warn("Daemon RPC {} failed: {}", method, failure.get().description());
            return ProxyResult.failure(failure.get());
        }
        return ProxyResult.success(response.result());
    }
}
