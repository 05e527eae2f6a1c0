package com.nodeproxy.proxy.cache;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-session cached daemon state. Each field is an immutable value swapped as a whole, so a reader never sees
 * a value paired with another value's freshness metadata. Writers are expected to hold the daemon access guard.
 */
public class NodeCacheStore {

    private final AtomicReference<NodeInfoSnapshot> info = new AtomicReference<>();
    private final AtomicReference<HeightStamp> height = new AtomicReference<>();
    private final AtomicReference<Integer> rpcVersion = new AtomicReference<>();
    private final EarliestHeightTable earliestHeights = new EarliestHeightTable();
    private final AtomicReference<FeeEstimate> feeEstimate = new AtomicReference<>();
    private final AtomicReference<ServiceNodeSnapshot> serviceNodes = new AtomicReference<>();

    public Optional<NodeInfoSnapshot> getInfo() {
        return Optional.ofNullable(info.get());
    }

    /** Stores the snapshot and stamps its height with the same instant. */
    public void putInfo(NodeInfoSnapshot snapshot) {
        info.set(snapshot);
        height.set(new HeightStamp(snapshot.info().height(), snapshot.cachedAt()));
    }

    public Optional<HeightStamp> getHeight() {
        return Optional.ofNullable(height.get());
    }

    public void putHeight(HeightStamp stamp) {
        height.set(stamp);
    }

    public Optional<Integer> getRpcVersion() {
        return Optional.ofNullable(rpcVersion.get());
    }

    public void putRpcVersion(int version) {
        rpcVersion.set(version);
    }

    public OptionalLong getEarliestHeight(int version) {
        return earliestHeights.find(version);
    }

    public boolean putEarliestHeight(int version, long earliestHeight) {
        return earliestHeights.record(version, earliestHeight);
    }

    public Optional<FeeEstimate> getFeeEstimate() {
        return Optional.ofNullable(feeEstimate.get());
    }

    public void putFeeEstimate(FeeEstimate estimate) {
        feeEstimate.set(estimate);
    }

    public Optional<ServiceNodeSnapshot> getServiceNodes() {
        return Optional.ofNullable(serviceNodes.get());
    }

    public void putServiceNodes(ServiceNodeSnapshot snapshot) {
        serviceNodes.set(snapshot);
    }

    /**
     * Returns every field to its initial empty state.
     */
    public void reset() {
        info.set(null);
        height.set(null);
        rpcVersion.set(null);
        earliestHeights.clear();
        feeEstimate.set(null);
        serviceNodes.set(null);
    }
}
