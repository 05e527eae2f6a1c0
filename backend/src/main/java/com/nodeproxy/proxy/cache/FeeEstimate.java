package com.nodeproxy.proxy.cache;

/**
 * Cached get_fee_estimate result keyed by the height and grace blocks it was requested for.
 * The quantization mask is always at least 1.
 */
public record FeeEstimate(long fee, long quantizationMask, long cachedForHeight, long cachedForGraceBlocks) {

    public FeeEstimate {
        if (quantizationMask <= 0) {
            throw new IllegalArgumentException("quantizationMask must be positive: " + quantizationMask);
        }
    }

    /** Fee is reusable only for the same height and grace blocks. */
    public boolean isValidFor(long height, long graceBlocks) {
        return cachedForHeight == height && cachedForGraceBlocks == graceBlocks;
    }

    /** The mask only needs the height to match. */
    public boolean isValidForHeight(long height) {
        return cachedForHeight == height;
    }
}
