package com.nodeproxy.domain;

/**
 * Chain state reported by one get_info call: current height, sync target height and block weight limit.
 */
public record NodeInfo(long height, long targetHeight, long blockWeightLimit) {
}
