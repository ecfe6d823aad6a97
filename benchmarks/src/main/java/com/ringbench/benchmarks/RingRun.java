package com.ringbench.benchmarks;

import com.ringbench.ring.RingVariant;

/**
 * One configuration of the thread-ring matrix.
 *
 * @param variant the primitive and actor style under test
 * @param ringSize actors per ring (N)
 * @param token initial token per ring (M)
 * @param chains rings run in parallel (P)
 */
public record RingRun(RingVariant variant, int ringSize, int token, int chains) {

    public long messages() {
        return (long) chains * token;
    }
}
