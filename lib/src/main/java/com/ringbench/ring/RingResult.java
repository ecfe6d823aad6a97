package com.ringbench.ring;

import java.util.List;

/**
 * Outcome of one parallel ring run.
 *
 * @param ringSize the number of actors per chain
 * @param token the initial token injected into every chain
 * @param chains the number of chains run in parallel
 * @param reporters the name of the actor that reported for each chain, in order of receipt
 */
public record RingResult(int ringSize, int token, int chains, List<Integer> reporters) {

    public RingResult {
        reporters = List.copyOf(reporters);
    }

    /**
     * Returns the number of messages counted for throughput: one token of M hops' worth
     * of work per chain.
     *
     * @return chains times token
     */
    public long messages() {
        return (long) chains * token;
    }

    @Override
    public String toString() {
        return reporters.toString();
    }
}
