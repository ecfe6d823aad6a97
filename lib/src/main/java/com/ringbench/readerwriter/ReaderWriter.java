package com.ringbench.readerwriter;

import java.util.concurrent.CompletableFuture;

/**
 * A writer and a reader sharing one channel.
 * <p>
 * The writer transfers {@code count, count - 1, ..., 1, 0}; the reader adds up every
 * non-zero value and completes with the sum when it receives 0. Implementations differ
 * only in how the two loops are encoded, never in the result.
 */
public interface ReaderWriter {

    /**
     * Returns the name printed in front of the measured throughput.
     *
     * @return The display name
     */
    String name();

    /**
     * Starts the writer and the reader on the dispatcher.
     *
     * @param count The first value written, at least 0
     * @return The reader's sum, {@code count * (count + 1) / 2}
     */
    CompletableFuture<Long> run(int count);
}
