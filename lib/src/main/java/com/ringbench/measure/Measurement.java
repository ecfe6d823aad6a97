package com.ringbench.measure;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Result of one timed benchmark run.
 *
 * @param variant the name of the measured variant
 * @param messages the number of messages counted for throughput
 * @param elapsed the wall-clock time of the run
 * @param result the value the run produced
 * @param <R> the result type
 */
public record Measurement<R>(String variant, long messages, Duration elapsed, R result) {

    public Measurement {
        Objects.requireNonNull(variant, "variant");
        Objects.requireNonNull(elapsed, "elapsed");
    }

    /**
     * Times a blocking run from start to completion.
     *
     * @param variant the name of the measured variant
     * @param messages the number of messages the run transfers
     * @param run the run, returning once it has completed
     * @param <R> the result type
     * @return the measurement
     */
    public static <R> Measurement<R> measure(String variant, long messages, Supplier<R> run) {
        Objects.requireNonNull(run, "run");
        long start = System.nanoTime();
        R result = run.get();
        long elapsed = System.nanoTime() - start;
        return new Measurement<>(variant, messages, Duration.ofNanos(elapsed), result);
    }

    /**
     * Returns the elapsed time in seconds.
     *
     * @return seconds, with nanosecond precision
     */
    public double elapsedSeconds() {
        return elapsed.toNanos() / 1_000_000_000.0;
    }

    /**
     * Returns messages per second, or NaN when no time was measured.
     *
     * @return the throughput
     */
    public double throughput() {
        if (elapsed.isZero() || elapsed.isNegative()) {
            return Double.NaN;
        }
        return messages / elapsedSeconds();
    }

    /**
     * Formats a thread-ring result line:
     * {@code <variant>: <throughput> msgs/s - <messages>m/<seconds>s - <result>}.
     *
     * @return the formatted line
     */
    public String formatMessages() {
        return String.format(Locale.ROOT, "%s: %f msgs/s - %dm/%fs - %s",
                variant, throughput(), messages, elapsedSeconds(), result);
    }

    /**
     * Formats a reader/writer result line: {@code <variant>: <throughput> hops per second}.
     *
     * @return the formatted line
     */
    public String formatHops() {
        return String.format(Locale.ROOT, "%s: %f hops per second", variant, throughput());
    }
}
