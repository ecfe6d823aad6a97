package com.ringbench.measure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Settles the JVM between two measured runs: several rounds of a full collection
 * followed by a short pause, so garbage and scheduler activity left by one run do not
 * bias the next. Not part of any primitive's contract; the harness calls it explicitly.
 */
public final class Quiescence {

    private static final Logger logger = LoggerFactory.getLogger(Quiescence.class);

    public static final int DEFAULT_ROUNDS = 10;
    public static final Duration DEFAULT_PAUSE = Duration.ofMillis(50);

    private final int rounds;
    private final Duration pause;

    public Quiescence() {
        this(DEFAULT_ROUNDS, DEFAULT_PAUSE);
    }

    public Quiescence(int rounds, Duration pause) {
        if (rounds < 0) {
            throw new IllegalArgumentException("Rounds must not be negative, got: " + rounds);
        }
        this.rounds = rounds;
        this.pause = Objects.requireNonNull(pause, "pause");
    }

    /**
     * Runs the configured collection rounds.
     *
     * @return true if all rounds ran, false if the thread was interrupted
     */
    public boolean quiesce() {
        for (int i = 0; i < rounds; i++) {
            System.gc();
            try {
                Thread.sleep(pause.toMillis());
            } catch (InterruptedException e) {
                logger.warn("Interrupted during quiescence after {} of {} rounds", i + 1, rounds);
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    public int getRounds() {
        return rounds;
    }

    public Duration getPause() {
        return pause;
    }
}
