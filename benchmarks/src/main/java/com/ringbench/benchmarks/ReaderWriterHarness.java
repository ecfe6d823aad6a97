package com.ringbench.benchmarks;

import com.ringbench.config.RingConfig;
import com.ringbench.dispatcher.Dispatcher;
import com.ringbench.dispatcher.RunGuard;
import com.ringbench.measure.Measurement;
import com.ringbench.measure.Quiescence;
import com.ringbench.readerwriter.ReaderWriter;
import com.ringbench.readerwriter.StrictReaderWriter;
import com.ringbench.readerwriter.TweakedReaderWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs the reader/writer pair over a single rendezvous channel for growing counts, in
 * both encodings, and prints one line per run:
 * <pre>
 * Strict: 1234567.000000 hops per second
 * </pre>
 */
public class ReaderWriterHarness {

    private static final Logger logger = LoggerFactory.getLogger(ReaderWriterHarness.class);

    /** Counts run for each encoding, in order. */
    public static final List<Integer> DEFAULT_COUNTS = List.of(2_000, 20_000, 200_000, 2_000_000, 20_000_000);

    private final Dispatcher dispatcher;
    private final Quiescence quiescence;
    private final PrintStream out;

    public ReaderWriterHarness(Dispatcher dispatcher, Quiescence quiescence, PrintStream out) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.quiescence = Objects.requireNonNull(quiescence, "quiescence");
        this.out = Objects.requireNonNull(out, "out");
    }

    /**
     * Runs one count to completion and prints its line.
     *
     * @param readerWriter the encoding under test
     * @param count the first value written
     * @return the measurement, whose result is the reader's sum
     */
    public Measurement<Long> run(ReaderWriter readerWriter, int count) {
        logger.info("Running {} reader/writer with count {}", readerWriter.name(), count);
        Measurement<Long> measurement = Measurement.measure(readerWriter.name(), count, () -> {
            try (RunGuard guard = dispatcher.guard()) {
                return guard.await(readerWriter.run(count));
            }
        });
        out.println(measurement.formatHops());
        return measurement;
    }

    /**
     * Runs every count for every encoding, quiescing after each run. Stops early if
     * quiescence is interrupted.
     *
     * @param readerWriters the encodings
     * @param counts the counts
     * @return the measurements in run order
     */
    public List<Measurement<Long>> runAll(List<ReaderWriter> readerWriters, List<Integer> counts) {
        List<Measurement<Long>> measurements = new ArrayList<>();
        int total = readerWriters.size() * counts.size();
        for (ReaderWriter readerWriter : readerWriters) {
            for (int count : counts) {
                measurements.add(run(readerWriter, count));
                if (!quiescence.quiesce()) {
                    logger.warn("Quiescence interrupted, skipping the remaining {} runs",
                            total - measurements.size());
                    return measurements;
                }
            }
        }
        return measurements;
    }

    public static void main(String[] args) {
        RingConfig config = RingConfig.fromSystemProperties();
        Dispatcher dispatcher = Dispatcher.create(config);
        try {
            List<ReaderWriter> readerWriters = List.of(
                    new StrictReaderWriter(dispatcher),
                    new TweakedReaderWriter(dispatcher));
            new ReaderWriterHarness(dispatcher, config.quiescence(), System.out).runAll(readerWriters, DEFAULT_COUNTS);
        } finally {
            dispatcher.shutdown();
            dispatcher.awaitTermination(5, TimeUnit.SECONDS);
        }
    }
}
