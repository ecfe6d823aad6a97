package com.ringbench.benchmarks;

import com.ringbench.config.RingConfig;
import com.ringbench.dispatcher.Dispatcher;
import com.ringbench.measure.Measurement;
import com.ringbench.measure.Quiescence;
import com.ringbench.ring.ParallelRunner;
import com.ringbench.ring.RingResult;
import com.ringbench.ring.RingVariant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs the thread-ring matrix and prints one line per configuration:
 * <pre>
 * ChGive: 1234567.000000 msgs/s - 5000m/0.004050s - [48]
 * </pre>
 * Each variant runs a short ring, a long ring and one ring per processor, with a
 * quiescence period after every run. A failed run propagates and stops the harness
 * before its line is printed.
 *
 * Usage:
 * <pre>
 * java -cp benchmarks/target/classes:... com.ringbench.benchmarks.ThreadRingHarness
 * </pre>
 */
public class ThreadRingHarness {

    private static final Logger logger = LoggerFactory.getLogger(ThreadRingHarness.class);

    private final Dispatcher dispatcher;
    private final RingConfig config;
    private final Quiescence quiescence;
    private final PrintStream out;

    public ThreadRingHarness(Dispatcher dispatcher, RingConfig config, PrintStream out) {
        this(dispatcher, config, config.quiescence(), out);
    }

    public ThreadRingHarness(Dispatcher dispatcher, RingConfig config, Quiescence quiescence, PrintStream out) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.config = Objects.requireNonNull(config, "config");
        this.quiescence = Objects.requireNonNull(quiescence, "quiescence");
        this.out = Objects.requireNonNull(out, "out");
    }

    /**
     * Returns the fixed matrix: for each variant, (503, 5000, 1), (503, 50000000, 1) and
     * (53, 50000000, processors).
     *
     * @param processors the number of parallel rings for the widest configuration
     * @return the configurations in run order
     */
    public static List<RingRun> defaultMatrix(int processors) {
        List<RingRun> matrix = new ArrayList<>();
        for (RingVariant variant : List.of(RingVariant.CH_GIVE, RingVariant.MB_SEND,
                RingVariant.CH_SEND, RingVariant.MP_POST)) {
            matrix.add(new RingRun(variant, 503, 5_000, 1));
            matrix.add(new RingRun(variant, 503, 50_000_000, 1));
            matrix.add(new RingRun(variant, 53, 50_000_000, processors));
        }
        return matrix;
    }

    /**
     * Runs one configuration and prints its line.
     *
     * @param run the configuration
     * @return the measurement
     */
    public Measurement<RingResult> run(RingRun run) {
        ParallelRunner runner = run.variant().runner(dispatcher, config);
        logger.info("Running {} with ring size {}, token {}, {} chains",
                run.variant().displayName(), run.ringSize(), run.token(), run.chains());
        Measurement<RingResult> measurement = Measurement.measure(run.variant().displayName(), run.messages(),
                () -> runner.run(run.ringSize(), run.token(), run.chains()));
        out.println(measurement.formatMessages());
        return measurement;
    }

    /**
     * Runs every configuration in order, quiescing after each. Stops early if quiescence
     * is interrupted.
     *
     * @param matrix the configurations
     * @return the measurements in run order
     */
    public List<Measurement<RingResult>> runAll(List<RingRun> matrix) {
        List<Measurement<RingResult>> measurements = new ArrayList<>(matrix.size());
        for (RingRun run : matrix) {
            measurements.add(run(run));
            if (!quiescence.quiesce()) {
                logger.warn("Quiescence interrupted, skipping the remaining {} runs",
                        matrix.size() - measurements.size());
                break;
            }
        }
        return measurements;
    }

    public static void main(String[] args) {
        RingConfig config = RingConfig.fromSystemProperties();
        int processors = Runtime.getRuntime().availableProcessors();
        Dispatcher dispatcher = Dispatcher.create(config);
        try {
            new ThreadRingHarness(dispatcher, config, System.out).runAll(defaultMatrix(processors));
        } finally {
            dispatcher.shutdown();
            dispatcher.awaitTermination(5, TimeUnit.SECONDS);
        }
    }
}
