package com.ringbench.benchmarks;

import com.ringbench.config.RingConfig;
import com.ringbench.dispatcher.Dispatcher;
import com.ringbench.ring.ParallelRunner;
import com.ringbench.ring.RingResult;
import com.ringbench.ring.RingVariant;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.TimeUnit;

/**
 * Thread-ring run time per variant. Each invocation builds fresh rings, injects the
 * token and waits for every ring to report.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 2)
@Measurement(iterations = 5, time = 2)
@Fork(1)
public class ThreadRingBenchmark {

    @Param({"CH_GIVE", "CH_SEND", "MB_SEND", "MP_POST"})
    public RingVariant variant;

    @Param({"503"})
    public int ringSize;

    @Param({"10000"})
    public int token;

    @Param({"1", "4"})
    public int chains;

    private Dispatcher dispatcher;
    private ParallelRunner runner;

    @Setup(Level.Trial)
    public void setup() {
        RingConfig config = new RingConfig();
        dispatcher = Dispatcher.create(config);
        runner = variant.runner(dispatcher, config);
    }

    @TearDown(Level.Trial)
    public void tearDown() {
        dispatcher.shutdown();
        dispatcher.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Benchmark
    public RingResult ring() {
        return runner.run(ringSize, token, chains);
    }
}
