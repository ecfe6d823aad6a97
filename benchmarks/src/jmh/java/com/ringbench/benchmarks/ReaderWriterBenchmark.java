package com.ringbench.benchmarks;

import com.ringbench.channel.RendezvousChannel;
import com.ringbench.config.RingConfig;
import com.ringbench.dispatcher.Dispatcher;
import com.ringbench.dispatcher.RunGuard;
import com.ringbench.readerwriter.ReaderWriter;
import com.ringbench.readerwriter.ReaderWriterStyle;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.TimeUnit;

/**
 * Rendezvous give/take cost in both reader/writer encodings; the score is hops per
 * millisecond.
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 2)
@Measurement(iterations = 5, time = 2)
@Fork(1)
public class ReaderWriterBenchmark {

    private static final int COUNT = 20_000;

    @Param({"STRICT", "TWEAKED"})
    public ReaderWriterStyle style;

    private Dispatcher dispatcher;
    private ReaderWriter readerWriter;

    @Setup(Level.Trial)
    public void setup() {
        dispatcher = Dispatcher.create(new RingConfig());
        readerWriter = style.create(dispatcher, RendezvousChannel::new);
    }

    @TearDown(Level.Trial)
    public void tearDown() {
        dispatcher.shutdown();
        dispatcher.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Benchmark
    @OperationsPerInvocation(COUNT)
    public long readerWriter() {
        try (RunGuard guard = dispatcher.guard()) {
            return guard.await(readerWriter.run(COUNT));
        }
    }
}
