package com.ringbench.benchmarks;

import com.ringbench.channel.BufferedChannel;
import com.ringbench.channel.Channel;
import com.ringbench.dispatcher.Dispatcher;
import com.ringbench.mailbox.Mailbox;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.TimeUnit;

/**
 * Microbenchmarks of the asynchronous primitives without any actor around them.
 *
 * This focuses purely on the cost of send + take when the value is already there, so
 * no consumer is ever parked and the dispatcher is never involved.
 */
@BenchmarkMode({Mode.Throughput, Mode.AverageTime})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(2)
public class ChannelBenchmark {

    @State(Scope.Thread)
    public static class ChannelState {
        @Param({"buffered", "mailbox"})
        public String channelType;

        private Dispatcher dispatcher;
        private Channel<Integer> channel;

        @Setup
        public void setup() {
            dispatcher = Dispatcher.fixedThreadPoolDispatcher(1, "channel-bench");
            switch (channelType) {
                case "buffered" -> channel = new BufferedChannel<>(dispatcher);
                case "mailbox" -> channel = new Mailbox<>(dispatcher);
                default -> throw new IllegalArgumentException("Unknown channel type: " + channelType);
            }
        }

        @TearDown
        public void tearDown() {
            dispatcher.shutdown();
        }
    }

    /**
     * Send then take in pairs: queue overhead with minimal depth.
     */
    @Benchmark
    public int sendTakePairs(ChannelState state) {
        int sum = 0;
        for (int i = 1; i <= 1000; i++) {
            state.channel.tryTransfer(i, null);
            sum += state.channel.tryTake(value -> {
                throw new AssertionError("Taker parked on a non-empty channel");
            });
        }
        return sum;
    }

    /**
     * Fill, then drain: queue cost with actual depth.
     */
    @Benchmark
    public int sendThenTake(ChannelState state) {
        for (int i = 1; i <= 1000; i++) {
            state.channel.tryTransfer(i, null);
        }
        int sum = 0;
        for (int i = 0; i < 1000; i++) {
            Integer value = state.channel.tryTake(v -> {
                throw new AssertionError("Taker parked on a non-empty channel");
            });
            if (value == null) throw new AssertionError("Channel underflow at " + i);
            sum += value;
        }
        return sum;
    }
}
