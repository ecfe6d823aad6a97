package com.ringbench.benchmarks;

import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

/**
 * Entry point for the JMH benchmarks.
 *
 * Usage:
 *
 * # Run everything
 * java -cp ... com.ringbench.benchmarks.BenchmarkRunner
 *
 * # Run only the thread ring
 * java -cp ... com.ringbench.benchmarks.BenchmarkRunner ".*ThreadRingBenchmark.*"
 *
 * # Run only raw primitive costs
 * java -cp ... com.ringbench.benchmarks.BenchmarkRunner ".*ChannelBenchmark.*"
 */
public class BenchmarkRunner {

    public static void main(String[] args) throws RunnerException {
        String pattern = args.length > 0 ? args[0] : "com\\.ringbench\\.benchmarks\\..*";

        Options opt = new OptionsBuilder()
                .include(pattern)
                .build();

        System.out.println("Running benchmarks with pattern: " + pattern);
        new Runner(opt).run();
    }
}
