package com.ringbench.readerwriter;

import com.ringbench.channel.Channel;
import com.ringbench.channel.ChannelFactory;
import com.ringbench.channel.RendezvousChannel;
import com.ringbench.dispatcher.Dispatcher;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Reader and writer written in direct style: each transfer is an explicit future and each
 * loop iteration is a recursive call chained on it.
 */
public final class StrictReaderWriter implements ReaderWriter {

    private final Dispatcher dispatcher;
    private final ChannelFactory<Integer> channelFactory;

    public StrictReaderWriter(Dispatcher dispatcher) {
        this(dispatcher, RendezvousChannel::new);
    }

    public StrictReaderWriter(Dispatcher dispatcher, ChannelFactory<Integer> channelFactory) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory");
    }

    @Override
    public String name() {
        return "Strict";
    }

    @Override
    public CompletableFuture<Long> run(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Count must not be negative, got: " + count);
        }
        Channel<Integer> channel = channelFactory.create(dispatcher);
        CompletableFuture<Long> result = new CompletableFuture<>();
        dispatcher.schedule(() -> write(channel, count, result));
        dispatcher.schedule(() -> read(channel, 0L, result));
        return result;
    }

    // Every step runs as its own dispatcher task, so the stack never grows with the count
    private void write(Channel<Integer> channel, int value, CompletableFuture<Long> result) {
        try {
            channel.transferAsync(value).whenCompleteAsync((ignored, error) -> {
                if (error != null) {
                    abort(result, error);
                } else if (value != 0) {
                    write(channel, value - 1, result);
                }
            }, dispatcher);
        } catch (Throwable t) {
            abort(result, t);
        }
    }

    private void read(Channel<Integer> channel, long sum, CompletableFuture<Long> result) {
        try {
            channel.takeAsync().whenCompleteAsync((value, error) -> {
                if (error != null) {
                    abort(result, error);
                } else if (value == 0) {
                    result.complete(sum);
                } else {
                    read(channel, sum + value, result);
                }
            }, dispatcher);
        } catch (Throwable t) {
            abort(result, t);
        }
    }

    private void abort(CompletableFuture<Long> result, Throwable failure) {
        if (result.completeExceptionally(failure)) {
            dispatcher.reportFailure(failure);
        }
    }
}
