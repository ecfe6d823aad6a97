package com.ringbench.readerwriter;

import com.ringbench.Continuation;
import com.ringbench.channel.Channel;
import com.ringbench.channel.ChannelFactory;
import com.ringbench.channel.RendezvousChannel;
import com.ringbench.dispatcher.Dispatcher;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Reader and writer written in continuation-passing style: each side is a resumable task
 * that loops over the channel's continuation operations and parks itself only when the
 * channel cannot complete an operation right away. No future is allocated per value.
 */
public final class TweakedReaderWriter implements ReaderWriter {

    private final Dispatcher dispatcher;
    private final ChannelFactory<Integer> channelFactory;

    public TweakedReaderWriter(Dispatcher dispatcher) {
        this(dispatcher, RendezvousChannel::new);
    }

    public TweakedReaderWriter(Dispatcher dispatcher, ChannelFactory<Integer> channelFactory) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory");
    }

    @Override
    public String name() {
        return "Tweaked";
    }

    @Override
    public CompletableFuture<Long> run(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Count must not be negative, got: " + count);
        }
        Channel<Integer> channel = channelFactory.create(dispatcher);
        Reader reader = new Reader(channel);
        dispatcher.schedule(new Writer(channel, count));
        dispatcher.schedule(reader);
        return reader.result;
    }

    private static final class Writer implements Runnable {

        private final Channel<Integer> channel;
        private int next;

        Writer(Channel<Integer> channel, int first) {
            this.channel = channel;
            this.next = first;
        }

        @Override
        public void run() {
            while (next >= 0) {
                int value = next--;
                if (!channel.tryTransfer(value, this)) {
                    return;
                }
            }
        }
    }

    private static final class Reader implements Runnable, Continuation<Integer> {

        private final Channel<Integer> channel;
        private final CompletableFuture<Long> result = new CompletableFuture<>();
        private long sum;
        private Integer delivered;

        Reader(Channel<Integer> channel) {
            this.channel = channel;
        }

        @Override
        public void resume(Integer value) {
            delivered = value;
            run();
        }

        @Override
        public void run() {
            Integer value = delivered;
            delivered = null;
            while (true) {
                if (value == null) {
                    value = channel.tryTake(this);
                    if (value == null) {
                        return;
                    }
                }
                if (value == 0) {
                    result.complete(sum);
                    return;
                }
                sum += value;
                value = null;
            }
        }
    }
}
