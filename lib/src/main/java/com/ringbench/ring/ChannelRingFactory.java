package com.ringbench.ring;

import com.ringbench.actor.ChannelActor;
import com.ringbench.channel.Channel;
import com.ringbench.channel.ChannelFactory;
import com.ringbench.channel.RendezvousChannel;
import com.ringbench.dispatcher.Dispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Builds rings of {@link ChannelActor}s connected by one primitive per edge.
 * <p>
 * Actor i reads primitive i and writes primitive i+1; actor N writes primitive 1, the
 * entry primitive, which closes the cycle. Each actor is started as soon as it is
 * constructed. That is safe because no token exists until the caller injects one into the
 * entry primitive after {@link #build} returns. A ring of one actor is a self-loop, which
 * needs a primitive whose transfer does not wait for a taker.
 */
public final class ChannelRingFactory implements RingFactory {

    private static final Logger logger = LoggerFactory.getLogger(ChannelRingFactory.class);

    private final Dispatcher dispatcher;
    private final ChannelFactory<Integer> channelFactory;

    public ChannelRingFactory(Dispatcher dispatcher, ChannelFactory<Integer> channelFactory) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory");
    }

    @Override
    public Chain build(int size, RendezvousChannel<Integer> finish) {
        if (size < 1) {
            throw new IllegalArgumentException("Ring size must be at least 1, got: " + size);
        }
        Channel<Integer> entry = channelFactory.create(dispatcher);
        if (size == 1 && entry.isSynchronous()) {
            // The single actor would park giving to itself and never take again
            throw new IllegalArgumentException("A ring over a synchronous channel needs at least 2 actors");
        }
        List<ChannelActor> actors = new ArrayList<>(size);
        Channel<Integer> in = entry;
        for (int i = 1; i <= size; i++) {
            Channel<Integer> out = i == size ? entry : channelFactory.create(dispatcher);
            ChannelActor actor = new ChannelActor(i, in, out, finish);
            actor.start();
            actors.add(actor);
            in = out;
        }
        logger.debug("Built ring of {} channel actors", size);
        return new ChannelChain(entry, Collections.unmodifiableList(actors));
    }

    private static final class ChannelChain implements Chain {

        private static final Runnable NO_OP = () -> { };

        private final Channel<Integer> entry;
        private final List<ChannelActor> actors;

        ChannelChain(Channel<Integer> entry, List<ChannelActor> actors) {
            this.entry = entry;
            this.actors = actors;
        }

        @Override
        public void inject(int token) {
            if (token < 0) {
                throw new IllegalArgumentException("Token must not be negative, got: " + token);
            }
            entry.tryTransfer(token, NO_OP);
        }

        @Override
        public List<ChannelActor> actors() {
            return actors;
        }
    }
}
