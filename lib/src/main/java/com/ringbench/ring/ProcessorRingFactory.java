package com.ringbench.ring;

import com.ringbench.actor.ProcessorActor;
import com.ringbench.channel.RendezvousChannel;
import com.ringbench.config.RingConfig;
import com.ringbench.dispatcher.Dispatcher;
import com.ringbench.dispatcher.MailboxType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Builds rings of {@link ProcessorActor}s: actor i posts to actor (i mod N) + 1.
 * All actors are created first, then linked, then started.
 */
public final class ProcessorRingFactory implements RingFactory {

    private static final Logger logger = LoggerFactory.getLogger(ProcessorRingFactory.class);

    private final Dispatcher dispatcher;
    private final MailboxType mailboxType;
    private final int throughput;

    public ProcessorRingFactory(Dispatcher dispatcher) {
        this(dispatcher, RingConfig.DEFAULT_MAILBOX_TYPE, RingConfig.DEFAULT_THROUGHPUT);
    }

    public ProcessorRingFactory(Dispatcher dispatcher, MailboxType mailboxType, int throughput) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.mailboxType = Objects.requireNonNull(mailboxType, "mailboxType");
        this.throughput = throughput;
    }

    @Override
    public Chain build(int size, RendezvousChannel<Integer> finish) {
        if (size < 1) {
            throw new IllegalArgumentException("Ring size must be at least 1, got: " + size);
        }
        ProcessorActor[] actors = new ProcessorActor[size];
        for (int i = 0; i < size; i++) {
            actors[i] = new ProcessorActor(i + 1, finish, dispatcher, mailboxType, throughput);
        }
        for (int i = 0; i < size; i++) {
            actors[i].setNext(actors[(i + 1) % size]);
        }
        for (ProcessorActor actor : actors) {
            actor.start();
        }
        logger.debug("Built ring of {} processor actors", size);
        return new ProcessorChain(Collections.unmodifiableList(Arrays.asList(actors)));
    }

    private static final class ProcessorChain implements Chain {

        private final List<ProcessorActor> actors;

        ProcessorChain(List<ProcessorActor> actors) {
            this.actors = actors;
        }

        @Override
        public void inject(int token) {
            if (token < 0) {
                throw new IllegalArgumentException("Token must not be negative, got: " + token);
            }
            actors.get(0).tell(token);
        }

        @Override
        public List<ProcessorActor> actors() {
            return actors;
        }
    }
}
