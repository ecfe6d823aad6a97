package com.ringbench.ring;

import com.ringbench.channel.BufferedChannel;
import com.ringbench.channel.RendezvousChannel;
import com.ringbench.config.RingConfig;
import com.ringbench.dispatcher.Dispatcher;
import com.ringbench.mailbox.Mailbox;

/**
 * The thread-ring variants compared by the harness, one per primitive and actor style.
 */
public enum RingVariant {

    /** Channel actors forwarding with a rendezvous give. */
    CH_GIVE("ChGive") {
        @Override
        public RingFactory factory(Dispatcher dispatcher, RingConfig config) {
            return new ChannelRingFactory(dispatcher, RendezvousChannel::new);
        }
    },

    /** Channel actors forwarding with an asynchronous send on a buffered channel. */
    CH_SEND("ChSend") {
        @Override
        public RingFactory factory(Dispatcher dispatcher, RingConfig config) {
            return new ChannelRingFactory(dispatcher, BufferedChannel::new);
        }
    },

    /** Channel actors forwarding with a send to the next actor's mailbox. */
    MB_SEND("MbSend") {
        @Override
        public RingFactory factory(Dispatcher dispatcher, RingConfig config) {
            return new ChannelRingFactory(dispatcher, Mailbox::new);
        }
    },

    /** Message-processor actors posting to each other. */
    MP_POST("MPPost") {
        @Override
        public RingFactory factory(Dispatcher dispatcher, RingConfig config) {
            return new ProcessorRingFactory(dispatcher, config.getMailboxType(), config.getThroughput());
        }
    };

    private final String displayName;

    RingVariant(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Creates the ring factory implementing this variant.
     *
     * @param dispatcher The dispatcher running the actors
     * @param config Tuning for the processor variant
     * @return A ring factory
     */
    public abstract RingFactory factory(Dispatcher dispatcher, RingConfig config);

    /**
     * Creates a runner for this variant.
     *
     * @param dispatcher The dispatcher running the actors
     * @param config Tuning for the processor variant
     * @return A parallel runner
     */
    public ParallelRunner runner(Dispatcher dispatcher, RingConfig config) {
        return new ParallelRunner(dispatcher, factory(dispatcher, config));
    }

    public String displayName() {
        return displayName;
    }
}
