package com.ringbench.actor;

import com.ringbench.Continuation;
import com.ringbench.channel.Channel;
import com.ringbench.channel.RendezvousChannel;
import com.ringbench.dispatcher.Dispatcher;

import java.util.Objects;

/**
 * Ring actor written as a receive loop over an inbound and an outbound channel.
 * <p>
 * The loop takes from the inbound channel and forwards with the outbound channel's
 * designated transfer. Whenever an operation cannot complete immediately the actor leaves
 * its continuation with the channel and returns, freeing the worker; the channel resumes
 * it on the dispatcher and the loop carries on where it stopped.
 */
public final class ChannelActor extends AbstractRingActor implements Runnable, Continuation<Integer> {

    private final Dispatcher dispatcher;
    private final Channel<Integer> inbound;
    private final Channel<Integer> outbound;
    private final Runnable afterTransfer = this::run;

    /** Token delivered by the inbound channel on resumption, consumed by the loop. */
    private Integer delivered;

    public ChannelActor(int name, Channel<Integer> inbound, Channel<Integer> outbound,
                        RendezvousChannel<Integer> finish) {
        super(name, finish);
        this.inbound = Objects.requireNonNull(inbound, "inbound");
        this.outbound = Objects.requireNonNull(outbound, "outbound");
        this.dispatcher = inbound.dispatcher();
    }

    @Override
    public void start() {
        dispatcher.schedule(this);
    }

    @Override
    public void resume(Integer token) {
        delivered = token;
        run();
    }

    @Override
    public void run() {
        ensureOpen();
        Integer token = delivered;
        delivered = null;
        while (true) {
            if (token == null) {
                token = inbound.tryTake(this);
                if (token == null) {
                    return;
                }
            }
            int value = token;
            token = null;
            if (!accept(value)) {
                return;
            }
            if (!outbound.tryTransfer(value - 1, afterTransfer)) {
                return;
            }
        }
    }

    public Channel<Integer> inbound() {
        return inbound;
    }

    public Channel<Integer> outbound() {
        return outbound;
    }
}
