package com.ringbench.actor;

import com.ringbench.channel.RendezvousChannel;
import com.ringbench.dispatcher.ActorRunner;
import com.ringbench.dispatcher.Dispatcher;
import com.ringbench.dispatcher.DispatcherMailbox;
import com.ringbench.dispatcher.MailboxType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Ring actor written as a message processor: tokens are posted with {@link #tell(int)},
 * queued in a {@link DispatcherMailbox} and handed one by one to {@link #receive(Integer)}
 * by an {@link ActorRunner}. The actor never waits; reporting does not wait for the
 * finish channel's taker either.
 */
public final class ProcessorActor extends AbstractRingActor implements ActorLifecycle<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(ProcessorActor.class);

    private final Dispatcher dispatcher;
    private final DispatcherMailbox<Integer> mailbox;
    private final ActorRunner<Integer> runner;
    private ProcessorActor next;

    public ProcessorActor(int name, RendezvousChannel<Integer> finish, Dispatcher dispatcher,
                          MailboxType mailboxType, int throughput) {
        super(name, finish);
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        String actorId = "ring-actor-" + name;
        this.mailbox = new DispatcherMailbox<>(mailboxType, this::schedule, actorId);
        this.runner = new ActorRunner<>(actorId, mailbox, this,
                (token, error) -> dispatcher.reportFailure(error), dispatcher, throughput);
    }

    private void schedule() {
        dispatcher.schedule(runner);
    }

    /**
     * Sets the actor that receives this actor's forwarded tokens.
     *
     * @param next The next actor in the ring
     */
    public void setNext(ProcessorActor next) {
        this.next = Objects.requireNonNull(next, "next");
    }

    /**
     * Posts a token to this actor without waiting.
     *
     * @param token The token
     */
    public void tell(int token) {
        mailbox.enqueue(token);
    }

    @Override
    public void start() {
        if (next == null) {
            throw new IllegalStateException("Actor " + name + " has no successor");
        }
        preStart();
    }

    @Override
    public void preStart() {
        logger.trace("Actor {} started", name);
    }

    @Override
    public void receive(Integer token) {
        if (accept(token)) {
            next.tell(token - 1);
        }
    }

    @Override
    public void postStop() {
        logger.trace("Actor {} stopped after {} tokens", name, received());
    }

    @Override
    public void close() {
        if (isClosed()) {
            return;
        }
        super.close();
        mailbox.close();
        postStop();
    }

    public int pendingMessages() {
        return mailbox.size();
    }
}
