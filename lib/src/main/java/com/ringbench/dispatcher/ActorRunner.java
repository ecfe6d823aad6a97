package com.ringbench.dispatcher;

import com.ringbench.actor.ActorLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * ActorRunner processes messages from a DispatcherMailbox in batches.
 * <p>
 * It handles at most {@code throughput} messages per activation, then clears the
 * mailbox's scheduled flag and re-schedules itself if messages arrived meanwhile.
 * Errors raised by the actor are routed to its exception handler.
 *
 * @param <T> The type of messages to process
 */
public final class ActorRunner<T> implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(ActorRunner.class);

    private final String actorId;
    private final DispatcherMailbox<T> mailbox;
    private final ActorLifecycle<T> lifecycle;
    private final BiConsumer<T, Throwable> exceptionHandler;
    private final Dispatcher dispatcher;
    private final int throughput;

    /**
     * Creates an ActorRunner.
     *
     * @param actorId The ID of the actor for logging
     * @param mailbox The dispatcher mailbox to process messages from
     * @param lifecycle The actor lifecycle callbacks
     * @param exceptionHandler Handler for message processing errors
     * @param dispatcher The dispatcher for re-scheduling
     * @param throughput Maximum number of messages to process per activation
     */
    public ActorRunner(
            String actorId,
            DispatcherMailbox<T> mailbox,
            ActorLifecycle<T> lifecycle,
            BiConsumer<T, Throwable> exceptionHandler,
            Dispatcher dispatcher,
            int throughput) {
        this.actorId = Objects.requireNonNull(actorId, "actorId");
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.exceptionHandler = Objects.requireNonNull(exceptionHandler, "exceptionHandler");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.throughput = Math.max(1, throughput);
    }

    @Override
    public void run() {
        try {
            int processed = 0;
            T msg;
            while (processed < throughput && !mailbox.isClosed() && (msg = mailbox.poll()) != null) {
                processed++;
                try {
                    lifecycle.receive(msg);
                } catch (Throwable t) {
                    exceptionHandler.accept(msg, t);
                }
            }
            if (processed > 0) {
                logger.trace("Actor {} processed {} messages", actorId, processed);
            }
        } finally {
            // A message may have arrived after the last poll but before the flag is cleared
            if (mailbox.tryClearScheduled() && !mailbox.isEmpty() && !mailbox.isClosed()
                    && mailbox.trySetScheduled()) {
                dispatcher.schedule(this);
            }
        }
    }

    public int getThroughput() {
        return throughput;
    }

    public String getActorId() {
        return actorId;
    }
}
