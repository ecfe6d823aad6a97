package com.ringbench.dispatcher;

import org.jctools.queues.MpscUnboundedArrayQueue;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DispatcherMailbox is the unbounded message queue of a callback-style actor and
 * implements the coalesced scheduling pattern.
 * <p>
 * Enqueuing never blocks. The actor's runner is scheduled only when the mailbox goes
 * from "not scheduled" to "scheduled", so at most one runner drains the queue at a time.
 *
 * @param <T> The type of messages in the mailbox
 */
public final class DispatcherMailbox<T> {

    private static final int MPSC_CHUNK_SIZE = 128;

    private final Queue<T> queue;
    private final MailboxType mailboxType;
    private final AtomicBoolean scheduled = new AtomicBoolean(false);
    private final Runnable scheduleAction;
    private final String actorId;
    private volatile boolean closed = false;

    /**
     * Creates a dispatcher mailbox.
     *
     * @param mailboxType The queue implementation to use
     * @param scheduleAction The action to invoke when scheduling the actor
     * @param actorId The actor ID for error messages
     */
    public DispatcherMailbox(MailboxType mailboxType, Runnable scheduleAction, String actorId) {
        this.mailboxType = Objects.requireNonNull(mailboxType, "mailboxType");
        this.scheduleAction = Objects.requireNonNull(scheduleAction, "scheduleAction");
        this.actorId = actorId;
        this.queue = mailboxType == MailboxType.MPSC
                ? new MpscUnboundedArrayQueue<>(MPSC_CHUNK_SIZE)
                : new ConcurrentLinkedQueue<>();
    }

    /**
     * Enqueues a message and schedules the actor if it is not already scheduled.
     *
     * @param message The message to enqueue
     * @throws IllegalStateException if the mailbox was closed
     */
    public void enqueue(T message) {
        Objects.requireNonNull(message, "message cannot be null");
        if (closed) {
            throw new IllegalStateException("Mailbox of actor " + actorId + " is closed");
        }
        queue.offer(message);

        // Coalesced scheduling: only schedule if transitioning from not-scheduled to scheduled
        if (scheduled.compareAndSet(false, true)) {
            try {
                scheduleAction.run();
            } catch (RuntimeException e) {
                scheduled.set(false);
                throw e;
            }
        }
    }

    /**
     * Polls a message from the mailbox (consumer side).
     *
     * @return The next message, or null if empty
     */
    public T poll() {
        return queue.poll();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    /**
     * Gets the approximate size of the mailbox.
     *
     * @return The approximate number of messages
     */
    public int size() {
        return queue.size();
    }

    /**
     * Attempts to clear the scheduled flag after processing a batch.
     *
     * @return true if cleared, false if already false
     */
    public boolean tryClearScheduled() {
        return scheduled.compareAndSet(true, false);
    }

    /**
     * Attempts to set the scheduled flag so the caller may re-schedule the runner.
     *
     * @return true if this caller won the right to schedule
     */
    public boolean trySetScheduled() {
        return scheduled.compareAndSet(false, true);
    }

    public boolean isScheduled() {
        return scheduled.get();
    }

    /**
     * Rejects further messages. Messages still queued are never delivered; the queue is
     * left to its single consumer, which stops polling once it sees the mailbox closed.
     */
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public MailboxType getMailboxType() {
        return mailboxType;
    }
}
