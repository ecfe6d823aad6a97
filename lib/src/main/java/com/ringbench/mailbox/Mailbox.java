package com.ringbench.mailbox;

import com.ringbench.Continuation;
import com.ringbench.channel.Channel;
import com.ringbench.dispatcher.Dispatcher;
import org.jctools.queues.MpscUnboundedArrayQueue;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Unbounded asynchronous inbox owned by a single actor.
 * <p>
 * Built on a JCTools MPSC (Multi-Producer Single-Consumer) queue:
 * <ul>
 *   <li>Any number of senders; {@link #send(Object)} is lock-free and never waits</li>
 *   <li>Exactly one consumer, the owning actor; messages are taken in FIFO order</li>
 *   <li>A parked consumer is woken by scheduling a re-take on the dispatcher, so the
 *   queue is only ever polled by one task at a time</li>
 * </ul>
 * A second consumer parking while the first is still waiting is a wiring error and is
 * rejected with {@link IllegalStateException}.
 *
 * @param <T> The type of messages
 */
public final class Mailbox<T> implements Channel<T> {

    private static final int DEFAULT_CHUNK_SIZE = 128;

    private final Dispatcher dispatcher;
    private final MpscUnboundedArrayQueue<T> queue;
    private final AtomicReference<Continuation<? super T>> waitingConsumer = new AtomicReference<>();

    /**
     * Creates a mailbox with the default chunk size (128).
     *
     * @param dispatcher The dispatcher on which a parked consumer is resumed
     */
    public Mailbox(Dispatcher dispatcher) {
        this(dispatcher, DEFAULT_CHUNK_SIZE);
    }

    /**
     * Creates a mailbox with the specified chunk size.
     * The mailbox is unbounded; the chunk size only sets the allocation granularity.
     *
     * @param dispatcher The dispatcher on which a parked consumer is resumed
     * @param chunkSize The chunk size (rounded up to a power of 2, at least 2)
     */
    public Mailbox(Dispatcher dispatcher, int chunkSize) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        // JCTools requires a power of 2 of at least 2
        this.queue = new MpscUnboundedArrayQueue<>(nextPowerOfTwo(Math.max(2, chunkSize)));
    }

    /**
     * Enqueues a message and wakes the owner if it is parked.
     *
     * @param message The message to send
     */
    public void send(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        queue.offer(message);
        // Check the slot first to stay off the atomic swap on the hot path
        if (waitingConsumer.get() != null) {
            Continuation<? super T> consumer = waitingConsumer.getAndSet(null);
            if (consumer != null) {
                dispatcher.schedule(() -> retake(consumer));
            }
        }
    }

    @Override
    public T tryTake(Continuation<? super T> consumer) {
        Objects.requireNonNull(consumer, "consumer");
        T message = queue.poll();
        if (message != null) {
            return message;
        }
        if (!waitingConsumer.compareAndSet(null, consumer)) {
            throw new IllegalStateException("Mailbox already has a parked consumer");
        }
        // A send may have slipped in before the consumer was published
        if (!queue.isEmpty() && waitingConsumer.compareAndSet(consumer, null)) {
            return queue.poll();
        }
        return null;
    }

    private void retake(Continuation<? super T> consumer) {
        T message = tryTake(consumer);
        if (message != null) {
            consumer.resume(message);
        }
    }

    @Override
    public boolean tryTransfer(T value, Runnable onTransferred) {
        send(value);
        return true;
    }

    @Override
    public Dispatcher dispatcher() {
        return dispatcher;
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    /**
     * Returns whether the owner is parked waiting for a message.
     *
     * @return true if a consumer is parked
     */
    public boolean hasWaitingConsumer() {
        return waitingConsumer.get() != null;
    }

    private static int nextPowerOfTwo(int value) {
        if ((value & (value - 1)) == 0) {
            return value;
        }
        return Integer.highestOneBit(value) << 1;
    }
}
