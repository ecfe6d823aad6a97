package com.ringbench.channel;

import com.ringbench.Continuation;
import com.ringbench.dispatcher.Dispatcher;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Asynchronous channel with an unbounded FIFO buffer.
 * <p>
 * {@link #send(Object)} never waits for a receiver, so a fast sender can run arbitrarily
 * far ahead of a slow taker. Takers park in arrival order while the buffer is empty.
 * The buffer and the taker queue are never both non-empty.
 *
 * @param <T> The type of values carried
 */
public final class BufferedChannel<T> implements Channel<T> {

    private final Dispatcher dispatcher;
    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<T> buffer = new ArrayDeque<>();
    private final ArrayDeque<Continuation<? super T>> takers = new ArrayDeque<>();

    public BufferedChannel(Dispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    /**
     * Hands the value to the oldest parked taker, or appends it to the buffer.
     *
     * @param value The value to send
     */
    public void send(T value) {
        Objects.requireNonNull(value, "value cannot be null");
        Continuation<? super T> taker;
        lock.lock();
        try {
            taker = takers.poll();
            if (taker == null) {
                buffer.add(value);
                return;
            }
        } finally {
            lock.unlock();
        }
        dispatcher.resume(taker, value);
    }

    @Override
    public T tryTake(Continuation<? super T> taker) {
        Objects.requireNonNull(taker, "taker");
        lock.lock();
        try {
            T value = buffer.poll();
            if (value == null) {
                takers.add(taker);
            }
            return value;
        } finally {
            lock.unlock();
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

    /**
     * Returns the number of buffered values.
     *
     * @return The buffer depth
     */
    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of parked takers.
     *
     * @return The number of takers waiting for a value
     */
    public int pendingTakes() {
        lock.lock();
        try {
            return takers.size();
        } finally {
            lock.unlock();
        }
    }
}
