package com.ringbench.channel;

import com.ringbench.Continuation;
import com.ringbench.dispatcher.Dispatcher;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Synchronous channel: a give and a take complete together, and no value is ever
 * buffered.
 * <p>
 * Parked givers and parked takers each wait in arrival order, and a newcomer is matched
 * with the oldest party waiting on the other side. Surplus givers or takers therefore
 * just wait their turn. At any time at most one of the two queues is non-empty.
 *
 * @param <T> The type of values carried
 */
public final class RendezvousChannel<T> implements Channel<T> {

    private final Dispatcher dispatcher;
    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<PendingGive<T>> givers = new ArrayDeque<>();
    private final ArrayDeque<Continuation<? super T>> takers = new ArrayDeque<>();

    public RendezvousChannel(Dispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    @Override
    public T tryTake(Continuation<? super T> taker) {
        Objects.requireNonNull(taker, "taker");
        PendingGive<T> giver;
        lock.lock();
        try {
            giver = givers.poll();
            if (giver == null) {
                takers.add(taker);
                return null;
            }
        } finally {
            lock.unlock();
        }
        dispatcher.schedule(giver.onTaken());
        return giver.value();
    }

    /**
     * Gives a value to the oldest parked taker, or parks the giver until a taker comes.
     *
     * @param value The value to give
     * @param onTaken Run on the dispatcher once a taker took the value, only if this call
     *                returns false
     * @return true if a taker was waiting and received the value
     */
    public boolean give(T value, Runnable onTaken) {
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(onTaken, "onTaken");
        Continuation<? super T> taker;
        lock.lock();
        try {
            taker = takers.poll();
            if (taker == null) {
                givers.add(new PendingGive<>(value, onTaken));
                return false;
            }
        } finally {
            lock.unlock();
        }
        dispatcher.resume(taker, value);
        return true;
    }

    @Override
    public boolean tryTransfer(T value, Runnable onTransferred) {
        return give(value, onTransferred);
    }

    @Override
    public boolean isSynchronous() {
        return true;
    }

    @Override
    public Dispatcher dispatcher() {
        return dispatcher;
    }

    /**
     * Returns the number of givers parked until a taker arrives.
     *
     * @return The number of parked givers
     */
    public int pendingGives() {
        lock.lock();
        try {
            return givers.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of takers parked until a giver arrives.
     *
     * @return The number of parked takers
     */
    public int pendingTakes() {
        lock.lock();
        try {
            return takers.size();
        } finally {
            lock.unlock();
        }
    }

    private record PendingGive<T>(T value, Runnable onTaken) {
    }
}
