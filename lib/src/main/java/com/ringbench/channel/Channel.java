package com.ringbench.channel;

import com.ringbench.Continuation;
import com.ringbench.dispatcher.Dispatcher;

import java.util.concurrent.CompletableFuture;

/**
 * Common contract of the message-passing primitives an actor reads from and writes to.
 * <p>
 * Operations come in two layers:
 * <ul>
 *   <li>Continuation layer: {@link #tryTake} and {@link #tryTransfer} complete
 *   immediately when they can and otherwise retain a continuation that the primitive
 *   hands to the dispatcher once the operation completes. Callers loop instead of
 *   recursing, so stack depth stays bounded.</li>
 *   <li>Future layer: {@link #takeAsync()} and {@link #transferAsync(Object)} wrap the
 *   same operations in {@link CompletableFuture}s that always complete on the
 *   dispatcher, never on the caller's stack.</li>
 * </ul>
 * Values may not be null.
 *
 * @param <T> The type of values carried
 */
public interface Channel<T> {

    /**
     * Takes the next value if one is available now; otherwise parks the taker.
     *
     * @param taker Resumed on the dispatcher with the value if this call returns null
     * @return The value, or null if the taker was parked
     */
    T tryTake(Continuation<? super T> taker);

    /**
     * Transfers a value using this primitive's designated operation: give for a
     * rendezvous channel, send for buffered channels and mailboxes.
     *
     * @param value The value to transfer
     * @param onTransferred Run on the dispatcher once the transfer completes, only if this
     *                      call returns false
     * @return true if the transfer completed immediately, false if the caller is parked
     */
    boolean tryTransfer(T value, Runnable onTransferred);

    /**
     * Returns whether a transfer waits until a taker receives the value, as with a
     * rendezvous give.
     *
     * @return true for synchronous handoff, false if transfers never wait
     */
    default boolean isSynchronous() {
        return false;
    }

    /**
     * Returns the dispatcher on which parked parties are resumed.
     *
     * @return The dispatcher
     */
    Dispatcher dispatcher();

    /**
     * Takes the next value as a future.
     *
     * @return A future completed on the dispatcher with the next value
     */
    default CompletableFuture<T> takeAsync() {
        CompletableFuture<T> future = new CompletableFuture<>();
        T value = tryTake(future::complete);
        if (value != null) {
            dispatcher().resume(future::complete, value);
        }
        return future;
    }

    /**
     * Transfers a value and returns a future of its completion.
     *
     * @param value The value to transfer
     * @return A future completed on the dispatcher once the transfer completes
     */
    default CompletableFuture<Void> transferAsync(T value) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        Runnable complete = () -> future.complete(null);
        if (tryTransfer(value, complete)) {
            dispatcher().schedule(complete);
        }
        return future;
    }

    /**
     * Blocks the calling thread until a value is available.
     * Meant for threads outside the dispatcher, such as a runner collecting results.
     *
     * @return The next value
     */
    default T awaitTake() {
        return takeAsync().join();
    }
}
