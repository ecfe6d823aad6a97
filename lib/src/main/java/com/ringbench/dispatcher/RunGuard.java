package com.ringbench.dispatcher;

import com.ringbench.RingException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * Watches a dispatcher for task failures while a run is in flight, and lets a thread
 * outside the dispatcher wait for the run's result.
 * <p>
 * The guard is registered when it is opened, so failures of tasks scheduled afterwards
 * are never missed. Waiting through {@link #await(CompletableFuture)} returns the result,
 * or throws {@link RingException} as soon as any task fails.
 *
 * <pre>{@code
 * try (RunGuard guard = dispatcher.guard()) {
 *     CompletableFuture<Long> sum = readerWriter.run(1000);
 *     return guard.await(sum);
 * }
 * }</pre>
 */
public final class RunGuard implements AutoCloseable {

    private final Dispatcher dispatcher;
    private final CompletableFuture<Void> aborted = new CompletableFuture<>();
    private final Consumer<Throwable> listener = aborted::completeExceptionally;

    RunGuard(Dispatcher dispatcher) {
        this.dispatcher = dispatcher;
        dispatcher.addFailureListener(listener);
    }

    /**
     * Blocks until the future completes or a dispatcher task fails.
     *
     * @param future The result to wait for
     * @param <T> The result type
     * @return The result
     * @throws RingException if the future failed, any dispatcher task failed meanwhile, or
     *         the waiting thread was interrupted
     */
    public <T> T await(CompletableFuture<T> future) {
        try {
            CompletableFuture.anyOf(future, aborted).get();
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RingException("Interrupted while waiting for the run", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RingException) {
                throw (RingException) cause;
            }
            throw new RingException("Run aborted: " + cause, cause);
        }
    }

    /**
     * Returns whether a task failure has been observed.
     *
     * @return true once any task failed while the guard was open
     */
    public boolean isAborted() {
        return aborted.isCompletedExceptionally();
    }

    @Override
    public void close() {
        dispatcher.removeFailureListener(listener);
    }
}
