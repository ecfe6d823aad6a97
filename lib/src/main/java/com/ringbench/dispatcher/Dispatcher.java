package com.ringbench.dispatcher;

import com.ringbench.Continuation;
import com.ringbench.config.RingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Dispatcher multiplexes ring actors and other lightweight tasks onto a small pool of
 * worker threads.
 * <p>
 * A task never blocks a worker: when it has to wait on a primitive it registers a
 * {@link Continuation} and returns, and the primitive hands the continuation back to
 * {@link #resume(Continuation, Object)} once the value is ready. By default the pool is a
 * work-stealing {@link ForkJoinPool} sized to the available processors; a fixed platform
 * thread pool is available as an alternative.
 * <p>
 * Every task is guarded: an exception escaping a task is logged and published to the
 * registered failure listeners (see {@link RunGuard}) instead of being lost on a worker
 * thread.
 */
public final class Dispatcher implements Executor {

    private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);

    private final ExecutorService executor;
    private final String name;
    private final int parallelism;
    private final List<Consumer<Throwable>> failureListeners = new CopyOnWriteArrayList<>();
    private volatile boolean shutdown = false;

    private Dispatcher(ExecutorService executor, String name, int parallelism) {
        this.executor = executor;
        this.name = name;
        this.parallelism = parallelism;
    }

    /**
     * Creates a work-stealing dispatcher with one worker per available processor.
     *
     * @return A new Dispatcher backed by a ForkJoinPool
     */
    public static Dispatcher workStealingDispatcher() {
        return workStealingDispatcher(Runtime.getRuntime().availableProcessors(), "dispatcher");
    }

    /**
     * Creates a work-stealing dispatcher backed by a ForkJoinPool in FIFO (async) mode.
     *
     * @param parallelism The number of worker threads
     * @param name The name prefix for worker threads
     * @return A new Dispatcher backed by a ForkJoinPool
     */
    public static Dispatcher workStealingDispatcher(int parallelism, String name) {
        int poolSize = Math.max(1, parallelism);
        AtomicInteger counter = new AtomicInteger();
        ForkJoinPool.ForkJoinWorkerThreadFactory factory = pool -> {
            ForkJoinWorkerThread thread = ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(pool);
            thread.setName(name + "-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
        ForkJoinPool pool = new ForkJoinPool(poolSize, factory, null, true);
        logger.info("Created work-stealing dispatcher: {} with {} workers", name, poolSize);
        return new Dispatcher(pool, name, poolSize);
    }

    /**
     * Creates a dispatcher backed by a fixed-size platform thread pool.
     *
     * @param threads The number of platform threads in the pool
     * @return A new Dispatcher using platform threads
     */
    public static Dispatcher fixedThreadPoolDispatcher(int threads) {
        return fixedThreadPoolDispatcher(threads, "dispatcher");
    }

    /**
     * Creates a dispatcher backed by a fixed-size platform thread pool with a custom name.
     *
     * @param threads The number of platform threads in the pool
     * @param name The name prefix for threads
     * @return A new Dispatcher using platform threads
     */
    public static Dispatcher fixedThreadPoolDispatcher(int threads, String name) {
        int poolSize = Math.max(1, threads);
        AtomicInteger counter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(name + "-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
        logger.info("Created fixed thread pool dispatcher: {} with {} threads", name, poolSize);
        return new Dispatcher(executor, name, poolSize);
    }

    /**
     * Creates the dispatcher described by a configuration.
     *
     * @param config The configuration to read the dispatcher type and parallelism from
     * @return A new Dispatcher
     */
    public static Dispatcher create(RingConfig config) {
        Objects.requireNonNull(config, "config");
        switch (config.getDispatcherType()) {
            case FIXED:
                return fixedThreadPoolDispatcher(config.getParallelism(), "ring");
            case WORK_STEALING:
                return workStealingDispatcher(config.getParallelism(), "ring");
            default:
                throw new IllegalArgumentException("Unknown dispatcher type: " + config.getDispatcherType());
        }
    }

    /**
     * Schedules a task for execution on one of the workers.
     *
     * @param task The task to run
     * @throws SchedulingException if the dispatcher is shut down or the pool rejects the task
     */
    public void schedule(Runnable task) {
        Objects.requireNonNull(task, "task");
        if (shutdown) {
            throw new SchedulingException("Dispatcher " + name + " is shut down");
        }
        try {
            executor.execute(() -> runGuarded(task));
        } catch (RejectedExecutionException e) {
            throw new SchedulingException("Dispatcher " + name + " rejected a task", e);
        }
    }

    /**
     * Resumes a suspended continuation with its value on one of the workers.
     *
     * @param continuation The continuation to resume
     * @param value The value to deliver
     * @param <T> The value type
     */
    public <T> void resume(Continuation<? super T> continuation, T value) {
        schedule(() -> continuation.resume(value));
    }

    @Override
    public void execute(Runnable command) {
        schedule(command);
    }

    private void runGuarded(Runnable task) {
        try {
            task.run();
        } catch (Throwable t) {
            reportFailure(t);
        }
    }

    /**
     * Publishes a failure raised by a task to all registered listeners.
     *
     * @param failure The failure
     */
    public void reportFailure(Throwable failure) {
        logger.error("Task failed on dispatcher {}", name, failure);
        for (Consumer<Throwable> listener : failureListeners) {
            listener.accept(failure);
        }
    }

    /**
     * Opens a guard that observes failures reported while a run is in flight.
     *
     * @return A new RunGuard, to be closed when the run is over
     */
    public RunGuard guard() {
        return new RunGuard(this);
    }

    void addFailureListener(Consumer<Throwable> listener) {
        failureListeners.add(listener);
    }

    void removeFailureListener(Consumer<Throwable> listener) {
        failureListeners.remove(listener);
    }

    /**
     * Initiates shutdown of the dispatcher.
     * No new tasks will be accepted after this call.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        logger.info("Shutting down dispatcher: {}", name);
        executor.shutdown();
    }

    /**
     * Waits for the workers to finish after a shutdown.
     *
     * @param timeout The maximum time to wait
     * @param unit The time unit of the timeout
     * @return true if all tasks terminated, false if timeout elapsed
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) {
        try {
            return executor.awaitTermination(timeout, unit);
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for dispatcher {} termination", name);
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the number of worker threads.
     *
     * @return The worker count
     */
    public int getParallelism() {
        return parallelism;
    }
}
