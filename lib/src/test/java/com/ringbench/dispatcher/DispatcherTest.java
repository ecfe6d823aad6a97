package com.ringbench.dispatcher;

import com.ringbench.config.RingConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Dispatcher.
 */
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class DispatcherTest {

    private Dispatcher dispatcher;

    @AfterEach
    void cleanup() {
        if (dispatcher != null && !dispatcher.isShutdown()) {
            dispatcher.shutdown();
            dispatcher.awaitTermination(2, TimeUnit.SECONDS);
        }
    }

    @Test
    void testCreateWorkStealingDispatcher() {
        dispatcher = Dispatcher.workStealingDispatcher(3, "ws");
        assertNotNull(dispatcher);
        assertEquals("ws", dispatcher.getName());
        assertEquals(3, dispatcher.getParallelism());
        assertFalse(dispatcher.isShutdown());
    }

    @Test
    void testCreateFixedThreadPoolDispatcher() {
        dispatcher = Dispatcher.fixedThreadPoolDispatcher(2);
        assertEquals("dispatcher", dispatcher.getName());
        assertEquals(2, dispatcher.getParallelism());
    }

    @Test
    void testParallelismIsAtLeastOne() {
        dispatcher = Dispatcher.workStealingDispatcher(0, "tiny");
        assertEquals(1, dispatcher.getParallelism());
    }

    @Test
    void testCreateFromConfig() {
        dispatcher = Dispatcher.create(new RingConfig()
                .setDispatcherType(RingConfig.DispatcherType.FIXED)
                .setParallelism(2));
        assertEquals("ring", dispatcher.getName());
        assertEquals(2, dispatcher.getParallelism());
    }

    @Test
    void testScheduleTask() throws InterruptedException {
        dispatcher = Dispatcher.workStealingDispatcher(2, "ws");
        CountDownLatch latch = new CountDownLatch(1);
        AtomicInteger counter = new AtomicInteger(0);

        dispatcher.schedule(() -> {
            counter.incrementAndGet();
            latch.countDown();
        });

        assertTrue(latch.await(1, TimeUnit.SECONDS));
        assertEquals(1, counter.get());
    }

    @Test
    void testWorkerThreadsAreNamedAfterDispatcher() throws InterruptedException {
        dispatcher = Dispatcher.fixedThreadPoolDispatcher(2, "named");
        Set<String> names = ConcurrentHashMap.newKeySet();
        CountDownLatch latch = new CountDownLatch(10);

        for (int i = 0; i < 10; i++) {
            dispatcher.schedule(() -> {
                names.add(Thread.currentThread().getName());
                latch.countDown();
            });
        }

        assertTrue(latch.await(1, TimeUnit.SECONDS));
        assertFalse(names.isEmpty());
        assertTrue(names.stream().allMatch(name -> name.startsWith("named-")));
    }

    @Test
    void testResumeDeliversValueOnWorker() throws InterruptedException {
        dispatcher = Dispatcher.workStealingDispatcher(2, "resume");
        AtomicReference<String> value = new AtomicReference<>();
        AtomicReference<String> thread = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);

        dispatcher.resume(v -> {
            value.set(v);
            thread.set(Thread.currentThread().getName());
            latch.countDown();
        }, "hello");

        assertTrue(latch.await(1, TimeUnit.SECONDS));
        assertEquals("hello", value.get());
        assertTrue(thread.get().startsWith("resume-"));
    }

    @Test
    void testShutdown() {
        dispatcher = Dispatcher.workStealingDispatcher(2, "ws");
        dispatcher.shutdown();
        assertTrue(dispatcher.isShutdown());
        assertTrue(dispatcher.awaitTermination(1, TimeUnit.SECONDS));
    }

    @Test
    void testScheduleAfterShutdownThrows() {
        dispatcher = Dispatcher.workStealingDispatcher(2, "ws");
        dispatcher.shutdown();
        assertThrows(SchedulingException.class, () -> dispatcher.schedule(() -> { }));
    }

    @Test
    void testFailingTaskIsReportedToGuard() {
        dispatcher = Dispatcher.workStealingDispatcher(2, "ws");
        try (RunGuard guard = dispatcher.guard()) {
            dispatcher.schedule(() -> {
                throw new IllegalStateException("boom");
            });
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
            while (!guard.isAborted() && System.nanoTime() < deadline) {
                Thread.onSpinWait();
            }
            assertTrue(guard.isAborted());
        }
    }

    @Test
    void testFailingTaskDoesNotKillWorker() throws InterruptedException {
        dispatcher = Dispatcher.fixedThreadPoolDispatcher(1, "single");
        CountDownLatch latch = new CountDownLatch(1);

        dispatcher.schedule(() -> {
            throw new IllegalStateException("boom");
        });
        dispatcher.schedule(latch::countDown);

        assertTrue(latch.await(1, TimeUnit.SECONDS));
    }
}
