package com.ringbench.measure;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class QuiescenceTest {

    @Test
    void testDefaults() {
        Quiescence quiescence = new Quiescence();
        assertEquals(10, quiescence.getRounds());
        assertEquals(Duration.ofMillis(50), quiescence.getPause());
    }

    @Test
    void testRunsAllRounds() {
        Quiescence quiescence = new Quiescence(2, Duration.ofMillis(1));
        assertTrue(quiescence.quiesce());
    }

    @Test
    void testZeroRoundsIsNoOp() {
        assertTrue(new Quiescence(0, Duration.ofSeconds(10)).quiesce());
    }

    @Test
    void testInterruptStopsEarly() {
        Quiescence quiescence = new Quiescence(3, Duration.ofSeconds(10));
        Thread.currentThread().interrupt();
        try {
            assertFalse(quiescence.quiesce());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testNegativeRoundsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Quiescence(-1, Duration.ZERO));
    }
}
