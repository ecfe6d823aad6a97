package com.ringbench.config;

import com.ringbench.dispatcher.MailboxType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class RingConfigTest {

    @Test
    void testDefaults() {
        RingConfig config = new RingConfig();
        assertEquals(RingConfig.DispatcherType.WORK_STEALING, config.getDispatcherType());
        assertEquals(Runtime.getRuntime().availableProcessors(), config.getParallelism());
        assertEquals(64, config.getThroughput());
        assertEquals(MailboxType.MPSC, config.getMailboxType());
        assertEquals(10, config.getQuiesceRounds());
        assertEquals(Duration.ofMillis(50), config.getQuiescePause());
    }

    @Test
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty("ringbench.dispatcher", "fixed");
        properties.setProperty("ringbench.parallelism", " 3 ");
        properties.setProperty("ringbench.throughput", "16");
        properties.setProperty("ringbench.mailbox", "cbq");
        properties.setProperty("ringbench.quiesce.rounds", "0");
        properties.setProperty("ringbench.quiesce.pauseMillis", "5");

        RingConfig config = RingConfig.fromProperties(properties);

        assertEquals(RingConfig.DispatcherType.FIXED, config.getDispatcherType());
        assertEquals(3, config.getParallelism());
        assertEquals(16, config.getThroughput());
        assertEquals(MailboxType.CBQ, config.getMailboxType());
        assertEquals(0, config.quiescence().getRounds());
        assertEquals(Duration.ofMillis(5), config.quiescence().getPause());
    }

    @Test
    void testMissingPropertiesKeepDefaults() {
        RingConfig config = RingConfig.fromProperties(new Properties());
        assertEquals(RingConfig.DEFAULT_THROUGHPUT, config.getThroughput());
        assertEquals(RingConfig.DEFAULT_MAILBOX_TYPE, config.getMailboxType());
    }

    @Test
    void testInvalidNumberRejected() {
        Properties properties = new Properties();
        properties.setProperty("ringbench.parallelism", "many");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> RingConfig.fromProperties(properties));
        assertTrue(e.getMessage().contains("ringbench.parallelism"));
    }

    @Test
    void testUnknownEnumRejected() {
        Properties properties = new Properties();
        properties.setProperty("ringbench.dispatcher", "virtual");
        assertThrows(IllegalArgumentException.class, () -> RingConfig.fromProperties(properties));
    }

    @Test
    void testSettersValidate() {
        RingConfig config = new RingConfig();
        assertThrows(IllegalArgumentException.class, () -> config.setParallelism(0));
        assertThrows(IllegalArgumentException.class, () -> config.setThroughput(0));
        assertThrows(IllegalArgumentException.class, () -> config.setQuiesceRounds(-1));
        assertSame(config, config.setThroughput(8));
    }
}
