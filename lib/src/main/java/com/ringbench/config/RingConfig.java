package com.ringbench.config;

import com.ringbench.dispatcher.MailboxType;
import com.ringbench.measure.Quiescence;

import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * Configuration of a benchmark session: the dispatcher, the processor-style actors and
 * the quiescence between runs.
 * <p>
 * Defaults can be overridden from system properties with {@link #fromSystemProperties()}:
 * <ul>
 *   <li>{@code ringbench.dispatcher}: {@code work_stealing} or {@code fixed}</li>
 *   <li>{@code ringbench.parallelism}: number of worker threads</li>
 *   <li>{@code ringbench.throughput}: messages a processor actor handles per activation</li>
 *   <li>{@code ringbench.mailbox}: {@code cbq} or {@code mpsc}</li>
 *   <li>{@code ringbench.quiesce.rounds}: collection rounds between runs</li>
 *   <li>{@code ringbench.quiesce.pauseMillis}: pause after each collection</li>
 * </ul>
 */
public class RingConfig {
    public static final DispatcherType DEFAULT_DISPATCHER_TYPE = DispatcherType.WORK_STEALING;
    public static final int DEFAULT_THROUGHPUT = 64;
    public static final MailboxType DEFAULT_MAILBOX_TYPE = MailboxType.MPSC;

    public static final String DISPATCHER_PROPERTY = "ringbench.dispatcher";
    public static final String PARALLELISM_PROPERTY = "ringbench.parallelism";
    public static final String THROUGHPUT_PROPERTY = "ringbench.throughput";
    public static final String MAILBOX_PROPERTY = "ringbench.mailbox";
    public static final String QUIESCE_ROUNDS_PROPERTY = "ringbench.quiesce.rounds";
    public static final String QUIESCE_PAUSE_PROPERTY = "ringbench.quiesce.pauseMillis";

    /**
     * The kinds of worker pool a dispatcher can use.
     */
    public enum DispatcherType {
        /** ForkJoinPool in FIFO mode. */
        WORK_STEALING,

        /** Fixed pool of platform threads sharing one queue. */
        FIXED
    }

    private DispatcherType dispatcherType = DEFAULT_DISPATCHER_TYPE;
    private int parallelism = Runtime.getRuntime().availableProcessors();
    private int throughput = DEFAULT_THROUGHPUT;
    private MailboxType mailboxType = DEFAULT_MAILBOX_TYPE;
    private int quiesceRounds = Quiescence.DEFAULT_ROUNDS;
    private Duration quiescePause = Quiescence.DEFAULT_PAUSE;

    /**
     * Reads the configuration from the JVM's system properties.
     *
     * @return a configuration with the defaults overridden by any property set
     */
    public static RingConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads the configuration from a property set.
     *
     * @param properties the properties to read
     * @return a configuration with the defaults overridden by any property set
     * @throws IllegalArgumentException if a property has an invalid value
     */
    public static RingConfig fromProperties(Properties properties) {
        RingConfig config = new RingConfig();
        String dispatcher = properties.getProperty(DISPATCHER_PROPERTY);
        if (dispatcher != null) {
            config.setDispatcherType(DispatcherType.valueOf(dispatcher.trim().toUpperCase(Locale.ROOT)));
        }
        String parallelism = properties.getProperty(PARALLELISM_PROPERTY);
        if (parallelism != null) {
            config.setParallelism(parseInt(PARALLELISM_PROPERTY, parallelism));
        }
        String throughput = properties.getProperty(THROUGHPUT_PROPERTY);
        if (throughput != null) {
            config.setThroughput(parseInt(THROUGHPUT_PROPERTY, throughput));
        }
        String mailbox = properties.getProperty(MAILBOX_PROPERTY);
        if (mailbox != null) {
            config.setMailboxType(MailboxType.valueOf(mailbox.trim().toUpperCase(Locale.ROOT)));
        }
        String rounds = properties.getProperty(QUIESCE_ROUNDS_PROPERTY);
        if (rounds != null) {
            config.setQuiesceRounds(parseInt(QUIESCE_ROUNDS_PROPERTY, rounds));
        }
        String pause = properties.getProperty(QUIESCE_PAUSE_PROPERTY);
        if (pause != null) {
            config.setQuiescePause(Duration.ofMillis(parseInt(QUIESCE_PAUSE_PROPERTY, pause)));
        }
        return config;
    }

    private static int parseInt(String property, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + property + ": " + value, e);
        }
    }

    /**
     * Sets the kind of worker pool.
     *
     * @param dispatcherType the pool kind
     * @return this RingConfig instance
     */
    public RingConfig setDispatcherType(DispatcherType dispatcherType) {
        this.dispatcherType = dispatcherType;
        return this;
    }

    /**
     * Sets the number of worker threads.
     *
     * @param parallelism the worker count, at least 1
     * @return this RingConfig instance
     */
    public RingConfig setParallelism(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1, got: " + parallelism);
        }
        this.parallelism = parallelism;
        return this;
    }

    /**
     * Sets how many messages a processor actor handles per activation.
     *
     * @param throughput the batch size, at least 1
     * @return this RingConfig instance
     */
    public RingConfig setThroughput(int throughput) {
        if (throughput < 1) {
            throw new IllegalArgumentException("Throughput must be at least 1, got: " + throughput);
        }
        this.throughput = throughput;
        return this;
    }

    /**
     * Sets the queue behind processor actors' mailboxes.
     *
     * @param mailboxType the queue type
     * @return this RingConfig instance
     */
    public RingConfig setMailboxType(MailboxType mailboxType) {
        this.mailboxType = mailboxType;
        return this;
    }

    /**
     * Sets the number of collection rounds between runs.
     *
     * @param quiesceRounds the round count, 0 to disable
     * @return this RingConfig instance
     */
    public RingConfig setQuiesceRounds(int quiesceRounds) {
        if (quiesceRounds < 0) {
            throw new IllegalArgumentException("Quiesce rounds must not be negative, got: " + quiesceRounds);
        }
        this.quiesceRounds = quiesceRounds;
        return this;
    }

    /**
     * Sets the pause after each collection round.
     *
     * @param quiescePause the pause
     * @return this RingConfig instance
     */
    public RingConfig setQuiescePause(Duration quiescePause) {
        this.quiescePause = quiescePause;
        return this;
    }

    public DispatcherType getDispatcherType() {
        return dispatcherType;
    }

    public int getParallelism() {
        return parallelism;
    }

    public int getThroughput() {
        return throughput;
    }

    public MailboxType getMailboxType() {
        return mailboxType;
    }

    public int getQuiesceRounds() {
        return quiesceRounds;
    }

    public Duration getQuiescePause() {
        return quiescePause;
    }

    /**
     * Creates the quiescence step described by this configuration.
     *
     * @return a Quiescence
     */
    public Quiescence quiescence() {
        return new Quiescence(quiesceRounds, quiescePause);
    }
}
