package com.ringbench.dispatcher;

/**
 * Defines the queue backing a {@link DispatcherMailbox}.
 *
 * <ul>
 *   <li>{@link #CBQ} - ConcurrentLinkedQueue (non-blocking, linked nodes)</li>
 *   <li>{@link #MPSC} - JCTools MpscUnboundedArrayQueue (lock-free, chunked array)</li>
 * </ul>
 */
public enum MailboxType {
    /**
     * Unbounded ConcurrentLinkedQueue. Safe for any number of producers and consumers.
     */
    CBQ,

    /**
     * Unbounded JCTools multi-producer single-consumer queue.
     * Relies on the runner being the only consumer, which coalesced scheduling guarantees.
     */
    MPSC
}
