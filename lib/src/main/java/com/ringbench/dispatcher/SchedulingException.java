package com.ringbench.dispatcher;

import com.ringbench.RingException;

/**
 * Thrown when the dispatcher cannot accept a task, either because it was shut down or
 * because the pool ran out of capacity. Fatal for the run that triggered it.
 */
public class SchedulingException extends RingException {

    public SchedulingException(String message) {
        super(message);
    }

    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
