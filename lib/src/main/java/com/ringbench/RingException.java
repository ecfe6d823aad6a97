package com.ringbench;

/**
 * Exception thrown when a benchmark run cannot complete correctly.
 * Covers aborted runs and violations of the ring protocol by an actor.
 * Runs are never retried: the exception surfaces to whoever started the run.
 */
public class RingException extends RuntimeException {

    /** The name of the actor where the exception occurred, or -1 if not actor-specific. */
    private final int actorName;

    /**
     * Creates a new RingException with the specified detail message.
     *
     * @param message the detail message
     */
    public RingException(String message) {
        super(message);
        this.actorName = -1;
    }

    /**
     * Creates a new RingException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     */
    public RingException(String message, Throwable cause) {
        super(message, cause);
        this.actorName = -1;
    }

    /**
     * Creates a new RingException raised by a specific ring actor.
     *
     * @param message the detail message
     * @param actorName the 1-based position of the actor in its ring
     */
    public RingException(String message, int actorName) {
        super(message);
        this.actorName = actorName;
    }

    /**
     * Returns the name of the actor where the exception occurred.
     *
     * @return the actor name, or -1 if not specified
     */
    public int getActorName() {
        return actorName;
    }
}
