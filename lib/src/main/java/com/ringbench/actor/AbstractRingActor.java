package com.ringbench.actor;

import com.ringbench.RingException;
import com.ringbench.channel.RendezvousChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Token handling shared by both actor styles: count, decide between forwarding and
 * reporting, and give the actor's name on the finish channel.
 */
public abstract class AbstractRingActor implements RingActor {

    private static final Logger logger = LoggerFactory.getLogger(AbstractRingActor.class);

    private static final Runnable NO_OP = () -> { };

    protected final int name;
    private final RendezvousChannel<Integer> finish;
    private long received;
    private volatile boolean finished = false;
    private volatile boolean closed = false;

    protected AbstractRingActor(int name, RendezvousChannel<Integer> finish) {
        this.name = name;
        this.finish = Objects.requireNonNull(finish, "finish");
    }

    /**
     * Records a received token.
     *
     * @param token The token
     * @return true if the token must be forwarded (as {@code token - 1}), false if the
     *         actor has just reported
     * @throws RingException if the actor already finished or was closed
     */
    protected final boolean accept(int token) {
        if (finished || closed) {
            throw new RingException("Actor " + name + " received token " + token
                    + " after " + (closed ? "being closed" : "reporting"), name);
        }
        received++;
        if (token != 0) {
            return true;
        }
        finished = true;
        logger.debug("Actor {} observed token 0, reporting", name);
        finish.give(name, NO_OP);
        return false;
    }

    /**
     * Fails if the actor was closed; called by actors on resumption.
     */
    protected final void ensureOpen() {
        if (closed) {
            throw new RingException("Actor " + name + " resumed after being closed", name);
        }
    }

    @Override
    public int name() {
        return name;
    }

    @Override
    public boolean isFinished() {
        return finished;
    }

    @Override
    public long received() {
        return received;
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
