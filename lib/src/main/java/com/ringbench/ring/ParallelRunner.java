package com.ringbench.ring;

import com.ringbench.channel.RendezvousChannel;
import com.ringbench.dispatcher.Dispatcher;
import com.ringbench.dispatcher.RunGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Runs P independent rings at once and waits for all of them to finish.
 * <p>
 * One finish channel is shared by every chain of a run. The chains are built and given
 * their initial token by P concurrent dispatcher tasks; once every injection has been
 * issued the caller takes P finish signals, one per chain, in whatever order the chains
 * complete. The call returns only after every chain reduced its token to zero.
 */
public final class ParallelRunner {

    private static final Logger logger = LoggerFactory.getLogger(ParallelRunner.class);

    private final Dispatcher dispatcher;
    private final RingFactory ringFactory;

    public ParallelRunner(Dispatcher dispatcher, RingFactory ringFactory) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.ringFactory = Objects.requireNonNull(ringFactory, "ringFactory");
    }

    /**
     * Runs {@code chains} rings of {@code ringSize} actors, each starting from {@code token}.
     * Blocks the calling thread, which must not be a dispatcher worker.
     *
     * @param ringSize The number of actors per ring, at least 1
     * @param token The initial token, at least 0
     * @param chains The number of rings, at least 1
     * @return The reporters of every chain
     * @throws com.ringbench.RingException if any task of the run failed
     */
    public RingResult run(int ringSize, int token, int chains) {
        if (ringSize < 1) {
            throw new IllegalArgumentException("Ring size must be at least 1, got: " + ringSize);
        }
        if (token < 0) {
            throw new IllegalArgumentException("Token must not be negative, got: " + token);
        }
        if (chains < 1) {
            throw new IllegalArgumentException("Chain count must be at least 1, got: " + chains);
        }

        RendezvousChannel<Integer> finish = new RendezvousChannel<>(dispatcher);
        List<CompletableFuture<Chain>> launches = new ArrayList<>(chains);
        try (RunGuard guard = dispatcher.guard()) {
            for (int i = 0; i < chains; i++) {
                launches.add(CompletableFuture.supplyAsync(() -> {
                    Chain chain = ringFactory.build(ringSize, finish);
                    chain.inject(token);
                    return chain;
                }, dispatcher));
            }
            guard.await(CompletableFuture.allOf(launches.toArray(new CompletableFuture<?>[0])));
            logger.debug("Injected token {} into {} rings of {}", token, chains, ringSize);

            List<Integer> reporters = new ArrayList<>(chains);
            for (int i = 0; i < chains; i++) {
                reporters.add(guard.await(finish.takeAsync()));
            }

            for (CompletableFuture<Chain> launch : launches) {
                launch.join().close();
            }
            return new RingResult(ringSize, token, chains, reporters);
        }
    }
}
