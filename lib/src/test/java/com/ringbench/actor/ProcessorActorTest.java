package com.ringbench.actor;

import com.ringbench.RingException;
import com.ringbench.channel.RendezvousChannel;
import com.ringbench.dispatcher.Dispatcher;
import com.ringbench.dispatcher.MailboxType;
import com.ringbench.dispatcher.RunGuard;
import com.ringbench.helper.AsyncAssertion;
import com.ringbench.helper.DispatcherExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 30, unit = TimeUnit.SECONDS)
@ExtendWith(DispatcherExtension.class)
class ProcessorActorTest {

    @ParameterizedTest
    @EnumSource(MailboxType.class)
    void testSelfLinkedActorCountsDown(MailboxType mailboxType, Dispatcher dispatcher) {
        RendezvousChannel<Integer> finish = new RendezvousChannel<>(dispatcher);
        ProcessorActor actor = new ProcessorActor(1, finish, dispatcher, mailboxType, 2);
        actor.setNext(actor);
        actor.start();

        actor.tell(3);

        assertEquals(1, finish.awaitTake());
        assertTrue(actor.isFinished());
        assertEquals(4, actor.received());
    }

    @Test
    void testPairForwardsToSuccessor(Dispatcher dispatcher) {
        RendezvousChannel<Integer> finish = new RendezvousChannel<>(dispatcher);
        ProcessorActor first = new ProcessorActor(1, finish, dispatcher, MailboxType.MPSC, 64);
        ProcessorActor second = new ProcessorActor(2, finish, dispatcher, MailboxType.MPSC, 64);
        first.setNext(second);
        second.setNext(first);
        first.start();
        second.start();

        first.tell(5);

        // 5 at actor 1, 4 at actor 2, ... 0 at actor 2
        assertEquals(2, finish.awaitTake());
        assertEquals(3, first.received());
        assertEquals(3, second.received());
        assertFalse(first.isFinished());
    }

    @Test
    void testStartWithoutSuccessorFails(Dispatcher dispatcher) {
        ProcessorActor actor = new ProcessorActor(1, new RendezvousChannel<>(dispatcher), dispatcher,
                MailboxType.CBQ, 64);
        assertThrows(IllegalStateException.class, actor::start);
    }

    @Test
    void testTokenAfterReportingAbortsRun(Dispatcher dispatcher) {
        RendezvousChannel<Integer> finish = new RendezvousChannel<>(dispatcher);
        ProcessorActor actor = new ProcessorActor(1, finish, dispatcher, MailboxType.MPSC, 64);
        actor.setNext(actor);
        actor.start();

        try (RunGuard guard = dispatcher.guard()) {
            actor.tell(0);
            assertEquals(1, finish.awaitTake());

            actor.tell(7);
            RingException e = assertThrows(RingException.class, () -> guard.await(new CompletableFuture<>()));
            assertEquals(1, e.getActorName());
        }
    }

    @Test
    void testCloseIsIdempotentAndRejectsTokens(Dispatcher dispatcher) {
        ProcessorActor actor = new ProcessorActor(1, new RendezvousChannel<>(dispatcher), dispatcher,
                MailboxType.MPSC, 64);
        actor.setNext(actor);

        actor.close();
        actor.close();

        assertTrue(actor.isClosed());
        assertEquals(0, actor.pendingMessages());
        assertThrows(IllegalStateException.class, () -> actor.tell(1));
    }

    @Test
    void testForwardToClosedSuccessorIsReported(Dispatcher dispatcher) {
        RendezvousChannel<Integer> finish = new RendezvousChannel<>(dispatcher);
        ProcessorActor actor = new ProcessorActor(1, finish, dispatcher, MailboxType.CBQ, 64);
        ProcessorActor unstarted = new ProcessorActor(2, finish, dispatcher, MailboxType.CBQ, 64);
        actor.setNext(unstarted);
        unstarted.setNext(actor);
        actor.start();

        unstarted.close();
        try (RunGuard guard = dispatcher.guard()) {
            actor.tell(4);
            AsyncAssertion.eventually(guard::isAborted, Duration.ofSeconds(2));
        }
        assertEquals(1, actor.received());
    }
}
