package com.ringbench.actor;

import com.ringbench.RingException;
import com.ringbench.channel.BufferedChannel;
import com.ringbench.channel.Channel;
import com.ringbench.channel.RendezvousChannel;
import com.ringbench.dispatcher.Dispatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

/**
 * Drives a channel actor's receive loop directly on the test thread, with a mocked
 * outbound channel.
 */
@Timeout(value = 30, unit = TimeUnit.SECONDS)
@ExtendWith(MockitoExtension.class)
class ChannelActorTest {

    @Mock
    private Channel<Integer> outbound;

    private Dispatcher dispatcher;
    private BufferedChannel<Integer> inbound;
    private RendezvousChannel<Integer> finish;

    @BeforeEach
    void setUp() {
        dispatcher = Dispatcher.workStealingDispatcher(2, "actor-test");
        inbound = new BufferedChannel<>(dispatcher);
        finish = new RendezvousChannel<>(dispatcher);
    }

    @AfterEach
    void cleanup() {
        dispatcher.shutdown();
        dispatcher.awaitTermination(2, TimeUnit.SECONDS);
    }

    @Test
    void testForwardsDecrementedTokensThenReports() {
        when(outbound.tryTransfer(anyInt(), any(Runnable.class))).thenReturn(true);
        ChannelActor actor = new ChannelActor(4, inbound, outbound, finish);
        inbound.send(2);
        inbound.send(1);
        inbound.send(0);

        actor.run();

        InOrder order = inOrder(outbound);
        order.verify(outbound).tryTransfer(eq(1), any(Runnable.class));
        order.verify(outbound).tryTransfer(eq(0), any(Runnable.class));
        verifyNoMoreInteractions(outbound);
        assertTrue(actor.isFinished());
        assertEquals(3, actor.received());
        assertEquals(4, finish.awaitTake());
    }

    @Test
    void testParksWhenInboundEmpty() {
        ChannelActor actor = new ChannelActor(1, inbound, outbound, finish);

        actor.run();

        assertEquals(1, inbound.pendingTakes());
        assertEquals(0, actor.received());
        verifyNoInteractions(outbound);
    }

    @Test
    void testResumesAfterParkedTransfer() {
        when(outbound.tryTransfer(anyInt(), any(Runnable.class))).thenReturn(false, true);
        ChannelActor actor = new ChannelActor(2, inbound, outbound, finish);
        inbound.send(5);
        inbound.send(4);

        actor.run();

        ArgumentCaptor<Runnable> onTransferred = ArgumentCaptor.forClass(Runnable.class);
        verify(outbound).tryTransfer(eq(4), onTransferred.capture());
        assertEquals(1, actor.received());
        assertEquals(1, inbound.size());

        // The outbound channel completes the parked transfer
        onTransferred.getValue().run();

        verify(outbound).tryTransfer(eq(3), any(Runnable.class));
        assertEquals(2, actor.received());
        assertEquals(0, inbound.size());
        assertEquals(1, inbound.pendingTakes());
    }

    @Test
    void testResumedTokenIsProcessedFirst() {
        when(outbound.tryTransfer(anyInt(), any(Runnable.class))).thenReturn(true);
        ChannelActor actor = new ChannelActor(3, inbound, outbound, finish);

        inbound.send(0);

        // The delivered 1 is forwarded before the buffered 0 is taken
        actor.resume(1);

        verify(outbound).tryTransfer(eq(0), any(Runnable.class));
        assertEquals(2, actor.received());
        assertTrue(actor.isFinished());
        assertEquals(3, finish.awaitTake());
    }

    @Test
    void testTokenAfterReportingIsFatal() {
        ChannelActor actor = new ChannelActor(6, inbound, outbound, finish);
        inbound.send(0);
        actor.run();
        assertTrue(actor.isFinished());

        inbound.send(5);
        RingException e = assertThrows(RingException.class, actor::run);
        assertEquals(6, e.getActorName());
    }

    @Test
    void testResumeAfterCloseIsFatal() {
        ChannelActor actor = new ChannelActor(1, inbound, outbound, finish);
        actor.close();

        assertTrue(actor.isClosed());
        assertThrows(RingException.class, () -> actor.resume(3));
        verifyNoInteractions(outbound);
    }

    @Test
    void testAccessors() {
        ChannelActor actor = new ChannelActor(8, inbound, outbound, finish);
        assertEquals(8, actor.name());
        assertSame(inbound, actor.inbound());
        assertSame(outbound, actor.outbound());
        assertEquals("ChannelActor[8]", actor.toString());
    }
}
