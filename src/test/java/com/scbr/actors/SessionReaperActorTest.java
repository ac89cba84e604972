package com.scbr.actors;

import akka.actor.testkit.typed.javadsl.ActorTestKit;
import akka.actor.testkit.typed.javadsl.TestProbe;
import akka.actor.typed.ActorRef;
import com.scbr.messages.Messages.LogCommand;
import com.scbr.messages.Messages.LogEvent;
import com.scbr.messages.Messages.ReaperCommand;
import com.scbr.session.InMemorySessionStore;
import com.scbr.session.MutableClock;
import com.scbr.session.SessionStore;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class SessionReaperActorTest {

    private static final ActorTestKit testKit = ActorTestKit.create();
    private static final Duration SWEEP = Duration.ofMillis(100);

    @AfterAll
    public static void cleanup() {
        testKit.shutdownTestKit();
    }

    @Test
    public void shouldEvictIdleSessionsOnTimer() {
        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T08:00:00Z"));
        InMemorySessionStore store = new InMemorySessionStore(10, clock);
        store.getOrCreate("stale-1");
        store.getOrCreate("stale-2");
        clock.advance(Duration.ofMinutes(45));
        store.getOrCreate("fresh");
        clock.advance(Duration.ofMinutes(20));
        TestProbe<LogCommand> logger = testKit.createTestProbe(LogCommand.class);

        ActorRef<ReaperCommand> reaper = testKit.spawn(
            SessionReaperActor.create(store, SWEEP, Duration.ofMinutes(60), logger.getRef()));

        LogEvent event = logger.expectMessageClass(LogEvent.class, Duration.ofSeconds(5));
        assertEquals("SessionReaper", event.actorName);
        assertTrue(event.event.contains("Evicted 2 idle and 0 over-capacity"));
        assertTrue(store.get("stale-1").isEmpty());
        assertTrue(store.get("stale-2").isEmpty());
        assertTrue(store.get("fresh").isPresent());

        // nothing left to evict, so later sweeps stay quiet
        logger.expectNoMessage(Duration.ofMillis(400));
        testKit.stop(reaper);
    }

    @Test
    public void shouldEvictIdleBeforeTrimmingToCapacity() {
        SessionStore store = mock(SessionStore.class);
        when(store.evictIdle(any())).thenReturn(1);
        when(store.evictOverCapacity()).thenReturn(2);
        when(store.size()).thenReturn(10);
        TestProbe<LogCommand> logger = testKit.createTestProbe(LogCommand.class);

        ActorRef<ReaperCommand> reaper = testKit.spawn(
            SessionReaperActor.create(store, SWEEP, Duration.ofMinutes(60), logger.getRef()));

        LogEvent event = logger.expectMessageClass(LogEvent.class, Duration.ofSeconds(5));
        testKit.stop(reaper);

        assertEquals("Evicted 1 idle and 2 over-capacity session(s), 10 remain", event.event);
        InOrder order = inOrder(store);
        order.verify(store, atLeastOnce()).evictIdle(Duration.ofMinutes(60));
        order.verify(store, atLeastOnce()).evictOverCapacity();
        verify(store, atLeastOnce()).size();
    }
}
