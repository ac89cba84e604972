package com.scbr.actors;

import akka.actor.testkit.typed.javadsl.ActorTestKit;
import akka.actor.testkit.typed.javadsl.TestProbe;
import akka.actor.typed.ActorRef;
import com.scbr.engine.Stage;
import com.scbr.messages.Messages.*;
import com.scbr.reasoning.ReasoningResult;
import com.scbr.reasoning.ScriptedReasoning;
import com.scbr.session.InMemorySessionStore;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;

import static com.scbr.actors.ActorFixtures.INPUT;
import static com.scbr.actors.ActorFixtures.blockUntil;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SessionRoundActorTest {

    private static final ActorTestKit testKit = ActorTestKit.create();
    private static final Duration LONG_IDLE = Duration.ofMinutes(5);

    private InMemorySessionStore store;
    private ScriptedReasoning reasoning;
    private TestProbe<ConsultCommand> router;
    private TestProbe<LogCommand> logger;

    @AfterAll
    public static void cleanup() {
        testKit.shutdownTestKit();
    }

    @BeforeEach
    public void setUp() {
        store = new InMemorySessionStore(100);
        reasoning = new ScriptedReasoning();
        router = testKit.createTestProbe(ConsultCommand.class);
        logger = testKit.createTestProbe(LogCommand.class);
    }

    private ActorRef<SessionCommand> spawn(String sessionId, int stashCapacity, Duration passivateAfter)
            throws IOException {
        return testKit.spawn(SessionRoundActor.create(sessionId, ActorFixtures.orchestrator(store, reasoning),
            store, router.getRef(), logger.getRef(), stashCapacity, passivateAfter));
    }

    @Test
    public void shouldRunQueuedRoundsOneAfterAnother() throws IOException {
        CountDownLatch release = new CountDownLatch(1);
        reasoning.then(Stage.GATE, blockUntil(release));
        ActorRef<SessionCommand> session = spawn("s1", 4, LONG_IDLE);
        TestProbe<RoundReply> first = testKit.createTestProbe(RoundReply.class);
        TestProbe<RoundReply> second = testKit.createTestProbe(RoundReply.class);

        session.tell(new RunRound("s1", INPUT, first.getRef()));
        session.tell(new RunRound("s1", "持續兩個月，勞累後加重", second.getRef()));
        second.expectNoMessage(Duration.ofMillis(300));

        release.countDown();
        RoundCompleted one = (RoundCompleted) first.expectMessageClass(RoundCompleted.class, Duration.ofSeconds(5));
        RoundCompleted two = (RoundCompleted) second.expectMessageClass(RoundCompleted.class, Duration.ofSeconds(5));

        assertEquals(1, one.result.round);
        assertEquals(2, two.result.round);
        assertEquals(2, store.get("s1").orElseThrow().roundCount);
    }

    @Test
    public void shouldAnswerBusyWhenQueueIsFull() throws IOException {
        CountDownLatch release = new CountDownLatch(1);
        reasoning.then(Stage.GATE, blockUntil(release));
        ActorRef<SessionCommand> session = spawn("s1", 1, LONG_IDLE);
        TestProbe<RoundReply> probe = testKit.createTestProbe(RoundReply.class);
        TestProbe<RoundReply> rejected = testKit.createTestProbe(RoundReply.class);

        session.tell(new RunRound("s1", INPUT, probe.getRef()));
        session.tell(new RunRound("s1", "補充：頭暈", probe.getRef()));
        session.tell(new RunRound("s1", "再補充：乏力", rejected.getRef()));

        SessionBusy busy = rejected.expectMessageClass(SessionBusy.class, Duration.ofSeconds(5));
        assertEquals(SessionRoundActor.RETRY_AFTER.toMillis(), busy.retryAfterMillis);

        release.countDown();
        probe.expectMessageClass(RoundCompleted.class, Duration.ofSeconds(5));
        probe.expectMessageClass(RoundCompleted.class, Duration.ofSeconds(5));
    }

    @Test
    public void shouldResetOnlyAfterRunningRoundFinishes() throws IOException {
        CountDownLatch release = new CountDownLatch(1);
        reasoning.then(Stage.GATE, blockUntil(release));
        ActorRef<SessionCommand> session = spawn("s1", 4, LONG_IDLE);
        TestProbe<RoundReply> roundProbe = testKit.createTestProbe(RoundReply.class);
        TestProbe<ResetAck> resetProbe = testKit.createTestProbe(ResetAck.class);

        session.tell(new RunRound("s1", INPUT, roundProbe.getRef()));
        session.tell(new ResetSession("s1", resetProbe.getRef()));
        resetProbe.expectNoMessage(Duration.ofMillis(300));

        release.countDown();
        roundProbe.expectMessageClass(RoundCompleted.class, Duration.ofSeconds(5));
        ResetAck ack = resetProbe.expectMessageClass(ResetAck.class, Duration.ofSeconds(5));

        assertTrue(ack.existed);
        assertTrue(store.get("s1").isEmpty());
    }

    @Test
    public void shouldReportUnavailableReasoningAsRetryable() throws IOException {
        reasoning.always(Stage.GATE, context -> ReasoningResult.unavailable("HTTP 503"));
        ActorRef<SessionCommand> session = spawn("s1", 4, LONG_IDLE);
        TestProbe<RoundReply> probe = testKit.createTestProbe(RoundReply.class);

        session.tell(new RunRound("s1", INPUT, probe.getRef()));

        RoundFailed failed = probe.expectMessageClass(RoundFailed.class, Duration.ofSeconds(5));
        assertTrue(failed.retryable);
        assertEquals(0, store.get("s1").orElseThrow().roundCount);

        reasoning.always(Stage.GATE, context -> ScriptedReasoning.json("{\"action\":\"proceed\"}"));
        session.tell(new RunRound("s1", INPUT, probe.getRef()));
        RoundReply next = probe.receiveMessage(Duration.ofSeconds(5));
        assertInstanceOf(RoundCompleted.class, next);
    }

    @Test
    public void shouldAskRouterToPassivateWhenIdle() throws IOException {
        ActorRef<SessionCommand> session = spawn("s1", 4, Duration.ofMillis(200));

        Passivate passivate = router.expectMessageClass(Passivate.class, Duration.ofSeconds(5));
        assertEquals("s1", passivate.sessionId);
        assertEquals(session, passivate.ref);

        session.tell(StopSession.INSTANCE);
        TestProbe<Object> watcher = testKit.createTestProbe();
        watcher.expectTerminated(session, Duration.ofSeconds(5));
        assertFalse(store.get("s1").isPresent());
    }

    @Test
    public void shouldDeclineStopWhileRoundRuns() throws IOException {
        CountDownLatch release = new CountDownLatch(1);
        reasoning.then(Stage.GATE, blockUntil(release));
        ActorRef<SessionCommand> session = spawn("s1", 4, LONG_IDLE);
        TestProbe<RoundReply> probe = testKit.createTestProbe(RoundReply.class);

        session.tell(new RunRound("s1", INPUT, probe.getRef()));
        session.tell(StopSession.INSTANCE);

        PassivationDeclined declined = router.expectMessageClass(PassivationDeclined.class, Duration.ofSeconds(5));
        assertEquals("s1", declined.sessionId);
        assertEquals(session, declined.ref);

        release.countDown();
        probe.expectMessageClass(RoundCompleted.class, Duration.ofSeconds(5));
        session.tell(new RunRound("s1", "持續兩個月", probe.getRef()));
        RoundCompleted next = probe.expectMessageClass(RoundCompleted.class, Duration.ofSeconds(5));
        assertEquals(2, next.result.round);
    }

    @Test
    public void shouldReportChangedSessionAsRetryable() throws IOException {
        reasoning.then(Stage.REVIEW, context -> {
            store.evict("s1");
            return ScriptedReasoning.json("{\"verdict\":\"passed\"}");
        });
        ActorRef<SessionCommand> session = spawn("s1", 4, LONG_IDLE);
        TestProbe<RoundReply> probe = testKit.createTestProbe(RoundReply.class);

        session.tell(new RunRound("s1", INPUT, probe.getRef()));

        RoundFailed failed = probe.expectMessageClass(RoundFailed.class, Duration.ofSeconds(5));
        assertTrue(failed.retryable);
        assertTrue(failed.reason.contains("changed"));
        assertTrue(store.get("s1").isEmpty());
    }
}
