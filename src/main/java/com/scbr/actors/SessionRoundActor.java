package com.scbr.actors;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.DispatcherSelector;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import akka.actor.typed.javadsl.StashBuffer;
import com.scbr.engine.PipelineOrchestrator;
import com.scbr.engine.ReasoningUnavailableException;
import com.scbr.engine.RoundResult;
import com.scbr.engine.RoundStatus;
import com.scbr.messages.Messages.*;
import com.scbr.session.SessionStore;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * SessionRoundActor - Owns the rounds of one session.
 *
 * <p>At most one round runs at a time, on the blocking dispatcher. Requests arriving meanwhile
 * wait in a bounded stash; when it is full the caller gets {@link SessionBusy}. Resets queue
 * behind the running round. After a quiet period the actor asks its router to passivate it;
 * the session itself lives on in the store. A stop that finds a round in flight is declined,
 * and the router takes the actor back.</p>
 */
public class SessionRoundActor extends AbstractBehavior<SessionCommand> {

    static final Duration RETRY_AFTER = Duration.ofSeconds(2);

    private static final class RoundFinished implements SessionCommand {
        final RunRound request;
        final RoundResult result;
        final Throwable failure;

        RoundFinished(RunRound request, RoundResult result, Throwable failure) {
            this.request = request;
            this.result = result;
            this.failure = failure;
        }
    }

    private enum IdleTimeout implements SessionCommand {
        INSTANCE
    }

    private final String sessionId;
    private final PipelineOrchestrator orchestrator;
    private final SessionStore store;
    private final ActorRef<ConsultCommand> router;
    private final ActorRef<LogCommand> logger;
    private final StashBuffer<SessionCommand> stash;
    private final Executor blocking;
    private boolean inFlight;

    public static Behavior<SessionCommand> create(String sessionId, PipelineOrchestrator orchestrator,
                                                  SessionStore store, ActorRef<ConsultCommand> router,
                                                  ActorRef<LogCommand> logger, int stashCapacity,
                                                  Duration passivateAfter) {
        return Behaviors.withStash(stashCapacity, stash ->
            Behaviors.setup(context -> {
                context.setReceiveTimeout(passivateAfter, IdleTimeout.INSTANCE);
                return new SessionRoundActor(context, sessionId, orchestrator, store, router, logger, stash);
            }));
    }

    private SessionRoundActor(ActorContext<SessionCommand> context, String sessionId,
                              PipelineOrchestrator orchestrator, SessionStore store,
                              ActorRef<ConsultCommand> router, ActorRef<LogCommand> logger,
                              StashBuffer<SessionCommand> stash) {
        super(context);
        this.sessionId = sessionId;
        this.orchestrator = orchestrator;
        this.store = store;
        this.router = router;
        this.logger = logger;
        this.stash = stash;
        this.blocking = context.getSystem().dispatchers().lookup(DispatcherSelector.blocking());
    }

    @Override
    public Receive<SessionCommand> createReceive() {
        return newReceiveBuilder()
                .onMessage(RunRound.class, this::onRunRound)
                .onMessage(ResetSession.class, this::onResetSession)
                .onMessage(RoundFinished.class, this::onRoundFinished)
                .onMessageEquals(IdleTimeout.INSTANCE, this::onIdle)
                .onMessageEquals(StopSession.INSTANCE, this::onStop)
                .build();
    }

    private Behavior<SessionCommand> onRunRound(RunRound msg) {
        if (inFlight) {
            if (stash.isFull()) {
                logger.tell(new LogEvent(sessionId, "SessionRoundActor",
                    "Round refused, " + stash.size() + " already queued", "WARNING"));
                msg.replyTo.tell(new SessionBusy(sessionId, RETRY_AFTER.toMillis()));
            } else {
                stash.stash(msg);
            }
            return this;
        }

        inFlight = true;
        CompletableFuture<RoundResult> round =
            CompletableFuture.supplyAsync(() -> orchestrator.runRound(sessionId, msg.text), blocking);
        getContext().pipeToSelf(round, (result, failure) -> new RoundFinished(msg, result, failure));
        return this;
    }

    private Behavior<SessionCommand> onResetSession(ResetSession msg) {
        if (inFlight && !stash.isFull()) {
            stash.stash(msg);
            return this;
        }
        // a full stash resets right away; the running round then fails its version check
        boolean existed = store.evict(sessionId);
        logger.tell(new LogEvent(sessionId, "SessionRoundActor", "Session reset (existed=" + existed + ")"));
        msg.replyTo.tell(new ResetAck(sessionId, existed));
        return this;
    }

    private Behavior<SessionCommand> onRoundFinished(RoundFinished msg) {
        inFlight = false;
        if (msg.failure == null && msg.result.status == RoundStatus.SESSION_CHANGED) {
            logger.tell(new LogEvent(sessionId, "SessionRoundActor",
                "Round " + msg.result.round + " not recorded, session changed meanwhile", "WARNING"));
            msg.request.replyTo.tell(new RoundFailed(sessionId, "session changed during the round, please retry", true));
        } else if (msg.failure == null) {
            msg.request.replyTo.tell(new RoundCompleted(msg.result));
        } else {
            Throwable cause = msg.failure instanceof CompletionException && msg.failure.getCause() != null
                ? msg.failure.getCause() : msg.failure;
            if (cause instanceof ReasoningUnavailableException) {
                logger.tell(new LogEvent(sessionId, "SessionRoundActor", cause.getMessage(), "ERROR"));
                msg.request.replyTo.tell(new RoundFailed(sessionId, "reasoning service unavailable", true));
            } else {
                getContext().getLog().error("❌ Round failed for session {}", sessionId, cause);
                msg.request.replyTo.tell(new RoundFailed(sessionId, "internal error", false));
            }
        }
        return stash.unstashAll(this);
    }

    private Behavior<SessionCommand> onIdle() {
        if (!inFlight && stash.isEmpty()) {
            router.tell(new Passivate(sessionId, getContext().getSelf()));
        }
        return this;
    }

    private Behavior<SessionCommand> onStop() {
        if (inFlight) {
            getContext().getLog().debug("🔄 Session actor {} busy, declining passivation", sessionId);
            router.tell(new PassivationDeclined(sessionId, getContext().getSelf()));
            return this;
        }
        getContext().getLog().debug("💤 Session actor {} passivated", sessionId);
        return Behaviors.stopped();
    }
}
