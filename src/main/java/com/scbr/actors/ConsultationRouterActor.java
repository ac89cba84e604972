package com.scbr.actors;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import com.scbr.engine.PipelineOrchestrator;
import com.scbr.engine.SpiralConfig;
import com.scbr.messages.Messages.*;
import com.scbr.session.SessionStore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * ConsultationRouterActor - Entry point for consultation traffic.
 * Routes every session's commands to that session's {@link SessionRoundActor}, spawning it on
 * first use, so rounds of one session are serialized while sessions run in parallel.
 *
 * <p>While a passivating actor has not yet stopped or declined, commands for its session are
 * held here and delivered once the outcome is known, so a session never has two live actors.</p>
 */
public class ConsultationRouterActor extends AbstractBehavior<ConsultCommand> {

    private final PipelineOrchestrator orchestrator;
    private final SessionStore store;
    private final ActorRef<LogCommand> logger;
    private final SpiralConfig config;
    private final Map<String, ActorRef<SessionCommand>> sessions = new HashMap<>();
    private final Map<String, Stopping> stopping = new HashMap<>();
    private long spawned;

    private static final class Stopping {
        final ActorRef<SessionCommand> ref;
        final List<SessionCommand> held = new ArrayList<>();

        Stopping(ActorRef<SessionCommand> ref) {
            this.ref = ref;
        }
    }

    public static Behavior<ConsultCommand> create(PipelineOrchestrator orchestrator, SessionStore store,
                                                  ActorRef<LogCommand> logger, SpiralConfig config) {
        return Behaviors.setup(context -> new ConsultationRouterActor(context, orchestrator, store, logger, config));
    }

    private ConsultationRouterActor(ActorContext<ConsultCommand> context, PipelineOrchestrator orchestrator,
                                    SessionStore store, ActorRef<LogCommand> logger, SpiralConfig config) {
        super(context);
        this.orchestrator = orchestrator;
        this.store = store;
        this.logger = logger;
        this.config = config;
        getContext().getLog().info("🔀 ConsultationRouter ready (stash={}, passivate after {})",
            config.stashCapacity, config.passivateAfter);
    }

    @Override
    public Receive<ConsultCommand> createReceive() {
        return newReceiveBuilder()
                .onMessage(RunRound.class, this::onRunRound)
                .onMessage(ResetSession.class, this::onResetSession)
                .onMessage(GetStats.class, this::onGetStats)
                .onMessage(Passivate.class, this::onPassivate)
                .onMessage(PassivationDeclined.class, this::onPassivationDeclined)
                .onMessage(SessionTerminated.class, this::onSessionTerminated)
                .build();
    }

    private Behavior<ConsultCommand> onRunRound(RunRound msg) {
        Stopping pending = stopping.get(msg.sessionId);
        if (pending != null) {
            if (pending.held.size() >= config.stashCapacity) {
                msg.replyTo.tell(new SessionBusy(msg.sessionId, SessionRoundActor.RETRY_AFTER.toMillis()));
            } else {
                pending.held.add(msg);
            }
            return this;
        }
        getContext().getLog().debug("🔀 Routing round for session [{}]", msg.sessionId);
        sessionFor(msg.sessionId).tell(msg);
        return this;
    }

    private Behavior<ConsultCommand> onResetSession(ResetSession msg) {
        Stopping pending = stopping.get(msg.sessionId);
        if (pending != null) {
            pending.held.add(msg);
            return this;
        }
        ActorRef<SessionCommand> session = sessions.get(msg.sessionId);
        if (session != null) {
            session.tell(msg);
        } else {
            // no live actor means no round in flight
            boolean existed = store.evict(msg.sessionId);
            logger.tell(new LogEvent(msg.sessionId, "ConsultationRouter", "Session reset (existed=" + existed + ")"));
            msg.replyTo.tell(new ResetAck(msg.sessionId, existed));
        }
        return this;
    }

    private Behavior<ConsultCommand> onGetStats(GetStats msg) {
        msg.replyTo.tell(store.stats());
        return this;
    }

    private Behavior<ConsultCommand> onPassivate(Passivate msg) {
        // repeated idle ticks may ask twice; only the registered actor is stopped
        if (sessions.remove(msg.sessionId, msg.ref)) {
            stopping.put(msg.sessionId, new Stopping(msg.ref));
            msg.ref.tell(StopSession.INSTANCE);
        }
        return this;
    }

    private Behavior<ConsultCommand> onPassivationDeclined(PassivationDeclined msg) {
        Stopping pending = stopping.get(msg.sessionId);
        if (pending == null || !pending.ref.equals(msg.ref)) {
            return this;
        }
        stopping.remove(msg.sessionId);
        sessions.put(msg.sessionId, msg.ref);
        pending.held.forEach(msg.ref::tell);
        logger.tell(new LogEvent(msg.sessionId, "ConsultationRouter",
            "Passivation declined, " + pending.held.size() + " held command(s) delivered"));
        return this;
    }

    private Behavior<ConsultCommand> onSessionTerminated(SessionTerminated msg) {
        sessions.remove(msg.sessionId, msg.ref);
        Stopping pending = stopping.get(msg.sessionId);
        if (pending != null && pending.ref.equals(msg.ref)) {
            stopping.remove(msg.sessionId);
            for (SessionCommand held : pending.held) {
                if (held instanceof RunRound) {
                    onRunRound((RunRound) held);
                } else if (held instanceof ResetSession) {
                    onResetSession((ResetSession) held);
                }
            }
        }
        return this;
    }

    private ActorRef<SessionCommand> sessionFor(String sessionId) {
        ActorRef<SessionCommand> existing = sessions.get(sessionId);
        if (existing != null) {
            return existing;
        }
        ActorRef<SessionCommand> child = getContext().spawn(
            SessionRoundActor.create(sessionId, orchestrator, store, getContext().getSelf(), logger,
                config.stashCapacity, config.passivateAfter),
            "session-" + (++spawned));
        getContext().watchWith(child, new SessionTerminated(sessionId, child));
        sessions.put(sessionId, child);
        logger.tell(new LogEvent(sessionId, "ConsultationRouter", "Session actor started"));
        return child;
    }
}
