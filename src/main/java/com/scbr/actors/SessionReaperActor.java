package com.scbr.actors;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import com.scbr.messages.Messages.LogCommand;
import com.scbr.messages.Messages.LogEvent;
import com.scbr.messages.Messages.ReaperCommand;
import com.scbr.messages.Messages.Sweep;
import com.scbr.session.SessionStore;

import java.time.Duration;

/**
 * SessionReaperActor - Periodic sweep evicting idle sessions, then oldest-idle ones over capacity
 */
public class SessionReaperActor extends AbstractBehavior<ReaperCommand> {

    private final SessionStore store;
    private final Duration idleTimeout;
    private final ActorRef<LogCommand> logger;

    public static Behavior<ReaperCommand> create(SessionStore store, Duration sweepInterval, Duration idleTimeout,
                                                 ActorRef<LogCommand> logger) {
        return Behaviors.setup(context -> Behaviors.withTimers(timers -> {
            timers.startTimerWithFixedDelay(Sweep.INSTANCE, sweepInterval);
            return new SessionReaperActor(context, store, idleTimeout, logger);
        }));
    }

    private SessionReaperActor(ActorContext<ReaperCommand> context, SessionStore store, Duration idleTimeout,
                               ActorRef<LogCommand> logger) {
        super(context);
        this.store = store;
        this.idleTimeout = idleTimeout;
        this.logger = logger;
    }

    @Override
    public Receive<ReaperCommand> createReceive() {
        return newReceiveBuilder()
                .onMessageEquals(Sweep.INSTANCE, this::onSweep)
                .build();
    }

    private Behavior<ReaperCommand> onSweep() {
        int idle = store.evictIdle(idleTimeout);
        int overCapacity = store.evictOverCapacity();
        if (idle + overCapacity > 0) {
            logger.tell(new LogEvent("SYSTEM", "SessionReaper",
                "Evicted " + idle + " idle and " + overCapacity + " over-capacity session(s), "
                    + store.size() + " remain"));
        }
        return this;
    }
}
