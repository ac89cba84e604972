package com.scbr.messages;

import akka.actor.typed.ActorRef;
import com.scbr.engine.RoundResult;
import com.scbr.session.SessionStats;

import java.time.Instant;

/**
 * Messages - Actor protocol of the consultation service
 */
public class Messages {

    // ========== LOGGING MESSAGES ==========
    public interface LogCommand {}

    public static class LogEvent implements LogCommand {
        public final String sessionId;
        public final String actorName;
        public final String event;
        public final String level;
        public final Instant timestamp;

        public LogEvent(String sessionId, String actorName, String event, String level) {
            this.sessionId = sessionId;
            this.actorName = actorName;
            this.event = event;
            this.level = level;
            this.timestamp = Instant.now();
        }

        public LogEvent(String sessionId, String actorName, String event) {
            this(sessionId, actorName, event, "INFO");
        }
    }

    // ========== CONSULTATION ROUTER MESSAGES ==========
    public interface ConsultCommand {}

    // ========== PER-SESSION MESSAGES ==========
    public interface SessionCommand {}

    /**
     * One round for one session. Routed by session id, run by that session's actor.
     */
    public static class RunRound implements ConsultCommand, SessionCommand {
        public final String sessionId;
        public final String text;
        public final ActorRef<RoundReply> replyTo;

        public RunRound(String sessionId, String text, ActorRef<RoundReply> replyTo) {
            this.sessionId = sessionId;
            this.text = text;
            this.replyTo = replyTo;
        }
    }

    /**
     * Discards the session. Ordered after any round already queued for it.
     */
    public static class ResetSession implements ConsultCommand, SessionCommand {
        public final String sessionId;
        public final ActorRef<ResetAck> replyTo;

        public ResetSession(String sessionId, ActorRef<ResetAck> replyTo) {
            this.sessionId = sessionId;
            this.replyTo = replyTo;
        }
    }

    public static class GetStats implements ConsultCommand {
        public final ActorRef<SessionStats> replyTo;

        public GetStats(ActorRef<SessionStats> replyTo) {
            this.replyTo = replyTo;
        }
    }

    /** Sent by an idle session actor asking its router to stop it. */
    public static class Passivate implements ConsultCommand {
        public final String sessionId;
        public final ActorRef<SessionCommand> ref;

        public Passivate(String sessionId, ActorRef<SessionCommand> ref) {
            this.sessionId = sessionId;
            this.ref = ref;
        }
    }

    /** Reply to {@link StopSession} from an actor that picked up a round in the meantime. */
    public static class PassivationDeclined implements ConsultCommand {
        public final String sessionId;
        public final ActorRef<SessionCommand> ref;

        public PassivationDeclined(String sessionId, ActorRef<SessionCommand> ref) {
            this.sessionId = sessionId;
            this.ref = ref;
        }
    }

    public static class SessionTerminated implements ConsultCommand {
        public final String sessionId;
        public final ActorRef<SessionCommand> ref;

        public SessionTerminated(String sessionId, ActorRef<SessionCommand> ref) {
            this.sessionId = sessionId;
            this.ref = ref;
        }
    }

    public enum StopSession implements SessionCommand {
        INSTANCE
    }

    // ========== REPLIES ==========
    public interface RoundReply {
        String sessionId();
    }

    public static class RoundCompleted implements RoundReply {
        public final RoundResult result;

        public RoundCompleted(RoundResult result) {
            this.result = result;
        }

        @Override
        public String sessionId() {
            return result.sessionId;
        }
    }

    /**
     * The round produced nothing and committed nothing.
     */
    public static class RoundFailed implements RoundReply {
        public final String sessionId;
        public final String reason;
        public final boolean retryable;

        public RoundFailed(String sessionId, String reason, boolean retryable) {
            this.sessionId = sessionId;
            this.reason = reason;
            this.retryable = retryable;
        }

        @Override
        public String sessionId() {
            return sessionId;
        }
    }

    /**
     * Too many rounds already queued for this session; try again later.
     */
    public static class SessionBusy implements RoundReply {
        public final String sessionId;
        public final long retryAfterMillis;

        public SessionBusy(String sessionId, long retryAfterMillis) {
            this.sessionId = sessionId;
            this.retryAfterMillis = retryAfterMillis;
        }

        @Override
        public String sessionId() {
            return sessionId;
        }
    }

    public static class ResetAck {
        public final String sessionId;
        public final boolean existed;

        public ResetAck(String sessionId, boolean existed) {
            this.sessionId = sessionId;
            this.existed = existed;
        }
    }

    // ========== REAPER MESSAGES ==========
    public interface ReaperCommand {}

    public enum Sweep implements ReaperCommand {
        INSTANCE
    }
}
