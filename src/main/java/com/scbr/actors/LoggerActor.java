package com.scbr.actors;

import akka.actor.typed.Behavior;
import akka.actor.typed.javadsl.AbstractBehavior;
import akka.actor.typed.javadsl.ActorContext;
import akka.actor.typed.javadsl.Behaviors;
import akka.actor.typed.javadsl.Receive;
import com.scbr.messages.Messages.LogCommand;
import com.scbr.messages.Messages.LogEvent;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * LoggerActor - Consultation event log.
 * Fire-and-forget {@link LogEvent}s from the other actors; the session id goes to the MDC.
 */
public class LoggerActor extends AbstractBehavior<LogCommand> {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    public static Behavior<LogCommand> create() {
        return Behaviors.withMdc(LogCommand.class,
            msg -> msg instanceof LogEvent ? Map.of("sessionId", String.valueOf(((LogEvent) msg).sessionId)) : Map.of(),
            Behaviors.setup(LoggerActor::new));
    }

    private LoggerActor(ActorContext<LogCommand> context) {
        super(context);
        getContext().getLog().info("📝 LoggerActor initialized");
    }

    @Override
    public Receive<LogCommand> createReceive() {
        return newReceiveBuilder()
                .onMessage(LogEvent.class, this::onLogEvent)
                .build();
    }

    private Behavior<LogCommand> onLogEvent(LogEvent msg) {
        String timestamp = msg.timestamp.atZone(ZoneId.systemDefault()).format(TIMESTAMP_FORMAT);
        String level = normalize(msg.level);

        String line = String.format("[%s] %s %s | %s: %s",
            timestamp, emojiFor(level), msg.sessionId, msg.actorName, msg.event);

        switch (level) {
            case "ERROR":
                getContext().getLog().error(line);
                break;
            case "WARNING":
                getContext().getLog().warn(line);
                break;
            case "DEBUG":
                getContext().getLog().debug(line);
                break;
            default:
                getContext().getLog().info(line);
        }
        return this;
    }

    private static String normalize(String level) {
        String upper = level == null ? "INFO" : level.toUpperCase();
        return "WARN".equals(upper) ? "WARNING" : upper;
    }

    private static String emojiFor(String level) {
        return switch (level) {
            case "ERROR" -> "❌";
            case "WARNING" -> "⚠️";
            case "DEBUG" -> "🔍";
            default -> "ℹ️";
        };
    }
}
