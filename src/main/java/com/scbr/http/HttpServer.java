package com.scbr.http;

import akka.actor.typed.ActorRef;
import akka.actor.typed.ActorSystem;
import akka.actor.typed.javadsl.AskPattern;
import akka.http.javadsl.Http;
import akka.http.javadsl.ServerBinding;
import akka.http.javadsl.marshallers.jackson.Jackson;
import akka.http.javadsl.model.StatusCodes;
import akka.http.javadsl.model.headers.RawHeader;
import akka.http.javadsl.server.AllDirectives;
import akka.http.javadsl.server.PathMatchers;
import akka.http.javadsl.server.Route;
import com.scbr.engine.SpiralConfig;
import com.scbr.http.ApiModels.*;
import com.scbr.messages.Messages.*;
import com.scbr.session.SessionStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletionStage;

/**
 * HttpServer - JSON API in front of the consultation router
 */
public class HttpServer extends AllDirectives {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final ActorSystem<?> system;
    private final ActorRef<ConsultCommand> router;
    private final Duration askTimeout;
    private final String reasoningName;

    public HttpServer(ActorSystem<?> system, ActorRef<ConsultCommand> router, SpiralConfig config,
                      String reasoningName) {
        this.system = system;
        this.router = router;
        this.reasoningName = reasoningName;
        // every stage may use its full retry budget, plus queueing behind earlier rounds
        this.askTimeout = config.reasoningTimeout
            .multipliedBy((long) (config.retryBudget + 1) * 3)
            .plusSeconds(5);
    }

    public Route createRoutes() {
        return concat(
            path("health", () ->
                get(() -> completeOK(new HealthResponse("ok", reasoningName), Jackson.marshaller()))
            ),
            pathPrefix("api", () -> concat(
                path("consult", () ->
                    post(() ->
                        entity(Jackson.unmarshaller(ConsultRequest.class), this::consult)
                    )
                ),
                pathPrefix("sessions", () -> concat(
                    path("stats", () -> get(this::stats)),
                    path(PathMatchers.segment().slash("reset"), sessionId -> post(() -> reset(sessionId)))
                ))
            ))
        );
    }

    private Route consult(ConsultRequest request) {
        String sessionId = request.sessionId != null && !request.sessionId.isBlank()
            ? request.sessionId : generateSessionId();
        if (request.text == null || request.text.trim().isEmpty()) {
            return complete(StatusCodes.BAD_REQUEST,
                new ErrorResponse(sessionId, "Missing text field", false), Jackson.marshaller());
        }

        log.info("📨 Round request for session [{}]", sessionId);
        CompletionStage<RoundReply> reply = AskPattern.ask(
            router,
            replyTo -> new RunRound(sessionId, request.text.trim(), replyTo),
            askTimeout,
            system.scheduler()
        );

        return onComplete(reply, result -> {
            if (result.isFailure()) {
                log.error("❌ Round for session [{}] did not answer in time", sessionId, result.failed().get());
                return complete(StatusCodes.SERVICE_UNAVAILABLE,
                    new ErrorResponse(sessionId, "Consultation timed out, please retry", true), Jackson.marshaller());
            }
            RoundReply roundReply = result.get();
            if (roundReply instanceof RoundCompleted) {
                RoundCompleted completed = (RoundCompleted) roundReply;
                return completeOK(new ConsultResponse(completed.result), Jackson.marshaller());
            }
            if (roundReply instanceof SessionBusy) {
                SessionBusy busy = (SessionBusy) roundReply;
                long seconds = Math.max(1, Duration.ofMillis(busy.retryAfterMillis).toSeconds());
                return respondWithHeader(RawHeader.create("Retry-After", Long.toString(seconds)), () ->
                    complete(StatusCodes.TOO_MANY_REQUESTS,
                        new ErrorResponse(sessionId, "Session busy, retry later", true), Jackson.marshaller()));
            }
            RoundFailed failed = (RoundFailed) roundReply;
            return complete(failed.retryable ? StatusCodes.SERVICE_UNAVAILABLE : StatusCodes.INTERNAL_SERVER_ERROR,
                new ErrorResponse(sessionId, failed.reason, failed.retryable), Jackson.marshaller());
        });
    }

    private Route reset(String sessionId) {
        CompletionStage<ResetAck> ack = AskPattern.ask(
            router, replyTo -> new ResetSession(sessionId, replyTo), askTimeout, system.scheduler());
        return onSuccess(ack, a -> completeOK(new ResetResponse(a.sessionId, a.existed), Jackson.marshaller()));
    }

    private Route stats() {
        CompletionStage<SessionStats> stats = AskPattern.ask(
            router, GetStats::new, Duration.ofSeconds(5), system.scheduler());
        return onSuccess(stats, s -> completeOK(new StatsResponse(s), Jackson.marshaller()));
    }

    private String generateSessionId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public CompletionStage<ServerBinding> start(String host, int port) {
        return Http.get(system).newServerAt(host, port).bind(createRoutes())
            .thenApply(binding -> {
                log.info("🌐 HTTP API listening on {}:{}", host, port);
                return binding;
            });
    }
}
