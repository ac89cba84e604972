package com.scbr;

import akka.actor.typed.ActorRef;
import akka.actor.typed.ActorSystem;
import akka.actor.typed.Behavior;
import akka.actor.typed.javadsl.AskPattern;
import akka.actor.typed.javadsl.Behaviors;
import com.scbr.actors.ConsultationRouterActor;
import com.scbr.actors.LoggerActor;
import com.scbr.actors.SessionReaperActor;
import com.scbr.engine.PipelineOrchestrator;
import com.scbr.engine.RoundResult;
import com.scbr.engine.SpiralConfig;
import com.scbr.http.HttpServer;
import com.scbr.messages.Messages.*;
import com.scbr.reasoning.GeminiReasoningClient;
import com.scbr.reasoning.ReasoningCapability;
import com.scbr.retrieval.DomainClassifier;
import com.scbr.retrieval.LuceneCaseIndex;
import com.scbr.retrieval.RetrievalAssembler;
import com.scbr.retrieval.RetrievalConfig;
import com.scbr.security.PassThroughSecurityGateway;
import com.scbr.session.InMemorySessionStore;
import com.scbr.session.SessionStats;
import com.scbr.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Scanner;
import java.util.UUID;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Spiral CBR Consultation Assistant - HTTP API plus an interactive console session
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);
    private static final int MAX_INPUT_LENGTH = 4000;

    private static volatile ActorRef<ConsultCommand> router;
    private static final CountDownLatch systemReady = new CountDownLatch(1);

    public static void main(String[] args) throws InterruptedException {
        System.out.println("🌀 Initializing Spiral CBR Consultation Assistant...");

        SpiralConfig config = SpiralConfig.load();
        RetrievalConfig retrievalConfig = new RetrievalConfig();
        log.info("⚙️ {}", config);
        log.info("⚙️ {}", retrievalConfig);

        LuceneCaseIndex index;
        try {
            index = LuceneCaseIndex.open(retrievalConfig);
        } catch (IOException e) {
            log.error("❌ Could not open case index at {}", retrievalConfig.indexPath, e);
            System.exit(1);
            return;
        }

        SessionStore store = new InMemorySessionStore(config.sessionCapacity);
        ReasoningCapability reasoning = GeminiReasoningClient.fromEnv();
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(
            store,
            new RetrievalAssembler(index, new DomainClassifier()),
            reasoning,
            new PassThroughSecurityGateway(MAX_INPUT_LENGTH),
            config,
            Clock.systemUTC());

        ActorSystem<Void> system = ActorSystem.create(
            createBehavior(orchestrator, store, config, reasoning.name()),
            "SpiralConsultationSystem");
        system.getWhenTerminated().thenRun(() -> {
            try {
                index.close();
            } catch (IOException e) {
                log.warn("⚠️ Failed to close case index", e);
            }
        });

        if (!systemReady.await(30, TimeUnit.SECONDS)) {
            log.error("❌ Actor system did not start in time");
            system.terminate();
            return;
        }

        startConsole(system, config);
    }

    public static Behavior<Void> createBehavior(PipelineOrchestrator orchestrator, SessionStore store,
                                                SpiralConfig config, String reasoningName) {
        return Behaviors.setup(context -> {
            context.getLog().info("🚀 Starting consultation actors...");

            ActorRef<LogCommand> logger = context.spawn(LoggerActor.create(), "logger");
            ActorRef<ConsultCommand> routerRef = context.spawn(
                ConsultationRouterActor.create(orchestrator, store, logger, config), "consultation-router");
            context.spawn(
                SessionReaperActor.create(store, config.sweepInterval, config.idleTimeout, logger), "session-reaper");

            HttpServer httpServer = new HttpServer(context.getSystem(), routerRef, config, reasoningName);
            httpServer.start(config.httpHost, config.httpPort)
                .whenComplete((binding, throwable) -> {
                    if (throwable == null) {
                        logger.tell(new LogEvent("SYSTEM", "HttpServer",
                            "API ready at http://" + config.httpHost + ":" + config.httpPort));
                    } else {
                        logger.tell(new LogEvent("SYSTEM", "HttpServer",
                            "HTTP server failed to start: " + throwable.getMessage(), "ERROR"));
                    }
                });

            logger.tell(new LogEvent("SYSTEM", "MainSystem", "All actors initialized (reasoning=" + reasoningName + ")"));
            router = routerRef;
            systemReady.countDown();
            return Behaviors.empty();
        });
    }

    private static void startConsole(ActorSystem<Void> system, SpiralConfig config) {
        Scanner scanner = new Scanner(System.in);
        String sessionId = "console-" + UUID.randomUUID().toString().substring(0, 8);
        Duration timeout = config.reasoningTimeout.multipliedBy((long) (config.retryBudget + 1) * 3).plusSeconds(5);

        System.out.println("\n🌀 ============================================");
        System.out.println("🌀 SPIRAL CBR CONSULTATION - CONSOLE");
        System.out.println("🌀 ============================================");
        System.out.println("🌐 HTTP API: http://" + config.httpHost + ":" + config.httpPort + "/api/consult");
        System.out.println("💬 Describe symptoms, tongue and pulse. Commands: 'reset', 'stats', 'quit'\n");

        while (true) {
            System.out.print("\n🩺 [" + sessionId + "] ");
            if (!scanner.hasNextLine()) {
                break;
            }
            String input = scanner.nextLine().trim();

            if (input.equalsIgnoreCase("quit") || input.equalsIgnoreCase("exit")) {
                break;
            }
            if (input.isEmpty()) {
                continue;
            }
            try {
                if (input.equalsIgnoreCase("reset")) {
                    CompletionStage<ResetAck> ack = AskPattern.ask(
                        router, replyTo -> new ResetSession(sessionId, replyTo), timeout, system.scheduler());
                    ResetAck a = ack.toCompletableFuture().get();
                    System.out.println(a.existed ? "🔄 Session cleared." : "🔄 Nothing to clear.");
                } else if (input.equalsIgnoreCase("stats")) {
                    CompletionStage<SessionStats> stats = AskPattern.ask(
                        router, GetStats::new, Duration.ofSeconds(5), system.scheduler());
                    System.out.println("📊 " + stats.toCompletableFuture().get());
                } else {
                    CompletionStage<RoundReply> reply = AskPattern.ask(
                        router, replyTo -> new RunRound(sessionId, input, replyTo), timeout, system.scheduler());
                    printReply(reply.toCompletableFuture().get(timeout.toMillis(), TimeUnit.MILLISECONDS));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ExecutionException | TimeoutException e) {
                log.error("❌ Console request failed", e);
                System.out.println("❌ Request failed, please try again.");
            }
        }

        scanner.close();
        System.out.println("🔄 Shutting down...");
        system.terminate();
    }

    private static void printReply(RoundReply reply) {
        if (reply instanceof RoundCompleted) {
            RoundResult result = ((RoundCompleted) reply).result;
            System.out.println("─".repeat(60));
            System.out.println("🔁 Round " + result.round + " · " + result.status
                + String.format(" · coverage %.2f", result.coverageRatio)
                + (result.converged ? " · converged" : "")
                + (result.isDegraded() ? " · degraded " + result.degradedStages : ""));
            System.out.println(result.displayText());
            System.out.println("─".repeat(60));
        } else if (reply instanceof SessionBusy) {
            System.out.println("⏳ Session busy, retry in " + ((SessionBusy) reply).retryAfterMillis + " ms");
        } else if (reply instanceof RoundFailed) {
            System.out.println("❌ " + ((RoundFailed) reply).reason);
        }
    }
}
