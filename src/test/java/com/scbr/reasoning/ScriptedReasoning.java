package com.scbr.reasoning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scbr.engine.Stage;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Test reasoning capability: queued replies per stage first, then a per-stage default, then the
 * offline capability.
 */
public class ScriptedReasoning implements ReasoningCapability {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<Stage, Deque<Function<ObjectNode, ReasoningResult>>> queued = new EnumMap<>(Stage.class);
    private final Map<Stage, Function<ObjectNode, ReasoningResult>> defaults = new EnumMap<>(Stage.class);
    private final Map<Stage, Integer> calls = new EnumMap<>(Stage.class);
    private final OfflineReasoningCapability offline = new OfflineReasoningCapability();

    public static ReasoningResult json(String body) {
        try {
            return ReasoningResult.ok(MAPPER.readTree(body));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("bad test JSON: " + body, e);
        }
    }

    public ScriptedReasoning then(Stage stage, ReasoningResult result) {
        return then(stage, context -> result);
    }

    public synchronized ScriptedReasoning then(Stage stage, Function<ObjectNode, ReasoningResult> reply) {
        queued.computeIfAbsent(stage, s -> new ArrayDeque<>()).add(reply);
        return this;
    }

    public synchronized ScriptedReasoning always(Stage stage, Function<ObjectNode, ReasoningResult> reply) {
        defaults.put(stage, reply);
        return this;
    }

    public synchronized int calls(Stage stage) {
        return calls.getOrDefault(stage, 0);
    }

    @Override
    public ReasoningResult call(Stage stage, ObjectNode context, Duration timeout) {
        // replies may block, so they run outside the lock
        Function<ObjectNode, ReasoningResult> reply = next(stage);
        return reply != null ? reply.apply(context) : offline.call(stage, context, timeout);
    }

    private synchronized Function<ObjectNode, ReasoningResult> next(Stage stage) {
        calls.merge(stage, 1, Integer::sum);
        Deque<Function<ObjectNode, ReasoningResult>> queue = queued.get(stage);
        if (queue != null && !queue.isEmpty()) {
            return queue.poll();
        }
        return defaults.get(stage);
    }

    @Override
    public String name() {
        return "Scripted";
    }
}
