package com.scbr.actors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scbr.engine.PipelineOrchestrator;
import com.scbr.engine.SpiralConfig;
import com.scbr.reasoning.ReasoningCapability;
import com.scbr.reasoning.ReasoningResult;
import com.scbr.reasoning.ScriptedReasoning;
import com.scbr.retrieval.DomainClassifier;
import com.scbr.retrieval.HybridSearchCapability;
import com.scbr.retrieval.RetrievalAssembler;
import com.scbr.security.PassThroughSecurityGateway;
import com.scbr.session.SessionStore;
import com.typesafe.config.ConfigFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

final class ActorFixtures {

    static final String INPUT = "心悸失眠，舌淡，脈細";

    static SpiralConfig config() {
        return new SpiralConfig(ConfigFactory.load());
    }

    static PipelineOrchestrator orchestrator(SessionStore store, ReasoningCapability reasoning) throws IOException {
        ObjectNode record = new ObjectMapper().createObjectNode();
        record.put("case_id", "C2");
        record.put("pattern", "心血虛");
        record.put("summary", "心血不足");
        record.put("domain", "general");
        record.putArray("symptom_terms").add("心悸").add("失眠");
        record.putArray("tongue_pulse_terms").add("舌淡").add("脈細");
        record.put("score", 0.8);

        HybridSearchCapability search = mock(HybridSearchCapability.class);
        when(search.search(anyString(), anyString(), anyInt())).thenReturn(List.<JsonNode>of(record));
        return new PipelineOrchestrator(store, new RetrievalAssembler(search, new DomainClassifier()),
            reasoning, new PassThroughSecurityGateway(4000), config(), Clock.systemUTC());
    }

    /** Gate reply that holds the round until the latch opens. */
    static Function<ObjectNode, ReasoningResult> blockUntil(CountDownLatch latch) {
        return context -> {
            try {
                if (!latch.await(10, TimeUnit.SECONDS)) {
                    return ReasoningResult.timeout("test latch never opened");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ReasoningResult.timeout("interrupted");
            }
            return ScriptedReasoning.json("{\"action\":\"proceed\"}");
        };
    }

    private ActorFixtures() {}
}
