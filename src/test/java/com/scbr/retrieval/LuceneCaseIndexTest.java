package com.scbr.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.scbr.model.RetrievalPlan;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LuceneCaseIndexTest {

    private LuceneCaseIndex index;
    private int indexed;

    @BeforeEach
    public void setUp() throws IOException {
        index = new LuceneCaseIndex(new ByteBuffersDirectory(), new SimpleEmbeddingsClient(), 0.5);
        try (InputStream corpus = getClass().getResourceAsStream("/corpus/test-cases.jsonl")) {
            assertNotNull(corpus);
            indexed = index.buildIndexFromCorpus(corpus);
        }
        index.openForSearch();
    }

    @AfterEach
    public void tearDown() throws IOException {
        index.close();
    }

    @Test
    public void shouldSkipBrokenCorpusLines() {
        assertEquals(4, indexed);
        assertEquals(4, index.size());
    }

    @Test
    public void shouldReturnBlendedScoresForTermHits() throws IOException {
        List<JsonNode> hits = index.search("失眠 心悸", LuceneCaseIndex.FIELD_SYMPTOM_TERMS, 3);

        assertEquals(3, hits.size());
        Set<String> lexicalIds = hits.stream()
            .filter(h -> h.get("lexical").asDouble() > 0)
            .map(h -> h.get("case_id").asText())
            .collect(Collectors.toSet());
        assertEquals(Set.of("T-001", "T-002"), lexicalIds);
        for (JsonNode hit : hits) {
            double score = hit.get("score").asDouble();
            double expected = 0.5 * hit.get("similarity").asDouble() + 0.5 * hit.get("lexical").asDouble();
            assertEquals(expected, score, 1e-9);
            assertTrue(hit.get("lexical").asDouble() <= 1.0 + 1e-9);
        }
        double first = hits.get(0).get("score").asDouble();
        double last = hits.get(hits.size() - 1).get("score").asDouble();
        assertTrue(first >= last);
    }

    @Test
    public void shouldRespectLimit() throws IOException {
        List<JsonNode> hits = index.search("乏力", LuceneCaseIndex.FIELD_FULL_TEXT, 1);

        assertEquals(1, hits.size());
    }

    @Test
    public void shouldRankChiefComplaintHitFirst() throws IOException {
        List<JsonNode> hits = index.search("胃脹", LuceneCaseIndex.FIELD_CHIEF_COMPLAINT, 3);

        assertEquals(3, hits.size());
        assertEquals("T-003", hits.get(0).get("case_id").asText());
        assertEquals("脾胃虛弱", hits.get(0).get("pattern").asText());
        assertEquals(1.0, hits.get(0).get("lexical").asDouble(), 1e-9);
    }

    @Test
    public void shouldIgnoreUnknownField() throws IOException {
        assertTrue(index.search("失眠", "diagnosis", 3).isEmpty());
    }

    @Test
    public void shouldFillFromVectorsWhenNothingMatchesLexically() throws IOException {
        List<JsonNode> hits = index.search("咳嗽", LuceneCaseIndex.FIELD_SYMPTOM_TERMS, 3);

        assertEquals(3, hits.size());
        for (JsonNode hit : hits) {
            assertEquals(0.0, hit.get("lexical").asDouble(), 1e-9);
            assertEquals(0.5 * hit.get("similarity").asDouble(), hit.get("score").asDouble(), 1e-9);
        }
        assertEquals(4, index.search("咳嗽", LuceneCaseIndex.FIELD_FULL_TEXT, 10).size());
    }

    @Test
    public void shouldAssembleFullCandidateSetFromBundledCorpus() throws IOException {
        try (LuceneCaseIndex bundled = new LuceneCaseIndex(new ByteBuffersDirectory(), new SimpleEmbeddingsClient(), 0.5);
             InputStream corpus = getClass().getResourceAsStream("/corpus/cases.jsonl")) {
            assertNotNull(corpus);
            int size = bundled.buildIndexFromCorpus(corpus);
            bundled.openForSearch();
            RetrievalAssembler assembler = new RetrievalAssembler(bundled, new DomainClassifier());
            RetrievalPlan plan = new RetrievalPlan(Set.of("咳嗽"), Set.of(), Set.of(), Set.of());

            AssembledCandidates result = assembler.assemble("咳嗽", plan, List.of(
                LuceneCaseIndex.FIELD_SYMPTOM_TERMS, LuceneCaseIndex.FIELD_FULL_TEXT,
                LuceneCaseIndex.FIELD_CHIEF_COMPLAINT), 3);

            assertTrue(size >= 3);
            assertEquals(3, result.candidates.size());
            assertFalse(result.retrievalEmpty);
            assertTrue(result.candidates.stream().anyMatch(c -> c.caseId.equals("TCM-010")));
        }
    }
}
