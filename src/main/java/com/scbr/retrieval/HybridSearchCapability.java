package com.scbr.retrieval;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.List;

/**
 * HybridSearchCapability - Ranked lexical + semantic search over the case corpus.
 *
 * <p>Records come back best-first and carry {@code similarity}, {@code lexical} and
 * {@code score} next to the case fields. No hits is an empty list, never null.</p>
 */
public interface HybridSearchCapability {

    List<JsonNode> search(String query, String field, int limit) throws IOException;
}
