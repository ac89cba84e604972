package com.scbr.retrieval;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * RetrievalConfig - Case index settings read from .env
 */
public class RetrievalConfig {
    public final String provider;          // SIMPLE
    public final String indexPath;
    public final boolean rebuildOnStart;
    public final double hybridAlpha;       // weight of the embedding similarity in the blend
    public final String corpusResource;

    public RetrievalConfig() {
        this(Dotenv.configure().ignoreIfMissing().load());
    }

    public RetrievalConfig(Dotenv d) {
        this(d.get("EMBED_PROVIDER", "SIMPLE"),
            d.get("CASE_INDEX_PATH", "target/case-index"),
            Boolean.parseBoolean(d.get("REBUILD_INDEX_ON_START", "false")),
            Double.parseDouble(d.get("HYBRID_ALPHA", "0.5")),
            d.get("CASE_CORPUS_RESOURCE", "/corpus/cases.jsonl"));
    }

    public RetrievalConfig(String provider, String indexPath, boolean rebuildOnStart,
                           double hybridAlpha, String corpusResource) {
        if (hybridAlpha < 0.0 || hybridAlpha > 1.0) {
            throw new IllegalArgumentException("HYBRID_ALPHA must be within [0,1], got " + hybridAlpha);
        }
        this.provider = provider;
        this.indexPath = indexPath;
        this.rebuildOnStart = rebuildOnStart;
        this.hybridAlpha = hybridAlpha;
        this.corpusResource = corpusResource;
    }

    public EmbeddingsClient embeddingsClient() {
        return switch (provider.toUpperCase()) {
            case "SIMPLE" -> new SimpleEmbeddingsClient();
            default -> throw new IllegalArgumentException("Unsupported EMBED_PROVIDER: " + provider);
        };
    }

    @Override
    public String toString() {
        return String.format("RetrievalConfig{provider='%s', indexPath='%s', rebuild=%s, alpha=%.2f, corpus='%s'}",
            provider, indexPath, rebuildOnStart, hybridAlpha, corpusResource);
    }
}
