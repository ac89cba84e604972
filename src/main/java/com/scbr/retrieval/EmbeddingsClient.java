package com.scbr.retrieval;

/**
 * EmbeddingsClient - Text to vector, used for the semantic half of hybrid search
 */
public interface EmbeddingsClient {

    float[] embed(String text);

    int dimensions();

    /** Provider identifier as configured by {@code EMBED_PROVIDER}. */
    String name();
}
