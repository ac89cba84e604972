package com.scbr.retrieval;

import java.nio.charset.StandardCharsets;

/**
 * SimpleEmbeddingsClient - Offline hashed embedding over CJK character bigrams.
 * Deterministic, 384 dimensions, L2 normalized. Latin words hash as whole tokens.
 */
public class SimpleEmbeddingsClient implements EmbeddingsClient {

    private static final int DIMS = 384;

    @Override
    public float[] embed(String text) {
        float[] vector = new float[DIMS];
        if (text == null || text.isBlank()) {
            return vector;
        }

        StringBuilder word = new StringBuilder();
        int prevCjk = -1;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            i += Character.charCount(cp);

            if (isCjk(cp)) {
                flushWord(word, vector);
                // unigram plus bigram with the previous ideograph
                addToken(new String(Character.toChars(cp)), vector, 0.5f);
                if (prevCjk >= 0) {
                    addToken(new String(Character.toChars(prevCjk)) + new String(Character.toChars(cp)), vector, 1.0f);
                }
                prevCjk = cp;
            } else if (Character.isLetterOrDigit(cp)) {
                word.appendCodePoint(Character.toLowerCase(cp));
                prevCjk = -1;
            } else {
                flushWord(word, vector);
                prevCjk = -1;
            }
        }
        flushWord(word, vector);

        double norm = 0.0;
        for (float x : vector) {
            norm += x * x;
        }
        if (norm == 0.0) {
            return vector;
        }
        norm = Math.sqrt(norm);
        for (int i = 0; i < DIMS; i++) {
            vector[i] /= (float) norm;
        }
        return vector;
    }

    private static void flushWord(StringBuilder word, float[] vector) {
        if (word.length() > 0) {
            addToken(word.toString(), vector, 1.0f);
            word.setLength(0);
        }
    }

    private static void addToken(String token, float[] vector, float weight) {
        int hash = murmur32(token.getBytes(StandardCharsets.UTF_8));
        vector[Math.floorMod(hash, DIMS)] += weight;
    }

    private static boolean isCjk(int cp) {
        Character.UnicodeScript script = Character.UnicodeScript.of(cp);
        return script == Character.UnicodeScript.HAN;
    }

    @Override
    public int dimensions() {
        return DIMS;
    }

    @Override
    public String name() {
        return "SIMPLE";
    }

    private static int murmur32(byte[] data) {
        int h = 0x9747b28c;
        int len = data.length;
        int i = 0;

        while (len >= 4) {
            int k = (data[i] & 0xff) | ((data[i + 1] & 0xff) << 8)
                | ((data[i + 2] & 0xff) << 16) | ((data[i + 3] & 0xff) << 24);
            k *= 0x5bd1e995;
            k ^= k >>> 24;
            k *= 0x5bd1e995;
            h *= 0x5bd1e995;
            h ^= k;
            i += 4;
            len -= 4;
        }

        if (len == 3) {
            h ^= (data[i + 2] & 0xff) << 16;
        }
        if (len >= 2) {
            h ^= (data[i + 1] & 0xff) << 8;
        }
        if (len >= 1) {
            h ^= data[i] & 0xff;
            h *= 0x5bd1e995;
        }

        h ^= h >>> 13;
        h *= 0x5bd1e995;
        h ^= h >>> 15;
        return h;
    }
}
