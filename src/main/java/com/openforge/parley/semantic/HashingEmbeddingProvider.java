package com.openforge.parley.semantic;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Local, deterministic embedding: signed feature hashing of word tokens and
 * character trigrams, L2-normalised.
 *
 * Cosine similarity between two such vectors approximates weighted lexical
 * overlap with some tolerance for misspellings. Requires no model files and
 * no network, so it is the default provider and the one used in tests.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+");

    private static final float TOKEN_WEIGHT   = 2.0f;
    private static final float TRIGRAM_WEIGHT = 1.0f;

    private final int dimensions;

    public HashingEmbeddingProvider(int dimensions) {
        if (dimensions < 16) {
            throw new IllegalArgumentException("dimensions must be >= 16, got " + dimensions);
        }
        this.dimensions = dimensions;
    }

    @Override
    public List<Float> embed(String text) {
        float[] vector = new float[dimensions];
        if (text != null) {
            Matcher m = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
            while (m.find()) {
                String token = m.group();
                add(vector, "w:" + token, TOKEN_WEIGHT);
                String padded = "#" + token + "#";
                for (int i = 0; i + 3 <= padded.length(); i++) {
                    add(vector, "c:" + padded.substring(i, i + 3), TRIGRAM_WEIGHT);
                }
            }
        }
        normalize(vector);

        List<Float> out = new ArrayList<>(dimensions);
        for (float f : vector) out.add(f);
        return out;
    }

    @Override
    public String name() {
        return "hashing-" + dimensions;
    }

    private void add(float[] vector, String feature, float weight) {
        int h = mix(feature.hashCode());
        int index = Math.floorMod(h, dimensions);
        // an independent bit decides the sign so collisions cancel on average
        float sign = ((h >>> 16) & 1) == 0 ? 1f : -1f;
        vector[index] += sign * weight;
    }

    private static void normalize(float[] vector) {
        double sum = 0;
        for (float f : vector) sum += (double) f * f;
        if (sum == 0) return;
        float norm = (float) Math.sqrt(sum);
        for (int i = 0; i < vector.length; i++) vector[i] /= norm;
    }

    /** murmur3 finaliser; String.hashCode alone clusters short features. */
    private static int mix(int h) {
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }
}
