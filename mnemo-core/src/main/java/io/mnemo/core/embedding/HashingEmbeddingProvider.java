package io.mnemo.core.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class HashingEmbeddingProvider implements EmbeddingProvider {
    public static final int DEFAULT_DIMENSIONS = 256;

    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "the", "and", "or", "is", "are", "was", "were", "to", "of", "in", "for", "on", "with",
        "at", "by", "from", "it", "this", "that", "these", "those", "be", "been", "being", "as", "if", "but",
        "not", "no", "you", "your", "we", "our", "they", "their", "he", "she", "his", "her", "my", "me", "i",
        "has", "have", "had", "again", "after", "before", "very", "some", "any"
    );

    private final int dimensions;

    public HashingEmbeddingProvider() {
        this(DEFAULT_DIMENSIONS);
    }

    public HashingEmbeddingProvider(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be > 0");
        }
        this.dimensions = dimensions;
    }

    @Override
    public String modelVersion() {
        return "hashing-v1-" + dimensions;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public List<Double> embed(String text) {
        double[] vector = new double[dimensions];
        for (String token : tokenize(text)) {
            vector[Math.floorMod(token.hashCode(), dimensions)] += 1.0;
        }

        double norm = 0.0;
        for (double value : vector) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);

        List<Double> embedding = new ArrayList<>(dimensions);
        for (double value : vector) {
            embedding.add(norm == 0.0 ? 0.0 : value / norm);
        }
        return embedding;
    }

    static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String[] raw = text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+");
        List<String> out = new ArrayList<>();
        for (String token : raw) {
            if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                out.add(token);
            }
        }
        return out;
    }
}
