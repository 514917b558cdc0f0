package io.mnemo.core.embedding;

import java.util.List;

public interface EmbeddingProvider {
    String modelVersion();

    int dimensions();

    List<Double> embed(String text);
}
