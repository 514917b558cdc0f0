package io.mnemo.core.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import io.mnemo.core.collaborator.OpenAiCompatClient;
import io.mnemo.core.error.CollaboratorException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class OpenAiEmbeddingProvider implements EmbeddingProvider {
    private final OpenAiCompatClient client;
    private final String model;
    private final int dimensions;

    public OpenAiEmbeddingProvider(OpenAiCompatClient client, String model, int dimensions) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.dimensions = dimensions;
    }

    @Override
    public String modelVersion() {
        return model;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public List<Double> embed(String text) {
        JsonNode root = client.post("embeddings", Map.of("model", model, "input", text == null ? "" : text));
        JsonNode vector = root.path("data").path(0).path("embedding");
        if (!vector.isArray() || vector.isEmpty()) {
            throw new CollaboratorException(client.name(), "response carried no embedding");
        }
        if (dimensions > 0 && vector.size() != dimensions) {
            throw new CollaboratorException(
                client.name(),
                "expected " + dimensions + " dimensions but received " + vector.size()
            );
        }
        List<Double> embedding = new ArrayList<>(vector.size());
        vector.forEach(value -> embedding.add(value.asDouble()));
        return embedding;
    }
}
