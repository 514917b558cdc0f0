package io.mnemo.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.mnemo.core.config.model.MnemoConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public MnemoConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return MnemoConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(MnemoConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        return mapper.treeToValue(deepMerge(defaultsNode, existingNode), MnemoConfig.class);
    }

    public void save(Path configPath, MnemoConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        Files.writeString(configPath, toPrettyJson(config) + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        MnemoConfig config = created || overwrite ? MnemoConfig.defaults() : load(configPath);
        save(configPath, config);

        Path dataDirectory = dataDirectory(config, configPath);
        Files.createDirectories(dataDirectory);
        return new OnboardResult(configPath, dataDirectory, created, !created && overwrite);
    }

    public String toPrettyJson(MnemoConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    static Path dataDirectory(MnemoConfig config, Path configPath) {
        Path base = configPath.toAbsolutePath().getParent();
        String sqlitePath = config.storage().sqlitePath();
        if (sqlitePath == null || sqlitePath.isBlank()) {
            return base.resolve("data");
        }
        return ConfigPaths.resolve(sqlitePath, base).toAbsolutePath().getParent();
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null || override.isNull()) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry ->
            merged.set(entry.getKey(), deepMerge(merged.get(entry.getKey()), entry.getValue()))
        );
        return merged;
    }
}
