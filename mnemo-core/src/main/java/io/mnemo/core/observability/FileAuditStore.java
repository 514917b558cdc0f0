package io.mnemo.core.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FileAuditStore implements AuditStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileAuditStore.class);

    private final Path path;
    private final ObjectMapper mapper;

    public FileAuditStore(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
    }

    @Override
    public synchronized void append(AuditEvent event) throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        String line = mapper.writeValueAsString(event) + System.lineSeparator();
        Files.writeString(
            path,
            line,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND
        );
    }

    @Override
    public synchronized List<AuditEvent> load() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        List<AuditEvent> events = new ArrayList<>();
        int lineNumber = 0;
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                events.add(mapper.readValue(line, AuditEvent.class));
            } catch (JsonProcessingException e) {
                LOG.warn("Skipping malformed audit line {} in {}", lineNumber, path.getFileName());
            }
        }
        return events;
    }
}
