package io.mnemo.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemo.core.collaborator.LlmSummarizer;
import io.mnemo.core.collaborator.OpenAiCompatClient;
import io.mnemo.core.config.ConfigService;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.embedding.HashingEmbeddingProvider;
import io.mnemo.core.observability.FileAuditStore;
import io.mnemo.core.observability.ObservabilityService;
import io.mnemo.core.record.InMemoryRecordStore;
import io.mnemo.core.service.MemoryService;
import io.mnemo.core.service.MemoryServiceFactory;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.Callable;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class QueryCommandIntegrationTest {
    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    private MockWebServer server;
    private MemoryService service;
    private CliContext context;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        OpenAiCompatClient client = new OpenAiCompatClient(
            "summarizer", "sk-test", server.url("/v1").toString(), Duration.ofSeconds(5), 1
        );
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        service = MemoryServiceFactory.create(
            MnemoConfig.defaults(),
            new InMemoryRecordStore(),
            new HashingEmbeddingProvider(),
            new LlmSummarizer(client, "gpt-4.1-mini", 256),
            new ObservabilityService(new FileAuditStore(tempDir.resolve("audit.jsonl")), clock),
            clock
        );
        context = new CliContext(service, new ConfigService(), tempDir.resolve("config.json"));
    }

    @AfterEach
    void tearDown() throws Exception {
        service.close();
        server.shutdown();
    }

    @Test
    void shouldIngestThenQueryUsingHttpSummarizer() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "choices": [
                    { "message": { "content": "integration-ok" } }
                  ]
                }
                """));

        int ingested = run(new IngestCommand(context), new StringBuilder(),
            "alice", "Knee", "pain.", "Doctor", "recommended", "physical", "therapy.",
            "-c", "visit", "--created-at", "2025-01-25T00:00:00Z");
        assertThat(ingested).isZero();

        StringBuilder out = new StringBuilder();
        int code = run(new QueryCommand(context), out, "alice", "knee", "pain", "--floor", "0.0");

        assertThat(code).isZero();
        assertThat(out.toString())
            .contains("Outcome: ACCEPTED")
            .contains("OLD")
            .contains("visit from 2025-01-25 (1 years ago)")
            .contains("Insight: Unfollowed recommendation from 13 months ago: physical therapy.")
            .contains("integration-ok");
        assertThat(server.takeRequest().getPath()).isEqualTo("/v1/chat/completions");
    }

    @Test
    void shouldPrintQueryResultAsJson() throws Exception {
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json")
            .setBody("{ \"choices\": [ { \"message\": { \"content\": \"nothing yet\" } } ] }"));

        StringBuilder out = new StringBuilder();
        int code = run(new QueryCommand(context), out, "bob", "sleep", "--json");

        assertThat(code).isZero();
        assertThat(out.toString()).contains("\"outcome\" : \"ACCEPTED\"").contains("\"trace\"");
    }

    @Test
    void shouldExitWithValidationCodeForBadInput() throws Exception {
        assertThat(run(new QueryCommand(context), new StringBuilder(), "alice", "knee", "-n", "0")).isEqualTo(2);
        assertThat(run(new IngestCommand(context), new StringBuilder(), "bad!owner", "text")).isEqualTo(2);
    }

    @Test
    void shouldPrintSymptomProgression() throws Exception {
        run(new IngestCommand(context), new StringBuilder(), "alice", "Headache", "at", "work",
            "--created-at", "2026-01-01T00:00:00Z");
        run(new IngestCommand(context), new StringBuilder(), "alice", "Headache", "again",
            "--created-at", "2026-01-15T00:00:00Z");
        run(new IngestCommand(context), new StringBuilder(), "alice", "Bad", "headache", "tonight",
            "--created-at", "2026-02-12T00:00:00Z");

        StringBuilder out = new StringBuilder();
        int code = run(new ProgressionCommand(context), out, "alice", "headache", "--window-days", "90");

        assertThat(code).isZero();
        assertThat(out.toString())
            .contains("Occurrences: 3, trend RECURRING")
            .contains("First: 2026-01-01, latest: 2026-02-12, average gap: 21.0 days")
            .contains("+28d");
        assertThat(run(new ProgressionCommand(context), new StringBuilder(), "alice", "headache", "--window-days", "0"))
            .isEqualTo(2);
    }

    @Test
    void shouldRefusePurgeWithoutConfirmation() throws Exception {
        run(new IngestCommand(context), new StringBuilder(), "alice", "Allergic", "to", "penicillin");

        assertThat(run(new PurgeCommand(context), new StringBuilder(), "alice")).isEqualTo(2);
        assertThat(service.count("alice")).isEqualTo(1);

        StringBuilder out = new StringBuilder();
        assertThat(run(new PurgeCommand(context), out, "alice", "--yes")).isZero();
        assertThat(out.toString()).contains("Deleted 1 records");
        assertThat(service.count("alice")).isZero();
    }

    @Test
    void shouldOnboardConfigAndDataDirectory() throws Exception {
        StringBuilder first = new StringBuilder();
        StringBuilder second = new StringBuilder();

        assertThat(run(new OnboardCommand(context), first)).isZero();
        assertThat(run(new OnboardCommand(context), second)).isZero();

        assertThat(first.toString()).contains("Created config: ").contains("Data directory ready: ");
        assertThat(second.toString()).contains("Refreshed config with new defaults: ");
        assertThat(Files.exists(tempDir.resolve("config.json"))).isTrue();
    }

    private int run(Callable<Integer> command, StringBuilder sink, String... args) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            return new CommandLine(command).execute(args);
        } finally {
            System.setOut(originalOut);
            sink.append(out.toString(StandardCharsets.UTF_8));
        }
    }
}
