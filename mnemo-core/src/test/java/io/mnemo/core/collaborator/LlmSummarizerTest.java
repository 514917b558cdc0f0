package io.mnemo.core.collaborator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mnemo.core.error.CollaboratorException;
import io.mnemo.core.ranking.AgeBucket;
import io.mnemo.core.ranking.RankedCandidate;
import io.mnemo.core.record.MemoryRecord;
import io.mnemo.core.record.RecordContent;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LlmSummarizerTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldSendCandidatesAndParseCompletion() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                { "choices": [ { "message": { "content": "  Two related knee records.  " } } ] }
                """));
        LlmSummarizer summarizer = new LlmSummarizer(client(1), "gpt-4o-mini", 256);
        MemoryRecord record = MemoryRecord.create("r1", "alice", new RecordContent("Knee pain", "symptom", List.of()),
            List.of(1.0), Instant.parse("2025-01-15T00:00:00Z"));
        RankedCandidate candidate = new RankedCandidate(record, 0.9, 0.1, 0.8, 0.8, 400, AgeBucket.OLD);

        String summary = summarizer.summarize("knee pain", List.of(candidate), List.of());

        assertThat(summary).isEqualTo("Two related knee records.");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        String body = request.getBody().readUtf8();
        assertThat(body).contains("\"model\":\"gpt-4o-mini\"");
        assertThat(body).contains("\"max_tokens\":256");
        assertThat(body).contains("2025-01-15 [symptom, old] Knee pain");
    }

    @Test
    void shouldRetryServerErrorsThenSucceed() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse().setBody("{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}"));

        String summary = new LlmSummarizer(client(2), "gpt-4o-mini", 0).summarize("knee", List.of(), List.of());

        assertThat(summary).isEqualTo("ok");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void shouldFailOnEmptyCompletionOrClientError() {
        server.enqueue(new MockResponse().setBody("{\"choices\":[{\"message\":{\"content\":\"\"}}]}"));
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"bad key\"}"));
        LlmSummarizer summarizer = new LlmSummarizer(client(3), "gpt-4o-mini", 256);

        assertThatThrownBy(() -> summarizer.summarize("knee", List.of(), List.of()))
            .isInstanceOf(CollaboratorException.class)
            .hasMessageContaining("no content");
        assertThatThrownBy(() -> summarizer.summarize("knee", List.of(), List.of()))
            .isInstanceOf(CollaboratorException.class)
            .hasMessageContaining("HTTP 401");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    private OpenAiCompatClient client(int attempts) {
        return new OpenAiCompatClient("summarizer", "sk-test", server.url("/v1").toString(), Duration.ofSeconds(5), attempts);
    }
}
