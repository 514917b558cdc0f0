package io.mnemo.core.collaborator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mnemo.core.error.CollaboratorException;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class OpenAiCompatClient {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiCompatClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final int maxAttempts;

    public OpenAiCompatClient(String name, String apiKey, String apiBase, Duration readTimeout, int maxAttempts) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.maxAttempts = Math.max(1, maxAttempts);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(readTimeout == null ? Duration.ofSeconds(30) : readTimeout)
            .writeTimeout(Duration.ofSeconds(10))
            .build();
        this.mapper = new ObjectMapper();
    }

    public String name() {
        return name;
    }

    public JsonNode post(String path, Map<String, Object> payload) {
        long delayMs = 250;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Response response = client.newCall(buildRequest(path, payload)).execute()) {
                if (!response.isSuccessful()) {
                    String errorBody = response.body() == null ? "" : response.body().string();
                    boolean retryable = response.code() == 429 || response.code() >= 500;
                    if (retryable && attempt < maxAttempts) {
                        LOG.debug("{} returned HTTP {}, retrying (attempt {})", name, response.code(), attempt);
                        sleep(delayMs);
                        delayMs = Math.min(delayMs * 2, 2000);
                        continue;
                    }
                    throw new CollaboratorException(name, "HTTP " + response.code() + " " + truncate(errorBody, 300));
                }
                ResponseBody body = response.body();
                if (body == null) {
                    throw new CollaboratorException(name, "empty response body");
                }
                return mapper.readTree(body.string());
            } catch (IOException e) {
                if (attempt < maxAttempts) {
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, 2000);
                    continue;
                }
                throw new CollaboratorException(name, "request failed: " + e.getMessage(), e);
            }
        }
        throw new CollaboratorException(name, "exhausted retries");
    }

    private Request buildRequest(String path, Map<String, Object> payload) throws IOException {
        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        Request.Builder builder = new Request.Builder()
            .url(resolve(path))
            .post(body)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json");
        if (!apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }

    private HttpUrl resolve(String path) {
        HttpUrl.Builder builder = apiBase.newBuilder();
        for (String segment : path.split("/")) {
            if (!segment.isBlank()) {
                builder.addPathSegment(segment);
            }
        }
        return builder.build();
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException(name, "interrupted while backing off", e);
        }
    }

    private String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() <= max ? value : value.substring(0, max) + "...";
    }
}
