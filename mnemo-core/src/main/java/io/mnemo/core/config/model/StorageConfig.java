package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    String backend,
    @JsonAlias({"sqlite_path"}) String sqlitePath,
    @JsonAlias({"audit_path"}) String auditPath,
    @JsonAlias({"lock_timeout_ms"}) long lockTimeoutMs,
    @JsonAlias({"lock_attempts"}) int lockAttempts
) {

    public static StorageConfig defaults() {
        return new StorageConfig("sqlite", "data/records.db", "data/audit-events.jsonl", 2_000, 3);
    }
}
