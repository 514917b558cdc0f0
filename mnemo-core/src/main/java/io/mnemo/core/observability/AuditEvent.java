package io.mnemo.core.observability;

import java.time.Instant;
import java.util.Map;

public record AuditEvent(
    String id,
    Instant timestamp,
    String type,
    String ownerId,
    Map<String, Object> attributes
) {
    public static final String RECORD_INGESTED = "record_ingested";
    public static final String QUERY_COMPLETED = "query_completed";
    public static final String MAINTENANCE_COMPLETED = "maintenance_completed";
    public static final String OWNER_PURGED = "owner_purged";

    public AuditEvent {
        id = id == null ? "" : id.trim();
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
        type = type == null ? "" : type.trim();
        ownerId = ownerId == null ? "" : ownerId.trim();
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
