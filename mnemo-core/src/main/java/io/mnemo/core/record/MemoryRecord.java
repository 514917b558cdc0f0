package io.mnemo.core.record;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record MemoryRecord(
    String id,
    String ownerId,
    RecordContent content,
    List<Double> embedding,
    Instant createdAt,
    int accessCount,
    double memoryWeight,
    int reinforcementLevel,
    Instant lastAccessedAt,
    Instant lastDecayedAt
) {
    public static final double INITIAL_WEIGHT = 1.0;

    public MemoryRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        content = content == null ? RecordContent.text("") : content;
        embedding = embedding == null ? List.of() : List.copyOf(embedding);
        if (accessCount < 0) {
            throw new IllegalArgumentException("accessCount must be >= 0");
        }
        if (reinforcementLevel < 0) {
            throw new IllegalArgumentException("reinforcementLevel must be >= 0");
        }
        if (!(memoryWeight > 0) || Double.isInfinite(memoryWeight)) {
            throw new IllegalArgumentException("memoryWeight must be a positive finite number");
        }
    }

    public static MemoryRecord create(
        String id,
        String ownerId,
        RecordContent content,
        List<Double> embedding,
        Instant createdAt
    ) {
        return new MemoryRecord(id, ownerId, content, embedding, createdAt, 0, INITIAL_WEIGHT, 0, null, null);
    }

    public MemoryRecord withReinforcement(int newAccessCount, double newWeight, int newLevel, Instant accessedAt) {
        return new MemoryRecord(
            id,
            ownerId,
            content,
            embedding,
            createdAt,
            newAccessCount,
            newWeight,
            newLevel,
            accessedAt,
            lastDecayedAt
        );
    }

    public MemoryRecord withDecay(double newWeight, Instant decayedAt) {
        return new MemoryRecord(
            id,
            ownerId,
            content,
            embedding,
            createdAt,
            accessCount,
            newWeight,
            reinforcementLevel,
            lastAccessedAt,
            decayedAt
        );
    }

    public long ageDays(Instant asOf) {
        if (asOf == null || !asOf.isAfter(createdAt)) {
            return 0;
        }
        return Duration.between(createdAt, asOf).toDays();
    }

    public String text() {
        return content.text();
    }
}
