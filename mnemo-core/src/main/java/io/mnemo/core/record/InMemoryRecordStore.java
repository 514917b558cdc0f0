package io.mnemo.core.record;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryRecordStore implements RecordStore {
    private final Map<String, Map<String, MemoryRecord>> byOwner = new ConcurrentHashMap<>();

    @Override
    public MemoryRecord insert(MemoryRecord record) {
        byOwner.compute(record.ownerId(), (owner, records) -> {
            Map<String, MemoryRecord> target = records == null ? new ConcurrentHashMap<>() : records;
            if (target.putIfAbsent(record.id(), record) != null) {
                throw new IllegalStateException("Record " + record.id() + " already exists");
            }
            return target;
        });
        return record;
    }

    @Override
    public MemoryRecord update(MemoryRecord record) throws IOException {
        Map<String, MemoryRecord> records = byOwner.get(record.ownerId());
        if (records == null) {
            throw new IOException("Record " + record.id() + " not found");
        }
        MemoryRecord merged = records.computeIfPresent(record.id(), (id, stored) -> new MemoryRecord(
            stored.id(),
            stored.ownerId(),
            stored.content(),
            stored.embedding(),
            stored.createdAt(),
            record.accessCount(),
            record.memoryWeight(),
            record.reinforcementLevel(),
            record.lastAccessedAt(),
            record.lastDecayedAt()
        ));
        if (merged == null) {
            throw new IOException("Record " + record.id() + " not found");
        }
        return merged;
    }

    @Override
    public Optional<MemoryRecord> find(String ownerId, String recordId) {
        Map<String, MemoryRecord> records = byOwner.get(ownerId);
        return records == null ? Optional.empty() : Optional.ofNullable(records.get(recordId));
    }

    @Override
    public List<MemoryRecord> findByOwner(String ownerId) {
        Map<String, MemoryRecord> records = byOwner.get(ownerId);
        if (records == null) {
            return List.of();
        }
        return records.values().stream()
            .sorted(Comparator.comparing(MemoryRecord::createdAt).thenComparing(MemoryRecord::id))
            .toList();
    }

    @Override
    public int deleteByOwner(String ownerId) {
        Map<String, MemoryRecord> removed = byOwner.remove(ownerId);
        return removed == null ? 0 : removed.size();
    }

    @Override
    public int count(String ownerId) {
        Map<String, MemoryRecord> records = byOwner.get(ownerId);
        return records == null ? 0 : records.size();
    }
}
