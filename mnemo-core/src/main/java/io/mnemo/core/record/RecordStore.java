package io.mnemo.core.record;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface RecordStore extends AutoCloseable {
    MemoryRecord insert(MemoryRecord record) throws IOException;

    // Only the retrieval state is replaced; owner, content, embedding and createdAt stay as stored.
    MemoryRecord update(MemoryRecord record) throws IOException;

    Optional<MemoryRecord> find(String ownerId, String recordId) throws IOException;

    List<MemoryRecord> findByOwner(String ownerId) throws IOException;

    int deleteByOwner(String ownerId) throws IOException;

    default List<MemoryRecord> findByOwner(String ownerId, RecordFilter filter) throws IOException {
        RecordFilter safe = filter == null ? RecordFilter.ALL : filter;
        return findByOwner(ownerId).stream().filter(safe::matches).toList();
    }

    default int count(String ownerId) throws IOException {
        return findByOwner(ownerId).size();
    }

    @Override
    default void close() throws IOException {
    }
}
