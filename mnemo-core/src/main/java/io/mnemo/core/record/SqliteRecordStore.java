package io.mnemo.core.record;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public final class SqliteRecordStore implements RecordStore {
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {
    };
    private static final TypeReference<List<Double>> DOUBLES = new TypeReference<>() {
    };
    private static final String COLUMNS = """
        id, owner_id, text, category, tags_json, embedding_json, created_at,
        access_count, memory_weight, reinforcement_level, last_accessed_at, last_decayed_at
        """;

    private final String jdbcUrl;
    private final ObjectMapper mapper;

    public SqliteRecordStore(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.mapper = new ObjectMapper();
        init();
    }

    @Override
    public synchronized MemoryRecord insert(MemoryRecord record) throws IOException {
        String sql = "INSERT INTO memory_records (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, record.id());
            statement.setString(2, record.ownerId());
            statement.setString(3, record.content().text());
            statement.setString(4, record.content().category());
            statement.setString(5, mapper.writeValueAsString(record.content().tags()));
            statement.setString(6, mapper.writeValueAsString(record.embedding()));
            statement.setLong(7, record.createdAt().toEpochMilli());
            statement.setInt(8, record.accessCount());
            statement.setDouble(9, record.memoryWeight());
            statement.setInt(10, record.reinforcementLevel());
            setInstant(statement, 11, record.lastAccessedAt());
            setInstant(statement, 12, record.lastDecayedAt());
            statement.executeUpdate();
            return record;
        } catch (SQLException e) {
            throw new IOException("Failed to insert record " + record.id(), e);
        }
    }

    @Override
    public synchronized MemoryRecord update(MemoryRecord record) throws IOException {
        String sql = """
            UPDATE memory_records
            SET access_count = ?, memory_weight = ?, reinforcement_level = ?, last_accessed_at = ?, last_decayed_at = ?
            WHERE owner_id = ? AND id = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setInt(1, record.accessCount());
            statement.setDouble(2, record.memoryWeight());
            statement.setInt(3, record.reinforcementLevel());
            setInstant(statement, 4, record.lastAccessedAt());
            setInstant(statement, 5, record.lastDecayedAt());
            statement.setString(6, record.ownerId());
            statement.setString(7, record.id());
            if (statement.executeUpdate() == 0) {
                throw new IOException("Record " + record.id() + " not found");
            }
        } catch (SQLException e) {
            throw new IOException("Failed to update record " + record.id(), e);
        }
        return find(record.ownerId(), record.id())
            .orElseThrow(() -> new IOException("Record " + record.id() + " vanished during update"));
    }

    @Override
    public Optional<MemoryRecord> find(String ownerId, String recordId) throws IOException {
        String sql = "SELECT " + COLUMNS + " FROM memory_records WHERE owner_id = ? AND id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, ownerId);
            statement.setString(2, recordId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(map(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load record " + recordId, e);
        }
    }

    @Override
    public List<MemoryRecord> findByOwner(String ownerId) throws IOException {
        String sql = "SELECT " + COLUMNS + " FROM memory_records WHERE owner_id = ? ORDER BY created_at ASC, id ASC";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, ownerId);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<MemoryRecord> records = new ArrayList<>();
                while (resultSet.next()) {
                    records.add(map(resultSet));
                }
                records.sort(Comparator.comparing(MemoryRecord::createdAt).thenComparing(MemoryRecord::id));
                return records;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list records for owner", e);
        }
    }

    @Override
    public synchronized int deleteByOwner(String ownerId) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM memory_records WHERE owner_id = ?")) {
            statement.setString(1, ownerId);
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to purge records for owner", e);
        }
    }

    @Override
    public int count(String ownerId) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("SELECT COUNT(*) FROM memory_records WHERE owner_id = ?")) {
            statement.setString(1, ownerId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? resultSet.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to count records for owner", e);
        }
    }

    private MemoryRecord map(ResultSet resultSet) throws SQLException, IOException {
        RecordContent content = new RecordContent(
            resultSet.getString("text"),
            resultSet.getString("category"),
            mapper.readValue(resultSet.getString("tags_json"), STRINGS)
        );
        return new MemoryRecord(
            resultSet.getString("id"),
            resultSet.getString("owner_id"),
            content,
            mapper.readValue(resultSet.getString("embedding_json"), DOUBLES),
            Instant.ofEpochMilli(resultSet.getLong("created_at")),
            resultSet.getInt("access_count"),
            resultSet.getDouble("memory_weight"),
            resultSet.getInt("reinforcement_level"),
            getInstant(resultSet, "last_accessed_at"),
            getInstant(resultSet, "last_decayed_at")
        );
    }

    private void setInstant(PreparedStatement statement, int index, Instant value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setLong(index, value.toEpochMilli());
        }
    }

    private Instant getInstant(ResultSet resultSet, String column) throws SQLException {
        long value = resultSet.getLong(column);
        return resultSet.wasNull() ? null : Instant.ofEpochMilli(value);
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
            statement.execute("PRAGMA busy_timeout=5000;");
        }
        return connection;
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS memory_records (
                id TEXT PRIMARY KEY,
                owner_id TEXT NOT NULL,
                text TEXT NOT NULL,
                category TEXT NOT NULL,
                tags_json TEXT NOT NULL,
                embedding_json TEXT NOT NULL,
                created_at INTEGER NOT NULL,
                access_count INTEGER NOT NULL DEFAULT 0,
                memory_weight REAL NOT NULL DEFAULT 1.0,
                reinforcement_level INTEGER NOT NULL DEFAULT 0,
                last_accessed_at INTEGER,
                last_decayed_at INTEGER
            )
            """;
        String idx = """
            CREATE INDEX IF NOT EXISTS idx_memory_records_owner_created
            ON memory_records(owner_id, created_at)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite record store", e);
        }
    }
}
