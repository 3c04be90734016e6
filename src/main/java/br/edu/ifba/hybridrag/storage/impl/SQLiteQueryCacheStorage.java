package br.edu.ifba.hybridrag.storage.impl;

import br.edu.ifba.hybridrag.core.CitationMapping;
import br.edu.ifba.hybridrag.core.ContextSnapshot;
import br.edu.ifba.hybridrag.core.QueryCacheEntry;
import br.edu.ifba.hybridrag.storage.QueryCacheStorage;
import br.edu.ifba.hybridrag.utils.EmbeddingUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.jboss.logging.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * SQLite-based implementation of QueryCacheStorage.
 *
 * <p>Citations and the response context are stored as JSON text columns; the query
 * embedding as a float32 BLOB. Nearest-neighbour lookup is an exact cosine scan.</p>
 */
public final class SQLiteQueryCacheStorage implements QueryCacheStorage {

    private static final Logger LOG = Logger.getLogger(SQLiteQueryCacheStorage.class);

    private static final TypeReference<List<CitationMapping>> CITATIONS_TYPE = new TypeReference<>() { };

    private static final String SELECT_ENTRY = """
        SELECT id, query_text, query_embedding, answer_text, citations, context_json,
               low_confidence, hit_count, created_at
        FROM query_cache
        """;

    private final SQLiteConnectionManager connectionManager;
    private final ObjectMapper objectMapper;

    public SQLiteQueryCacheStorage(SQLiteConnectionManager connectionManager, ObjectMapper objectMapper) {
        this.connectionManager = connectionManager;
        this.objectMapper = objectMapper;
    }

    @Override
    public CompletableFuture<QueryCacheEntry> insert(@NotNull QueryCacheEntry entry) {
        return CompletableFuture.supplyAsync(() -> {
            String sql = """
                INSERT INTO query_cache (query_text, query_embedding, answer_text, citations,
                                         context_json, low_confidence, hit_count, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

            Instant createdAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                stmt.setString(1, entry.queryText());
                stmt.setBytes(2, EmbeddingUtil.toBytes(entry.embedding()));
                stmt.setString(3, entry.answerText());
                stmt.setString(4, toJson(entry.citations()));
                stmt.setString(5, toJson(entry.context()));
                stmt.setInt(6, entry.lowConfidence() ? 1 : 0);
                stmt.setLong(7, entry.hitCount());
                stmt.setString(8, SQLiteTimestamps.format(createdAt));
                stmt.executeUpdate();

                try (ResultSet keys = stmt.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new SQLException("No id generated for query cache entry");
                    }
                    long id = keys.getLong(1);
                    LOG.debugf("Stored query cache entry %d", id);
                    return new QueryCacheEntry(id, entry.queryText(), entry.embedding(), entry.answerText(),
                        entry.citations(), entry.context(), entry.lowConfidence(), entry.hitCount(), createdAt);
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to store query cache entry", e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Optional<CacheMatch>> findNearest(@NotNull float[] embedding) {
        return CompletableFuture.supplyAsync(() -> {
            long bestId = -1;
            double bestSimilarity = Double.NEGATIVE_INFINITY;

            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT id, query_embedding FROM query_cache ORDER BY id");
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    float[] stored = EmbeddingUtil.fromBytes(rs.getBytes("query_embedding"));
                    if (stored.length != embedding.length) {
                        continue;
                    }
                    double similarity = EmbeddingUtil.cosineSimilarity(embedding, stored);
                    // strict comparison keeps the oldest entry on ties
                    if (similarity > bestSimilarity) {
                        bestSimilarity = similarity;
                        bestId = rs.getLong("id");
                    }
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to scan query cache", e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }

            if (bestId < 0) {
                return Optional.empty();
            }
            final double similarity = bestSimilarity;
            return loadById(bestId).map(entry -> new CacheMatch(entry, similarity));
        });
    }

    @Override
    public CompletableFuture<Long> incrementHitCount(long id) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement update = conn.prepareStatement(
                    "UPDATE query_cache SET hit_count = hit_count + 1 WHERE id = ?");
                 PreparedStatement select = conn.prepareStatement(
                    "SELECT hit_count FROM query_cache WHERE id = ?")) {
                update.setLong(1, id);
                if (update.executeUpdate() == 0) {
                    throw new IllegalStateException("Query cache entry " + id + " does not exist");
                }
                select.setLong(1, id);
                try (ResultSet rs = select.executeQuery()) {
                    rs.next();
                    return rs.getLong(1);
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to increment hit count for entry " + id, e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Optional<QueryCacheEntry>> findById(long id) {
        return CompletableFuture.supplyAsync(() -> loadById(id));
    }

    @Override
    public CompletableFuture<Boolean> exists(long id) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement("SELECT 1 FROM query_cache WHERE id = ?")) {
                stmt.setLong(1, id);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next();
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to check query cache entry " + id, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<List<QueryCacheEntry>> findRecent(int limit) {
        return CompletableFuture.supplyAsync(() -> {
            if (limit <= 0) {
                return List.of();
            }
            List<QueryCacheEntry> entries = new ArrayList<>();
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_ENTRY + " ORDER BY id DESC LIMIT ?")) {
                stmt.setInt(1, limit);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        entries.add(mapEntry(rs));
                    }
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to load recent query cache entries", e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
            return entries;
        });
    }

    @Override
    public CompletableFuture<Long> count() {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getReadConnection();
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM query_cache")) {
                rs.next();
                return rs.getLong(1);
            } catch (SQLException e) {
                throw new RuntimeException("Failed to count query cache entries", e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    private Optional<QueryCacheEntry> loadById(long id) {
        Connection conn = connectionManager.getReadConnection();
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_ENTRY + " WHERE id = ?")) {
            stmt.setLong(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(mapEntry(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load query cache entry " + id, e);
        } finally {
            connectionManager.releaseReadConnection(conn);
        }
    }

    private QueryCacheEntry mapEntry(ResultSet rs) throws SQLException {
        return new QueryCacheEntry(
            rs.getLong("id"),
            rs.getString("query_text"),
            EmbeddingUtil.fromBytes(rs.getBytes("query_embedding")),
            rs.getString("answer_text"),
            fromJson(rs.getString("citations"), CITATIONS_TYPE, List.of()),
            fromJson(rs.getString("context_json"), ContextSnapshot.class),
            rs.getInt("low_confidence") == 1,
            rs.getLong("hit_count"),
            SQLiteTimestamps.parse(rs.getString("created_at"))
        );
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt JSON column in query_cache", e);
        }
    }

    private ContextSnapshot fromJson(String json, Class<ContextSnapshot> type) {
        if (json == null || json.isBlank() || "{}".equals(json.trim())) {
            return ContextSnapshot.empty();
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt context JSON in query_cache", e);
        }
    }
}
