package br.edu.ifba.hybridrag.storage.impl;

import br.edu.ifba.hybridrag.core.ContextSnapshot;
import br.edu.ifba.hybridrag.feedback.FavoriteEntry;
import br.edu.ifba.hybridrag.feedback.FeedbackMetrics;
import br.edu.ifba.hybridrag.feedback.FeedbackRecord;
import br.edu.ifba.hybridrag.storage.FeedbackStorage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.jboss.logging.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * SQLite-based implementation of FeedbackStorage.
 *
 * <p>Conditional writes use the {@code version} column: an update or delete only matches
 * the row when the caller's version is still current.</p>
 */
public final class SQLiteFeedbackStorage implements FeedbackStorage {

    private static final Logger LOG = Logger.getLogger(SQLiteFeedbackStorage.class);

    private static final String SELECT_FEEDBACK = """
        SELECT query_cache_id, rating, accuracy_rating, comprehensiveness_rating, helpfulness_rating,
               feedback_text, is_favorite, version, created_at, updated_at
        FROM user_feedback
        """;

    private final SQLiteConnectionManager connectionManager;
    private final ObjectMapper objectMapper;

    public SQLiteFeedbackStorage(SQLiteConnectionManager connectionManager, ObjectMapper objectMapper) {
        this.connectionManager = connectionManager;
        this.objectMapper = objectMapper;
    }

    @Override
    public CompletableFuture<Optional<FeedbackRecord>> find(long memoryId) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_FEEDBACK + " WHERE query_cache_id = ?")) {
                stmt.setLong(1, memoryId);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(mapRecord(rs)) : Optional.empty();
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to load feedback for memory entry " + memoryId, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> insert(@NotNull FeedbackRecord record) {
        return CompletableFuture.supplyAsync(() -> {
            String sql = """
                INSERT INTO user_feedback (query_cache_id, rating, accuracy_rating, comprehensiveness_rating,
                                           helpfulness_rating, feedback_text, is_favorite, version,
                                           created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, 0, ?, ?)
                ON CONFLICT(query_cache_id) DO NOTHING
                """;

            String now = SQLiteTimestamps.now();
            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setLong(1, record.memoryId());
                bindFields(stmt, 2, record);
                stmt.setString(8, now);
                stmt.setString(9, now);
                boolean inserted = stmt.executeUpdate() > 0;
                LOG.debugf("Insert feedback for memory entry %d: %s", record.memoryId(), inserted ? "applied" : "exists");
                return inserted;
            } catch (SQLException e) {
                throw new RuntimeException("Failed to insert feedback for memory entry " + record.memoryId(), e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> update(@NotNull FeedbackRecord record) {
        return CompletableFuture.supplyAsync(() -> {
            String sql = """
                UPDATE user_feedback
                SET rating = ?, accuracy_rating = ?, comprehensiveness_rating = ?, helpfulness_rating = ?,
                    feedback_text = ?, is_favorite = ?, version = version + 1, updated_at = ?
                WHERE query_cache_id = ? AND version = ?
                """;

            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                bindFields(stmt, 1, record);
                stmt.setString(7, SQLiteTimestamps.now());
                stmt.setLong(8, record.memoryId());
                stmt.setLong(9, record.version());
                return stmt.executeUpdate() > 0;
            } catch (SQLException e) {
                throw new RuntimeException("Failed to update feedback for memory entry " + record.memoryId(), e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> delete(long memoryId, long expectedVersion) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "DELETE FROM user_feedback WHERE query_cache_id = ? AND version = ?")) {
                stmt.setLong(1, memoryId);
                stmt.setLong(2, expectedVersion);
                return stmt.executeUpdate() > 0;
            } catch (SQLException e) {
                throw new RuntimeException("Failed to delete feedback for memory entry " + memoryId, e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> delete(long memoryId) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "DELETE FROM user_feedback WHERE query_cache_id = ?")) {
                stmt.setLong(1, memoryId);
                return stmt.executeUpdate() > 0;
            } catch (SQLException e) {
                throw new RuntimeException("Failed to delete feedback for memory entry " + memoryId, e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<List<FavoriteEntry>> findFavorites() {
        return CompletableFuture.supplyAsync(() -> {
            String sql = """
                SELECT qc.id, qc.query_text, qc.answer_text, qc.context_json, qc.created_at,
                       uf.rating, uf.accuracy_rating, uf.comprehensiveness_rating, uf.helpfulness_rating,
                       uf.feedback_text, uf.updated_at AS favorited_at
                FROM query_cache qc
                JOIN user_feedback uf ON uf.query_cache_id = qc.id
                WHERE uf.is_favorite = 1
                ORDER BY uf.updated_at DESC, qc.id DESC
                """;

            List<FavoriteEntry> favorites = new ArrayList<>();
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql);
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    favorites.add(new FavoriteEntry(
                        rs.getLong("id"),
                        rs.getString("query_text"),
                        rs.getString("answer_text"),
                        readReferences(rs.getString("context_json")),
                        SQLiteTimestamps.parse(rs.getString("created_at")),
                        getNullableInt(rs, "rating"),
                        getNullableInt(rs, "accuracy_rating"),
                        getNullableInt(rs, "comprehensiveness_rating"),
                        getNullableInt(rs, "helpfulness_rating"),
                        rs.getString("feedback_text"),
                        SQLiteTimestamps.parse(rs.getString("favorited_at"))
                    ));
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to load favorites", e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
            return favorites;
        });
    }

    @Override
    public CompletableFuture<FeedbackMetrics> metrics() {
        return CompletableFuture.supplyAsync(() -> {
            String overallSql = """
                SELECT COUNT(*) AS total_feedback,
                       COUNT(rating) AS rated_count,
                       AVG(rating) AS average_rating,
                       COUNT(accuracy_rating) AS accuracy_rated_count,
                       AVG(accuracy_rating) AS average_accuracy_rating,
                       COUNT(comprehensiveness_rating) AS comprehensiveness_rated_count,
                       AVG(comprehensiveness_rating) AS average_comprehensiveness_rating,
                       COUNT(helpfulness_rating) AS helpfulness_rated_count,
                       AVG(helpfulness_rating) AS average_helpfulness_rating,
                       COALESCE(SUM(CASE WHEN is_favorite = 1 THEN 1 ELSE 0 END), 0) AS favorites_count,
                       COUNT(feedback_text) AS text_feedback_count
                FROM user_feedback
                """;
            String distributionSql = """
                SELECT rating, COUNT(*) AS count
                FROM user_feedback
                WHERE rating IS NOT NULL
                GROUP BY rating
                ORDER BY rating
                """;

            Connection conn = connectionManager.getReadConnection();
            try (Statement stmt = conn.createStatement()) {
                FeedbackMetrics.Overall overall;
                try (ResultSet rs = stmt.executeQuery(overallSql)) {
                    rs.next();
                    overall = new FeedbackMetrics.Overall(
                        rs.getLong("total_feedback"),
                        rs.getLong("rated_count"),
                        getNullableDouble(rs, "average_rating"),
                        rs.getLong("accuracy_rated_count"),
                        getNullableDouble(rs, "average_accuracy_rating"),
                        rs.getLong("comprehensiveness_rated_count"),
                        getNullableDouble(rs, "average_comprehensiveness_rating"),
                        rs.getLong("helpfulness_rated_count"),
                        getNullableDouble(rs, "average_helpfulness_rating"),
                        rs.getLong("favorites_count"),
                        rs.getLong("text_feedback_count")
                    );
                }

                List<FeedbackMetrics.RatingCount> distribution = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery(distributionSql)) {
                    while (rs.next()) {
                        distribution.add(new FeedbackMetrics.RatingCount(rs.getInt("rating"), rs.getLong("count")));
                    }
                }
                return new FeedbackMetrics(overall, distribution);
            } catch (SQLException e) {
                throw new RuntimeException("Failed to compute feedback metrics", e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    private void bindFields(PreparedStatement stmt, int start, FeedbackRecord record) throws SQLException {
        setNullableInt(stmt, start, record.rating());
        setNullableInt(stmt, start + 1, record.accuracyRating());
        setNullableInt(stmt, start + 2, record.comprehensivenessRating());
        setNullableInt(stmt, start + 3, record.helpfulnessRating());
        if (record.feedbackText() == null) {
            stmt.setNull(start + 4, Types.VARCHAR);
        } else {
            stmt.setString(start + 4, record.feedbackText());
        }
        stmt.setInt(start + 5, record.favorite() ? 1 : 0);
    }

    private FeedbackRecord mapRecord(ResultSet rs) throws SQLException {
        return new FeedbackRecord(
            rs.getLong("query_cache_id"),
            getNullableInt(rs, "rating"),
            getNullableInt(rs, "accuracy_rating"),
            getNullableInt(rs, "comprehensiveness_rating"),
            getNullableInt(rs, "helpfulness_rating"),
            rs.getString("feedback_text"),
            rs.getInt("is_favorite") == 1,
            rs.getLong("version"),
            SQLiteTimestamps.parse(rs.getString("created_at")),
            SQLiteTimestamps.parse(rs.getString("updated_at"))
        );
    }

    private List<String> readReferences(String contextJson) {
        if (contextJson == null || contextJson.isBlank() || "{}".equals(contextJson.trim())) {
            return List.of();
        }
        try {
            return objectMapper.readValue(contextJson, ContextSnapshot.class).references();
        } catch (JsonProcessingException e) {
            LOG.warnf("Ignoring unreadable context of a favorite answer: %s", e.getMessage());
            return List.of();
        }
    }

    private static void setNullableInt(PreparedStatement stmt, int index, Integer value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.INTEGER);
        } else {
            stmt.setInt(index, value);
        }
    }

    private static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static Double getNullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

}
