package br.edu.ifba.hybridrag.storage.impl;

import br.edu.ifba.hybridrag.core.RetrievalMethod;
import br.edu.ifba.hybridrag.evaluation.ChunkEvaluation;
import br.edu.ifba.hybridrag.evaluation.QualityCounts;
import br.edu.ifba.hybridrag.evaluation.RetrievalJudgment;
import br.edu.ifba.hybridrag.storage.EvaluationStorage;
import org.jetbrains.annotations.NotNull;
import org.jboss.logging.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * SQLite-based implementation of EvaluationStorage.
 *
 * <p>Rows are only ever inserted. A run is written in one transaction, so readers see
 * either all of its judgments or none.</p>
 */
public final class SQLiteEvaluationStorage implements EvaluationStorage {

    private static final Logger LOG = Logger.getLogger(SQLiteEvaluationStorage.class);

    private static final String LATEST_RUN_FILTER = """
        re.run_id = (
            SELECT r2.run_id FROM retrieval_evaluations r2
            WHERE r2.query_id = re.query_id
            ORDER BY r2.id DESC
            LIMIT 1
        )
        """;

    private final SQLiteConnectionManager connectionManager;

    public SQLiteEvaluationStorage(SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    private static final String INSERT_JUDGMENT = """
        INSERT INTO retrieval_evaluations (query_id, chunk_id, run_id, relevance_score, llm_score,
                                           explanation, retrieval_method, rank_position, created_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    @Override
    public CompletableFuture<Integer> appendRun(long queryId, @NotNull String runId,
                                                @NotNull List<RetrievalJudgment> judgments) {
        return CompletableFuture.supplyAsync(() -> {
            if (judgments.isEmpty()) {
                return 0;
            }

            String createdAt = SQLiteTimestamps.now();
            Connection conn = connectionManager.getWriteConnection();
            try {
                conn.setAutoCommit(false);
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_JUDGMENT)) {
                    for (RetrievalJudgment judgment : judgments) {
                        bindJudgment(stmt, queryId, runId, judgment, createdAt);
                        stmt.addBatch();
                    }
                    stmt.executeBatch();
                }
                conn.commit();
                LOG.debugf("Appended evaluation run %s for query %d with %d judgments", runId, queryId, judgments.size());
                return judgments.size();
            } catch (SQLException e) {
                rollback(conn);
                throw new RuntimeException("Failed to append evaluation run for query " + queryId, e);
            } finally {
                resetAutoCommit(conn);
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<String> appendJudgment(long queryId, @NotNull String newRunId,
                                                    @NotNull RetrievalJudgment judgment) {
        return CompletableFuture.supplyAsync(() -> {
            String latestRunSql = """
                SELECT run_id FROM retrieval_evaluations
                WHERE query_id = ?
                ORDER BY id DESC
                LIMIT 1
                """;
            String slotTakenSql = """
                SELECT 1 FROM retrieval_evaluations
                WHERE query_id = ? AND run_id = ? AND retrieval_method = ? AND rank_position = ?
                """;

            Connection conn = connectionManager.getWriteConnection();
            try {
                conn.setAutoCommit(false);

                String runId = null;
                try (PreparedStatement stmt = conn.prepareStatement(latestRunSql)) {
                    stmt.setLong(1, queryId);
                    try (ResultSet rs = stmt.executeQuery()) {
                        if (rs.next()) {
                            runId = rs.getString("run_id");
                        }
                    }
                }
                if (runId != null) {
                    try (PreparedStatement stmt = conn.prepareStatement(slotTakenSql)) {
                        stmt.setLong(1, queryId);
                        stmt.setString(2, runId);
                        stmt.setString(3, judgment.method().tag());
                        stmt.setInt(4, judgment.rank());
                        try (ResultSet rs = stmt.executeQuery()) {
                            if (rs.next()) {
                                runId = null;
                            }
                        }
                    }
                }
                if (runId == null) {
                    runId = newRunId;
                }

                try (PreparedStatement stmt = conn.prepareStatement(INSERT_JUDGMENT)) {
                    bindJudgment(stmt, queryId, runId, judgment, SQLiteTimestamps.now());
                    stmt.executeUpdate();
                }
                conn.commit();
                LOG.debugf("Appended judgment (rank %d, %s) to run %s of query %d",
                    judgment.rank(), judgment.methodTag(), runId, queryId);
                return runId;
            } catch (SQLException e) {
                rollback(conn);
                throw new RuntimeException("Failed to append judgment for query " + queryId, e);
            } finally {
                resetAutoCommit(conn);
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<Map<Long, List<RetrievalJudgment>>> findLatestRuns() {
        return CompletableFuture.supplyAsync(() -> {
            String sql = """
                SELECT re.query_id, re.chunk_id, re.relevance_score, re.llm_score, re.explanation,
                       re.retrieval_method, re.rank_position
                FROM retrieval_evaluations re
                WHERE %s
                ORDER BY re.query_id, re.rank_position, re.id
                """.formatted(LATEST_RUN_FILTER);

            Map<Long, List<RetrievalJudgment>> runs = new LinkedHashMap<>();
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql);
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    runs.computeIfAbsent(rs.getLong("query_id"), id -> new ArrayList<>())
                        .add(mapJudgment(rs, null));
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to load latest evaluation runs", e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
            return runs;
        });
    }

    @Override
    public CompletableFuture<List<RetrievalJudgment>> findLatestRun(long queryId) {
        return CompletableFuture.supplyAsync(() -> {
            String sql = """
                SELECT re.chunk_id, re.relevance_score, re.llm_score, re.explanation,
                       re.retrieval_method, re.rank_position, dc.text_content
                FROM retrieval_evaluations re
                LEFT JOIN document_chunks dc ON dc.id = re.chunk_id
                WHERE re.query_id = ? AND %s
                ORDER BY re.rank_position, re.id
                """.formatted(LATEST_RUN_FILTER);

            List<RetrievalJudgment> judgments = new ArrayList<>();
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setLong(1, queryId);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        judgments.add(mapJudgment(rs, rs.getString("text_content")));
                    }
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to load judgments for query " + queryId, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
            return judgments;
        });
    }

    @Override
    public CompletableFuture<Long> countJudgments() {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getReadConnection();
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM retrieval_evaluations")) {
                rs.next();
                return rs.getLong(1);
            } catch (SQLException e) {
                throw new RuntimeException("Failed to count retrieval judgments", e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<ChunkEvaluation> insertChunkEvaluation(@NotNull ChunkEvaluation evaluation) {
        return CompletableFuture.supplyAsync(() -> {
            String sql = """
                INSERT INTO chunk_evaluations (chunk_id, evaluation_criteria, score, explanation, model_used, created_at)
                VALUES (?, ?, ?, ?, ?, ?)
                """;

            Instant createdAt = evaluation.createdAt() != null ? evaluation.createdAt() : Instant.now();
            Connection conn = connectionManager.getWriteConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                stmt.setLong(1, evaluation.chunkId());
                stmt.setString(2, evaluation.criteria());
                stmt.setInt(3, evaluation.score());
                stmt.setString(4, evaluation.explanation());
                stmt.setString(5, evaluation.modelUsed());
                stmt.setString(6, SQLiteTimestamps.format(createdAt));
                stmt.executeUpdate();

                try (ResultSet keys = stmt.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new SQLException("No id generated for chunk evaluation");
                    }
                    return new ChunkEvaluation(keys.getLong(1), evaluation.chunkId(), evaluation.criteria(),
                        evaluation.score(), evaluation.explanation(), evaluation.modelUsed(),
                        SQLiteTimestamps.parse(SQLiteTimestamps.format(createdAt)));
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to store chunk evaluation for chunk " + evaluation.chunkId(), e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    @Override
    public CompletableFuture<QualityCounts> chunkQualityCounts(@NotNull String criteria) {
        return CompletableFuture.supplyAsync(() -> {
            // only the newest evaluation of each chunk counts
            String sql = """
                SELECT COALESCE(SUM(CASE WHEN score = 1 THEN 1 ELSE 0 END), 0) AS good,
                       COUNT(*) AS total
                FROM chunk_evaluations
                WHERE id IN (
                    SELECT MAX(id) FROM chunk_evaluations
                    WHERE evaluation_criteria = ?
                    GROUP BY chunk_id
                )
                """;

            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, criteria);
                try (ResultSet rs = stmt.executeQuery()) {
                    rs.next();
                    return new QualityCounts(rs.getLong("good"), rs.getLong("total"));
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to count chunk quality for " + criteria, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    private static void bindJudgment(PreparedStatement stmt, long queryId, String runId,
                                     RetrievalJudgment judgment, String createdAt) throws SQLException {
        stmt.setLong(1, queryId);
        stmt.setLong(2, judgment.chunkId());
        stmt.setString(3, runId);
        stmt.setInt(4, judgment.relevance());
        if (judgment.llmScore() == null) {
            stmt.setNull(5, Types.REAL);
        } else {
            stmt.setDouble(5, judgment.llmScore());
        }
        stmt.setString(6, judgment.explanation());
        stmt.setString(7, judgment.method().tag());
        stmt.setInt(8, judgment.rank());
        stmt.setString(9, createdAt);
    }

    private static void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException rollbackEx) {
            LOG.warn("Failed to rollback", rollbackEx);
        }
    }

    private static void resetAutoCommit(Connection conn) {
        try {
            conn.setAutoCommit(true);
        } catch (SQLException ex) {
            LOG.warn("Failed to reset auto-commit", ex);
        }
    }

    private RetrievalJudgment mapJudgment(ResultSet rs, String textContent) throws SQLException {
        double llmScore = rs.getDouble("llm_score");
        Double nullableLlmScore = rs.wasNull() ? null : llmScore;
        return new RetrievalJudgment(
            rs.getLong("chunk_id"),
            rs.getInt("relevance_score"),
            nullableLlmScore,
            rs.getString("explanation"),
            RetrievalMethod.fromTag(rs.getString("retrieval_method")),
            rs.getInt("rank_position"),
            textContent
        );
    }
}
