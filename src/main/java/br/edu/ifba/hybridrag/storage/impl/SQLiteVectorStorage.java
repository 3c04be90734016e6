package br.edu.ifba.hybridrag.storage.impl;

import br.edu.ifba.hybridrag.core.RetrievedChunk;
import br.edu.ifba.hybridrag.storage.VectorStorage;
import br.edu.ifba.hybridrag.utils.EmbeddingUtil;
import org.jetbrains.annotations.NotNull;
import org.jboss.logging.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;

/**
 * SQLite-based implementation of VectorStorage.
 *
 * <p>Embeddings are stored as float32 BLOBs in {@code chunk_embeddings}. Search is an exact
 * scan: every stored vector is scored with cosine similarity and the best {@code topK}
 * are kept in a bounded heap.</p>
 */
public final class SQLiteVectorStorage implements VectorStorage {

    private static final Logger LOG = Logger.getLogger(SQLiteVectorStorage.class);

    /** Best first: higher similarity, then lower chunk id. */
    static final Comparator<RetrievedChunk> RANKING = Comparator
        .comparingDouble(RetrievedChunk::similarity).reversed()
        .thenComparingLong(RetrievedChunk::id);

    private static final String CHUNK_COLUMNS = """
        SELECT dc.id, dc.text_content, dc.source, dc.document_id, dc.position, d.reference
        """;

    private final SQLiteConnectionManager connectionManager;

    public SQLiteVectorStorage(SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public CompletableFuture<List<RetrievedChunk>> query(@NotNull float[] queryVector, int topK) {
        return CompletableFuture.supplyAsync(() -> {
            if (topK <= 0) {
                return List.of();
            }

            String sql = CHUNK_COLUMNS + """
                , ce.embedding
                FROM chunk_embeddings ce
                JOIN document_chunks dc ON dc.id = ce.chunk_id
                LEFT JOIN documents d ON d.id = dc.document_id
                """;

            // Worst kept candidate at the head
            PriorityQueue<RetrievedChunk> best = new PriorityQueue<>(topK + 1, RANKING.reversed());
            int skipped = 0;

            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql);
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    float[] embedding = EmbeddingUtil.fromBytes(rs.getBytes("embedding"));
                    if (embedding.length != queryVector.length) {
                        skipped++;
                        continue;
                    }
                    double similarity = EmbeddingUtil.cosineSimilarity(queryVector, embedding);
                    best.offer(mapChunk(rs, similarity));
                    if (best.size() > topK) {
                        best.poll();
                    }
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to query chunk embeddings", e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }

            if (skipped > 0) {
                LOG.warnf("Skipped %d chunk embeddings with a dimension other than %d",
                    skipped, queryVector.length);
            }

            List<RetrievedChunk> results = new ArrayList<>(best);
            results.sort(RANKING);
            LOG.debugf("Vector query returned %d of %d requested chunks", results.size(), topK);
            return results;
        });
    }

    @Override
    public CompletableFuture<List<RetrievedChunk>> getChunks(@NotNull Collection<Long> chunkIds) {
        return CompletableFuture.supplyAsync(() -> {
            if (chunkIds.isEmpty()) {
                return List.of();
            }

            StringBuilder sql = new StringBuilder(CHUNK_COLUMNS).append("""
                FROM document_chunks dc
                LEFT JOIN documents d ON d.id = dc.document_id
                WHERE dc.id IN (""");
            sql.append("?,".repeat(chunkIds.size()));
            sql.setLength(sql.length() - 1);
            sql.append(") ORDER BY dc.id");

            List<RetrievedChunk> chunks = new ArrayList<>();
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
                int index = 1;
                for (Long id : chunkIds) {
                    stmt.setLong(index++, id);
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        chunks.add(mapChunk(rs, 0.0));
                    }
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to load chunks", e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
            return chunks;
        });
    }

    @Override
    public CompletableFuture<Optional<RetrievedChunk>> getChunk(long chunkId) {
        return getChunks(List.of(chunkId))
            .thenApply(chunks -> chunks.isEmpty() ? Optional.empty() : Optional.of(chunks.get(0)));
    }

    @Override
    public CompletableFuture<CorpusStats> getCorpusStats() {
        return CompletableFuture.supplyAsync(() -> {
            String sql = """
                SELECT COUNT(*) AS total_chunks,
                       COUNT(DISTINCT COALESCE(source, CAST(document_id AS TEXT))) AS unique_documents
                FROM document_chunks
                """;

            Connection conn = connectionManager.getReadConnection();
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery(sql)) {
                rs.next();
                return new CorpusStats(rs.getLong("total_chunks"), rs.getLong("unique_documents"));
            } catch (SQLException e) {
                throw new RuntimeException("Failed to compute corpus statistics", e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    private RetrievedChunk mapChunk(ResultSet rs, double similarity) throws SQLException {
        return new RetrievedChunk(
            rs.getLong("id"),
            rs.getString("text_content"),
            rs.getString("source"),
            rs.getLong("document_id"),
            rs.getInt("position"),
            rs.getString("reference"),
            similarity
        );
    }
}
