package br.edu.ifba.hybridrag.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import br.edu.ifba.hybridrag.core.ContextSnapshot;
import br.edu.ifba.hybridrag.core.QueryCacheEntry;
import br.edu.ifba.hybridrag.core.RetrievalMethod;
import br.edu.ifba.hybridrag.evaluation.ChunkEvaluation;
import br.edu.ifba.hybridrag.evaluation.QualityCounts;
import br.edu.ifba.hybridrag.evaluation.RetrievalJudgment;

class SQLiteEvaluationStorageTest {

    @TempDir
    Path tempDir;

    private SQLiteTestDatabase database;
    private SQLiteEvaluationStorage storage;
    private long queryId;

    @BeforeEach
    void setUp() throws Exception {
        database = SQLiteTestDatabase.create(tempDir);
        storage = database.evaluationStorage();

        database.document(1, "paper.pdf", null);
        database.chunk(10, 1, "First chunk.", 1, 0);
        database.chunk(11, 1, "Second chunk.", 0, 1);

        queryId = database.queryCacheStorage().insert(new QueryCacheEntry(0, "q", new float[] {1, 0}, "a",
            List.of(), ContextSnapshot.empty(), false, 0, Instant.now())).join().id();
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    @DisplayName("only the latest run of a query is read back, ordered by rank with chunk text")
    void testLatestRunWins() {
        storage.appendRun(queryId, "run-1", List.of(
            judgment(10, 0, 1), judgment(11, 0, 2))).join();
        storage.appendRun(queryId, "run-2", List.of(
            judgment(11, 1, 2), judgment(10, 1, 1))).join();

        List<RetrievalJudgment> latest = storage.findLatestRun(queryId).join();

        assertEquals(2, latest.size());
        assertEquals(List.of(1, 2), latest.stream().map(RetrievalJudgment::rank).toList());
        assertTrue(latest.stream().allMatch(RetrievalJudgment::isRelevant));
        assertEquals("First chunk.", latest.get(0).textContent());

        Map<Long, List<RetrievalJudgment>> runs = storage.findLatestRuns().join();
        assertEquals(1, runs.size());
        assertEquals(2, runs.get(queryId).size());
        assertEquals(4L, storage.countJudgments().join());
    }

    @Test
    @DisplayName("a run with a duplicate rank is rejected as a whole")
    void testRunIsAtomic() {
        assertThrows(CompletionException.class, () -> storage.appendRun(queryId, "run-1", List.of(
            judgment(10, 1, 1), judgment(11, 1, 1))).join());

        assertEquals(0L, storage.countJudgments().join());
    }

    @Test
    void testChunkQualityCountsUseLatestEvaluation() {
        storage.insertChunkEvaluation(evaluation(10, 0)).join();
        storage.insertChunkEvaluation(evaluation(10, 1)).join();
        ChunkEvaluation stored = storage.insertChunkEvaluation(evaluation(11, 0)).join();

        assertTrue(stored.id() > 0);
        QualityCounts counts = storage.chunkQualityCounts("chunk_quality").join();
        assertEquals(1, counts.good());
        assertEquals(2, counts.total());
        assertEquals(50.0, counts.percentage());
    }

    private static RetrievalJudgment judgment(long chunkId, int relevance, int rank) {
        return new RetrievalJudgment(chunkId, relevance, null, "test", RetrievalMethod.VECTOR, rank);
    }

    private static ChunkEvaluation evaluation(long chunkId, int score) {
        return new ChunkEvaluation(0, chunkId, "chunk_quality", score, "test", "heuristic:v0", Instant.now());
    }
}
