package br.edu.ifba.hybridrag.evaluation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import br.edu.ifba.hybridrag.core.ContextSnapshot;
import br.edu.ifba.hybridrag.core.GraphContext;
import br.edu.ifba.hybridrag.core.OrderedContext;
import br.edu.ifba.hybridrag.core.QueryCacheEntry;
import br.edu.ifba.hybridrag.core.RetrievalMethod;
import br.edu.ifba.hybridrag.exception.ChunkNotFoundException;
import br.edu.ifba.hybridrag.exception.MemoryEntryNotFoundException;
import br.edu.ifba.hybridrag.llm.ScriptedLLMFunction;
import br.edu.ifba.hybridrag.query.ContextAssembler;
import br.edu.ifba.hybridrag.query.VectorRetriever;
import br.edu.ifba.hybridrag.storage.impl.SQLiteTestDatabase;

class EvaluationServiceTest {

    @TempDir
    Path tempDir;

    private SQLiteTestDatabase database;
    private ScriptedLLMFunction llm;
    private EvaluationService service;

    @BeforeEach
    void setUp() throws Exception {
        database = SQLiteTestDatabase.create(tempDir);
        database.document(1, "rag.pdf", null);
        database.chunk(10, 1, "RAG conditions generation on retrieved passages.", 1, 0, 0);
        database.chunk(11, 1, "Dense retrieval maps text into vectors.", 0.8f, 0.6f, 0);
        database.chunk(12, 1, "bad ### chunk", 0, 0, 1);

        llm = ScriptedLLMFunction.always("Yes");
        service = new EvaluationService(
            database.evaluationStorage(),
            database.queryCacheStorage(),
            database.vectorStorage(),
            new VectorRetriever(database.vectorStorage()),
            new SimilarityRelevanceJudge(0.5),
            new LlmRelevanceJudge(llm, 0.5),
            new ChunkQualityEvaluator());
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Nested
    @DisplayName("recording runs")
    class Recording {

        @Test
        void testEmptyRunRejected() {
            CompletionException thrown = assertThrows(CompletionException.class,
                () -> service.recordRun(remember("q", 1, 0, 0), List.of()).join());

            assertInstanceOf(IllegalArgumentException.class, thrown.getCause());
        }

        @Test
        void testDuplicateRankRejected() {
            long queryId = remember("q", 1, 0, 0);

            CompletionException thrown = assertThrows(CompletionException.class,
                () -> service.recordRun(queryId, List.of(judgment(10, 1, 1), judgment(11, 0, 1))).join());

            assertInstanceOf(IllegalArgumentException.class, thrown.getCause());
        }

        @Test
        void testUnknownQueryRejected() {
            CompletionException thrown = assertThrows(CompletionException.class,
                () -> service.recordRetrievalEvaluation(999, 10, 1, RetrievalMethod.VECTOR, 1).join());

            assertInstanceOf(MemoryEntryNotFoundException.class, thrown.getCause());
        }

        @Test
        void testInvalidRelevanceRejected() {
            long queryId = remember("q", 1, 0, 0);

            CompletionException thrown = assertThrows(CompletionException.class,
                () -> service.recordRetrievalEvaluation(queryId, 10, 2, RetrievalMethod.VECTOR, 1).join());

            assertInstanceOf(IllegalArgumentException.class, thrown.getCause());
        }

        @Test
        void testSingleJudgmentRecorded() {
            long queryId = remember("q", 1, 0, 0);

            String runId = service.recordRetrievalEvaluation(queryId, 10, 1, RetrievalMethod.VECTOR, 1).join();

            assertNotNull(runId);
            QueryJudgments judgments = service.queryJudgments(queryId).join();
            assertEquals(1, judgments.judgments().size());
            assertEquals("RAG conditions generation on retrieved passages.", judgments.judgments().get(0).textContent());
        }

        @Test
        @DisplayName("per-chunk judgments of one retrieval form a single run")
        void testPerChunkJudgmentsShareRun() {
            long queryId = remember("q", 1, 0, 0);
            int[] relevance = {1, 1, 1, 0, 0};

            String firstRun = null;
            for (int rank = 1; rank <= relevance.length; rank++) {
                String runId = service.recordRetrievalEvaluation(queryId, 10 + rank, relevance[rank - 1],
                    RetrievalMethod.VECTOR, rank).join();
                if (firstRun == null) {
                    firstRun = runId;
                }
                assertEquals(firstRun, runId);
            }

            RetrievalEvalSummary summary = service.summary().join();
            assertEquals(0.6, summary.precisionAt5(), 1e-9);
            assertEquals(0.6, summary.overallPrecision(), 1e-9);
            assertEquals(5, summary.totalJudgments());
            assertEquals(5, service.queryJudgments(queryId).join().judgments().size());
        }

        @Test
        void testRejudgedRankOpensNewRun() {
            long queryId = remember("q", 1, 0, 0);
            String first = service.recordRetrievalEvaluation(queryId, 10, 0, RetrievalMethod.VECTOR, 1).join();
            service.recordRetrievalEvaluation(queryId, 11, 0, RetrievalMethod.VECTOR, 2).join();

            String second = service.recordRetrievalEvaluation(queryId, 10, 1, RetrievalMethod.VECTOR, 1).join();

            assertNotEquals(first, second);
            QueryJudgments latest = service.queryJudgments(queryId).join();
            assertEquals(1, latest.judgments().size());
            assertEquals(1, latest.judgments().get(0).relevance());
            assertEquals(0.2, service.summary().join().precisionAt5(), 1e-9);
        }
    }

    @Nested
    @DisplayName("summary")
    class Summary {

        @Test
        void testAveragesLatestRunPerQuery() {
            long first = remember("first", 1, 0, 0);
            long second = remember("second", 0, 1, 0);
            service.recordRun(first, List.of(
                judgment(10, 1, 1), judgment(11, 1, 2), judgment(12, 0, 3), judgment(13, 1, 4), judgment(14, 0, 5))).join();
            service.recordRun(second, List.of(judgment(10, 0, 1), judgment(11, 0, 2))).join();
            // re-judging replaces the earlier run of the second query
            service.recordRun(second, List.of(judgment(10, 1, 1), judgment(11, 1, 2))).join();

            RetrievalEvalSummary summary = service.summary().join();

            assertEquals(0.8, summary.overallPrecision());
            assertEquals(0.5, summary.precisionAt5());
            assertEquals(0.25, summary.precisionAt10());
            assertEquals(9, summary.totalJudgments());
        }

        @Test
        void testEmptySummary() {
            RetrievalEvalSummary summary = service.summary().join();

            assertEquals(0.0, summary.overallPrecision());
            assertEquals(0, summary.totalJudgments());
        }

        @Test
        void testHeuristicRunUsesCitationOrder() {
            long queryId = remember("q", 1, 0, 0);
            OrderedContext context = new ContextAssembler().assemble(
                new VectorRetriever(database.vectorStorage()).search(new float[] {1, 0, 0}, 3).join(),
                GraphContext.empty());

            int written = service.recordHeuristicRun(queryId, context).join();

            assertEquals(3, written);
            List<RetrievalJudgment> judgments = service.queryJudgments(queryId).join().judgments();
            assertEquals(List.of(10L, 11L, 12L), judgments.stream().map(RetrievalJudgment::chunkId).toList());
            assertEquals(List.of(1, 1, 0), judgments.stream().map(RetrievalJudgment::relevance).toList());
        }
    }

    @Nested
    @DisplayName("backfill")
    class Backfill {

        @Test
        void testHeuristicBackfillOverStoredQueries() {
            remember("about rag", 1, 0, 0);
            remember("about dense retrieval", 0.8f, 0.6f, 0);

            BackfillResult result = service.backfill(10, 2, false).join();

            assertEquals(2, result.queries());
            assertEquals(4, result.judgments());
            assertEquals(0, llm.callCount());
            assertEquals(4, service.summary().join().totalJudgments());
        }

        @Test
        void testLlmBackfillWritesASeparateRun() {
            long queryId = remember("about rag", 1, 0, 0);

            BackfillResult result = service.backfill(10, 2, true).join();

            assertEquals(1, result.queries());
            assertEquals(4, result.judgments());
            assertEquals(2, llm.callCount());
            List<RetrievalJudgment> latest = service.queryJudgments(queryId).join().judgments();
            assertEquals(2, latest.size());
            assertTrue(latest.stream().allMatch(j -> j.method() == RetrievalMethod.LLM));
            assertTrue(latest.stream().allMatch(j -> j.llmScore() != null));
        }

        @Test
        void testLimitRespectedAndValidated() {
            remember("one", 1, 0, 0);
            remember("two", 0, 1, 0);

            assertEquals(1, service.backfill(1, 1, false).join().queries());
            CompletionException thrown = assertThrows(CompletionException.class,
                () -> service.backfill(0, 10, false).join());
            assertInstanceOf(IllegalArgumentException.class, thrown.getCause());
        }

        @Test
        void testEmptyCorpusWritesNothing() throws Exception {
            SQLiteTestDatabase empty = SQLiteTestDatabase.create(Files.createDirectories(tempDir.resolve("empty")));
            try {
                EvaluationService emptyService = new EvaluationService(
                    empty.evaluationStorage(), empty.queryCacheStorage(), empty.vectorStorage(),
                    new VectorRetriever(empty.vectorStorage()), new SimilarityRelevanceJudge(0.5),
                    new LlmRelevanceJudge(llm, 0.5), new ChunkQualityEvaluator());
                empty.queryCacheStorage().insert(entry("q", 1, 0, 0)).join();

                BackfillResult result = emptyService.backfill(10, 5, false).join();

                assertEquals(0, result.queries());
                assertEquals(0, result.judgments());
            } finally {
                empty.close();
            }
        }
    }

    @Nested
    @DisplayName("chunk quality")
    class ChunkQuality {

        @Test
        void testEvaluateAndSummarize() {
            ChunkEvaluation good = service.evaluateChunk(10).join();
            ChunkEvaluation bad = service.evaluateChunk(12).join();

            assertTrue(good.id() > 0);
            assertEquals(1, good.score());
            assertEquals(0, bad.score());

            IngestionQualitySummary summary = service.qualitySummary().join();
            assertEquals(1, summary.chunkQuality().good());
            assertEquals(2, summary.chunkQuality().total());
            assertEquals(50.0, summary.chunkQuality().percentage());
            assertEquals(3, summary.overall().totalChunks());
            assertEquals(1, summary.overall().uniqueDocuments());
        }

        @Test
        void testUnknownChunk() {
            CompletionException thrown = assertThrows(CompletionException.class,
                () -> service.evaluateChunk(404).join());

            assertInstanceOf(ChunkNotFoundException.class, thrown.getCause());
        }
    }

    private long remember(String query, float... embedding) {
        return database.queryCacheStorage().insert(entry(query, embedding)).join().id();
    }

    private static QueryCacheEntry entry(String query, float... embedding) {
        return new QueryCacheEntry(0L, query, embedding, "answer", List.of(), ContextSnapshot.empty(),
            false, 0L, Instant.now());
    }

    private static RetrievalJudgment judgment(long chunkId, int relevance, int rank) {
        return new RetrievalJudgment(chunkId, relevance, null, null, RetrievalMethod.VECTOR, rank);
    }
}
