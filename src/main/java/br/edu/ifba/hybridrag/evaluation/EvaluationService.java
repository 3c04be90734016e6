package br.edu.ifba.hybridrag.evaluation;

import br.edu.ifba.hybridrag.core.ContextChunk;
import br.edu.ifba.hybridrag.core.OrderedContext;
import br.edu.ifba.hybridrag.core.QueryCacheEntry;
import br.edu.ifba.hybridrag.core.RetrievalMethod;
import br.edu.ifba.hybridrag.core.RetrievedChunk;
import br.edu.ifba.hybridrag.exception.ChunkNotFoundException;
import br.edu.ifba.hybridrag.exception.MemoryEntryNotFoundException;
import br.edu.ifba.hybridrag.query.VectorRetriever;
import br.edu.ifba.hybridrag.storage.EvaluationStorage;
import br.edu.ifba.hybridrag.storage.QueryCacheStorage;
import br.edu.ifba.hybridrag.storage.VectorStorage;
import br.edu.ifba.hybridrag.utils.AsyncUtil;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Records and summarizes retrieval judgments and chunk-quality evaluations.
 *
 * <p>Judgments are append-only. Every call to {@link #recordRun} writes one run under a
 * fresh run id, and summaries only look at the latest run of each query, so re-judging a
 * query replaces its contribution to the metrics without rewriting history. A run holds a
 * single ranked list: LLM judgments produced by a backfill are written as their own run.</p>
 */
public class EvaluationService {

    private static final Logger logger = LoggerFactory.getLogger(EvaluationService.class);

    private final EvaluationStorage evaluationStorage;
    private final QueryCacheStorage queryCacheStorage;
    private final VectorStorage vectorStorage;
    private final VectorRetriever vectorRetriever;
    private final SimilarityRelevanceJudge heuristicJudge;
    private final LlmRelevanceJudge llmJudge;
    private final ChunkQualityEvaluator chunkQualityEvaluator;

    public EvaluationService(
            @NotNull EvaluationStorage evaluationStorage,
            @NotNull QueryCacheStorage queryCacheStorage,
            @NotNull VectorStorage vectorStorage,
            @NotNull VectorRetriever vectorRetriever,
            @NotNull SimilarityRelevanceJudge heuristicJudge,
            @NotNull LlmRelevanceJudge llmJudge,
            @NotNull ChunkQualityEvaluator chunkQualityEvaluator) {
        this.evaluationStorage = evaluationStorage;
        this.queryCacheStorage = queryCacheStorage;
        this.vectorStorage = vectorStorage;
        this.vectorRetriever = vectorRetriever;
        this.heuristicJudge = heuristicJudge;
        this.llmJudge = llmJudge;
        this.chunkQualityEvaluator = chunkQualityEvaluator;
    }

    /**
     * Records a single judgment. Successive calls for the ranks of one retrieval build up a
     * single run; a call whose method and rank are already taken in the current run starts
     * a new one.
     *
     * @return the run id the judgment was written under
     */
    public CompletableFuture<String> recordRetrievalEvaluation(long queryId, long chunkId, int relevance,
                                                               @NotNull RetrievalMethod method, int rank) {
        RetrievalJudgment judgment;
        try {
            judgment = new RetrievalJudgment(chunkId, relevance, null, null, method, rank);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        return queryCacheStorage.exists(queryId).thenCompose(exists -> {
            if (!exists) {
                throw new MemoryEntryNotFoundException(queryId, "Memory entry " + queryId + " not found");
            }
            return evaluationStorage.appendJudgment(queryId, UUID.randomUUID().toString(), judgment);
        });
    }

    /**
     * Appends a batch of judgments for one query under a new run id.
     *
     * @return the run id
     * @throws IllegalArgumentException (in the future) when the batch is empty or repeats a rank for a method
     * @throws MemoryEntryNotFoundException (in the future) when the query does not exist
     */
    public CompletableFuture<String> recordRun(long queryId, @NotNull List<RetrievalJudgment> judgments) {
        if (judgments.isEmpty()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("An evaluation run needs at least one judgment"));
        }
        Set<String> ranks = new HashSet<>();
        for (RetrievalJudgment judgment : judgments) {
            if (!ranks.add(judgment.methodTag() + "#" + judgment.rank())) {
                return CompletableFuture.failedFuture(new IllegalArgumentException(
                    "Duplicate rank " + judgment.rank() + " for method " + judgment.methodTag()));
            }
        }

        String runId = UUID.randomUUID().toString();
        return queryCacheStorage.exists(queryId).thenCompose(exists -> {
            if (!exists) {
                throw new MemoryEntryNotFoundException(queryId, "Memory entry " + queryId + " not found");
            }
            return evaluationStorage.appendRun(queryId, runId, judgments);
        }).thenApply(written -> {
            logger.debug("Recorded evaluation run {} for query {} ({} judgments)", runId, queryId, written);
            return runId;
        });
    }

    /**
     * Judges every chunk of an answer's context with the similarity heuristic and records
     * the judgments as one run, ranked by citation index.
     *
     * @return number of judgments written, 0 for an empty context
     */
    public CompletableFuture<Integer> recordHeuristicRun(long queryId, @NotNull OrderedContext context) {
        if (context.isEmpty()) {
            return CompletableFuture.completedFuture(0);
        }
        List<RetrievalJudgment> judgments = new ArrayList<>(context.size());
        for (ContextChunk contextChunk : context.chunks()) {
            judgments.add(heuristicJudge.judgeNow(contextChunk.chunk(), contextChunk.method(), contextChunk.citationIndex()));
        }
        return recordRun(queryId, judgments).thenApply(runId -> judgments.size());
    }

    public CompletableFuture<RetrievalEvalSummary> summary() {
        return evaluationStorage.findLatestRuns().thenCombine(
            evaluationStorage.countJudgments(),
            (runs, total) -> PrecisionCalculator.summarize(runs.values(), total)
        );
    }

    /**
     * Judgments of the latest run of a query, ascending rank. Empty when never judged.
     */
    public CompletableFuture<QueryJudgments> queryJudgments(long queryId) {
        return evaluationStorage.findLatestRun(queryId)
            .thenApply(judgments -> new QueryJudgments(queryId, judgments));
    }

    /**
     * Re-runs vector retrieval for the most recent memory entries and appends a heuristic
     * run for each, plus an LLM-judged run when {@code useLlm} is set. Entries are processed
     * one at a time; an entry that fails is logged and skipped.
     */
    public CompletableFuture<BackfillResult> backfill(int limit, int maxResults, boolean useLlm) {
        if (limit < 1) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("limit must be >= 1, got " + limit));
        }
        if (maxResults < 1) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("max_results must be >= 1, got " + maxResults));
        }

        return queryCacheStorage.findRecent(limit).thenCompose(entries -> {
            logger.info("Backfilling retrieval evaluations for {} queries (max_results={}, use_llm={})",
                entries.size(), maxResults, useLlm);

            BackfillTally tally = new BackfillTally();
            CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
            for (QueryCacheEntry entry : entries) {
                chain = chain.thenCompose(ignored -> backfillEntry(entry, maxResults, useLlm)
                    .handle((written, error) -> {
                        if (error != null) {
                            logger.warn("Backfill of query {} failed: {}", entry.id(), AsyncUtil.unwrap(error).getMessage());
                        } else if (written > 0) {
                            tally.queries++;
                            tally.judgments += written;
                        }
                        return null;
                    }));
            }
            return chain.thenApply(ignored -> {
                logger.info("Backfill complete: {} queries, {} judgments", tally.queries, tally.judgments);
                return new BackfillResult(tally.queries, tally.judgments);
            });
        });
    }

    /**
     * Evaluates a stored chunk with the quality heuristic and stores the result.
     */
    public CompletableFuture<ChunkEvaluation> evaluateChunk(long chunkId) {
        return vectorStorage.getChunk(chunkId).thenCompose(chunk -> {
            if (chunk.isEmpty()) {
                throw new ChunkNotFoundException(chunkId);
            }
            ChunkEvaluation evaluation = chunkQualityEvaluator.evaluate(chunkId, chunk.get().text());
            return evaluationStorage.insertChunkEvaluation(evaluation);
        });
    }

    public CompletableFuture<IngestionQualitySummary> qualitySummary() {
        return evaluationStorage.chunkQualityCounts(ChunkQualityEvaluator.CRITERIA).thenCombine(
            vectorStorage.getCorpusStats(),
            (counts, stats) -> new IngestionQualitySummary(
                counts,
                new IngestionQualitySummary.Overall(stats.uniqueDocuments(), stats.totalChunks())
            )
        );
    }

    private CompletableFuture<Integer> backfillEntry(QueryCacheEntry entry, int maxResults, boolean useLlm) {
        return vectorRetriever.search(entry.embedding(), maxResults).thenCompose(chunks -> {
            if (chunks.isEmpty()) {
                return CompletableFuture.completedFuture(0);
            }

            List<RetrievalJudgment> heuristic = new ArrayList<>(chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                heuristic.add(heuristicJudge.judgeNow(chunks.get(i), RetrievalMethod.VECTOR, i + 1));
            }

            CompletableFuture<Integer> written = recordRun(entry.id(), heuristic).thenApply(runId -> heuristic.size());
            if (!useLlm) {
                return written;
            }
            return written.thenCompose(count -> judgeWithLlm(entry.queryText(), chunks)
                .thenCompose(llmJudgments -> recordRun(entry.id(), llmJudgments))
                .thenApply(runId -> count + chunks.size()));
        });
    }

    private CompletableFuture<List<RetrievalJudgment>> judgeWithLlm(String query, List<RetrievedChunk> chunks) {
        List<RetrievalJudgment> judgments = new ArrayList<>(chunks.size());
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (int i = 0; i < chunks.size(); i++) {
            RetrievedChunk chunk = chunks.get(i);
            int rank = i + 1;
            chain = chain.thenCompose(ignored -> llmJudge.judge(query, chunk, RetrievalMethod.VECTOR, rank))
                .thenAccept(judgments::add);
        }
        return chain.thenApply(ignored -> judgments);
    }

    private static final class BackfillTally {
        private int queries;
        private int judgments;
    }
}
