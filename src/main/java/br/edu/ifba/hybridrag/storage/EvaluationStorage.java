package br.edu.ifba.hybridrag.storage;

import br.edu.ifba.hybridrag.evaluation.ChunkEvaluation;
import br.edu.ifba.hybridrag.evaluation.QualityCounts;
import br.edu.ifba.hybridrag.evaluation.RetrievalJudgment;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Append-only store of retrieval judgments and chunk-quality evaluations.
 */
public interface EvaluationStorage {

    /**
     * Appends one evaluation run for a query atomically.
     *
     * @param queryId memory entry the judged retrieval belongs to
     * @param runId identifier shared by every judgment of the run
     * @param judgments judgments; rank positions must be unique per method
     * @return number of rows written
     */
    CompletableFuture<Integer> appendRun(long queryId, @NotNull String runId, @NotNull List<RetrievalJudgment> judgments);

    /**
     * Appends one judgment to the query's most recent run while that run has no judgment
     * at the same method and rank; otherwise the judgment opens the run {@code newRunId}.
     *
     * @return the run id the judgment was written under
     */
    CompletableFuture<String> appendJudgment(long queryId, @NotNull String newRunId, @NotNull RetrievalJudgment judgment);

    /**
     * @return for every judged query, the judgments of its most recent run
     */
    CompletableFuture<Map<Long, List<RetrievalJudgment>>> findLatestRuns();

    /**
     * @return judgments of the query's most recent run, ascending rank, with chunk text
     */
    CompletableFuture<List<RetrievalJudgment>> findLatestRun(long queryId);

    CompletableFuture<Long> countJudgments();

    CompletableFuture<ChunkEvaluation> insertChunkEvaluation(@NotNull ChunkEvaluation evaluation);

    CompletableFuture<QualityCounts> chunkQualityCounts(@NotNull String criteria);
}
