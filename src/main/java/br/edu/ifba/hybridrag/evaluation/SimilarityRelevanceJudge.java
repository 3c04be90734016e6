package br.edu.ifba.hybridrag.evaluation;

import br.edu.ifba.hybridrag.core.RetrievalMethod;
import br.edu.ifba.hybridrag.core.RetrievedChunk;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Heuristic judge: a chunk is relevant when its similarity to the query reaches the threshold.
 */
public class SimilarityRelevanceJudge implements RelevanceJudge {

    private final double threshold;

    public SimilarityRelevanceJudge(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public CompletableFuture<RetrievalJudgment> judge(@NotNull String query, @NotNull RetrievedChunk chunk,
                                                      @NotNull RetrievalMethod method, int rank) {
        return CompletableFuture.completedFuture(judgeNow(chunk, method, rank));
    }

    public RetrievalJudgment judgeNow(@NotNull RetrievedChunk chunk, @NotNull RetrievalMethod method, int rank) {
        int relevance = chunk.similarity() >= threshold ? 1 : 0;
        String explanation = String.format(Locale.ROOT, "similarity=%.3f threshold=%s", chunk.similarity(), threshold);
        return new RetrievalJudgment(chunk.id(), relevance, null, explanation, method, rank);
    }

    public double getThreshold() {
        return threshold;
    }
}
