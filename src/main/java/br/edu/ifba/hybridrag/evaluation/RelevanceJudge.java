package br.edu.ifba.hybridrag.evaluation;

import br.edu.ifba.hybridrag.core.RetrievalMethod;
import br.edu.ifba.hybridrag.core.RetrievedChunk;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * Decides whether a retrieved chunk is relevant to a query.
 */
public interface RelevanceJudge {

    /**
     * @param query the query text
     * @param chunk the retrieved chunk, with its similarity to the query
     * @param method the signal that retrieved the chunk
     * @param rank 1-based rank of the chunk in the retrieved list
     */
    CompletableFuture<RetrievalJudgment> judge(@NotNull String query, @NotNull RetrievedChunk chunk,
                                               @NotNull RetrievalMethod method, int rank);
}
