package br.edu.ifba.hybridrag.query.pipeline;

import br.edu.ifba.hybridrag.query.VectorRetriever;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * Retrieves the top {@code maxResults} chunks for the query embedding.
 */
public class VectorSearchStage implements PipelineStage {

    private static final String STAGE_NAME = "vector-search";

    private final VectorRetriever vectorRetriever;

    public VectorSearchStage(@NotNull VectorRetriever vectorRetriever) {
        this.vectorRetriever = vectorRetriever;
    }

    @Override
    public CompletableFuture<PipelineContext> process(@NotNull PipelineContext context) {
        return context.track(vectorRetriever.search(context.getQueryEmbedding(), context.getMaxResults()))
            .thenApply(chunks -> {
                context.setVectorChunks(chunks);
                return context;
            });
    }

    @Override
    public String getName() {
        return STAGE_NAME;
    }
}
