package br.edu.ifba.hybridrag.query.pipeline;

import br.edu.ifba.hybridrag.query.GraphRetriever;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * Adds entities, community summaries and related chunks reached through the graph.
 * Skipped when vector search found nothing to expand from.
 */
public class GraphExpansionStage implements PipelineStage {

    private static final String STAGE_NAME = "graph-expansion";

    private final GraphRetriever graphRetriever;

    public GraphExpansionStage(@NotNull GraphRetriever graphRetriever) {
        this.graphRetriever = graphRetriever;
    }

    @Override
    public CompletableFuture<PipelineContext> process(@NotNull PipelineContext context) {
        return context.track(graphRetriever.expand(context.getVectorChunks()))
            .thenApply(graphContext -> {
                context.setGraphContext(graphContext);
                return context;
            });
    }

    @Override
    public String getName() {
        return STAGE_NAME;
    }

    @Override
    public boolean shouldSkip(@NotNull PipelineContext context) {
        return context.getVectorChunks().isEmpty();
    }
}
