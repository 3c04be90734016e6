package br.edu.ifba.hybridrag.query.pipeline;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * A stage of the retrieval and synthesis pipeline.
 *
 * <p>Stages are stateless and thread-safe: they read their inputs from the
 * {@link PipelineContext}, write their outputs back to it and return it.</p>
 */
public interface PipelineStage {

    CompletableFuture<PipelineContext> process(@NotNull PipelineContext context);

    /**
     * @return stage name for logging, e.g. "vector-search"
     */
    String getName();

    /**
     * @return true if the stage has nothing to do for this context
     */
    default boolean shouldSkip(@NotNull PipelineContext context) {
        return false;
    }
}
