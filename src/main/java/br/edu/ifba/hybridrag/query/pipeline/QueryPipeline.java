package br.edu.ifba.hybridrag.query.pipeline;

import br.edu.ifba.hybridrag.utils.AsyncUtil;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Runs a query context through its stages sequentially.
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * QueryPipeline pipeline = QueryPipeline.builder()
 *     .addStage(new VectorSearchStage(vectorRetriever))
 *     .addStage(new GraphExpansionStage(graphRetriever))
 *     .addStage(new FusionStage(new ContextAssembler()))
 *     .addStage(new SynthesisStage(answerSynthesizer))
 *     .build();
 *
 * PipelineContext done = pipeline.execute(context).join();
 * }</pre>
 *
 * <p>Stage failures propagate unchanged when they are already runtime exceptions, so
 * domain errors such as an unavailable upstream keep their type.</p>
 */
public class QueryPipeline {

    private static final Logger logger = LoggerFactory.getLogger(QueryPipeline.class);

    private final List<PipelineStage> stages;

    private QueryPipeline(Builder builder) {
        this.stages = List.copyOf(builder.stages);
    }

    public CompletableFuture<PipelineContext> execute(@NotNull PipelineContext context) {
        long startTime = System.currentTimeMillis();

        CompletableFuture<PipelineContext> future = CompletableFuture.completedFuture(context);
        for (PipelineStage stage : stages) {
            future = future.thenCompose(ctx -> executeStage(stage, ctx));
        }

        return future.thenApply(ctx -> {
            logger.debug("Pipeline completed in {}ms with {} context chunks",
                System.currentTimeMillis() - startTime, ctx.getOrderedContext().size());
            return ctx;
        });
    }

    private CompletableFuture<PipelineContext> executeStage(
            @NotNull PipelineStage stage,
            @NotNull PipelineContext context) {

        if (context.isCancelled()) {
            return CompletableFuture.failedFuture(
                new CancellationException("Pipeline cancelled before stage " + stage.getName()));
        }
        if (stage.shouldSkip(context)) {
            logger.debug("Skipping stage: {}", stage.getName());
            return CompletableFuture.completedFuture(context);
        }

        logger.debug("Executing stage: {}", stage.getName());
        long stageStart = System.currentTimeMillis();

        return stage.process(context)
            .thenApply(ctx -> {
                logger.debug("Stage {} completed in {}ms", stage.getName(), System.currentTimeMillis() - stageStart);
                return ctx;
            })
            .exceptionally(e -> {
                Throwable cause = AsyncUtil.unwrap(e);
                if (cause instanceof CancellationException cancelled) {
                    logger.debug("Stage {} cancelled", stage.getName());
                    throw cancelled;
                }
                logger.error("Stage {} failed: {}", stage.getName(), cause.getMessage());
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new PipelineException("Stage " + stage.getName() + " failed", cause);
            });
    }

    public List<PipelineStage> getStages() {
        return stages;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<PipelineStage> stages = new ArrayList<>();

        public Builder addStage(@NotNull PipelineStage stage) {
            stages.add(stage);
            return this;
        }

        public QueryPipeline build() {
            if (stages.isEmpty()) {
                throw new IllegalStateException("At least one stage is required");
            }
            return new QueryPipeline(this);
        }
    }

    /**
     * Thrown when a stage fails with a checked exception.
     */
    public static class PipelineException extends RuntimeException {
        public PipelineException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
