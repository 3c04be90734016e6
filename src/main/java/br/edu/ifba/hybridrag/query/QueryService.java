package br.edu.ifba.hybridrag.query;

import br.edu.ifba.hybridrag.core.Answer;
import br.edu.ifba.hybridrag.core.CitationMapping;
import br.edu.ifba.hybridrag.core.ContextSnapshot;
import br.edu.ifba.hybridrag.core.OrderedContext;
import br.edu.ifba.hybridrag.core.QueryCacheEntry;
import br.edu.ifba.hybridrag.embedding.EmbeddingFunction;
import br.edu.ifba.hybridrag.evaluation.EvaluationService;
import br.edu.ifba.hybridrag.exception.QueryTimeoutException;
import br.edu.ifba.hybridrag.exception.UpstreamUnavailableException;
import br.edu.ifba.hybridrag.query.pipeline.PipelineContext;
import br.edu.ifba.hybridrag.query.pipeline.QueryPipeline;
import br.edu.ifba.hybridrag.utils.AsyncUtil;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Answers queries: embed, consult the query memory, and on a miss run retrieval and
 * synthesis through the pipeline and remember the result.
 *
 * <p>The whole answer path runs under one deadline. When it expires the call in flight is
 * cancelled, a leader admission is failed so its followers answer on their own, and the
 * caller gets a {@link QueryTimeoutException} instead of a partial answer.</p>
 */
public class QueryService {

    private static final Logger logger = LoggerFactory.getLogger(QueryService.class);

    private final EmbeddingFunction embeddingFunction;
    private final QueryMemoryService memoryService;
    private final QueryPipeline pipeline;
    private final EvaluationService evaluationService;
    private final Settings settings;
    private final Executor admissionExecutor;

    public QueryService(
            @NotNull EmbeddingFunction embeddingFunction,
            @NotNull QueryMemoryService memoryService,
            @NotNull QueryPipeline pipeline,
            @NotNull EvaluationService evaluationService,
            @NotNull Settings settings) {
        this(embeddingFunction, memoryService, pipeline, evaluationService, settings, ForkJoinPool.commonPool());
    }

    public QueryService(
            @NotNull EmbeddingFunction embeddingFunction,
            @NotNull QueryMemoryService memoryService,
            @NotNull QueryPipeline pipeline,
            @NotNull EvaluationService evaluationService,
            @NotNull Settings settings,
            @NotNull Executor admissionExecutor) {
        this.embeddingFunction = embeddingFunction;
        this.memoryService = memoryService;
        this.pipeline = pipeline;
        this.evaluationService = evaluationService;
        this.settings = settings;
        this.admissionExecutor = admissionExecutor;
    }

    /**
     * Synchronous variant of {@link #queryAsync}, rethrowing the domain exception.
     */
    public QueryResult query(@NotNull String query, @Nullable Integer maxResults, @Nullable Boolean useMemory) {
        return AsyncUtil.await(queryAsync(query, maxResults, useMemory));
    }

    /**
     * @param query the question
     * @param maxResults number of vector results, the configured default when null
     * @param useMemory false to skip the memory lookup; the answer is still remembered
     */
    public CompletableFuture<QueryResult> queryAsync(@NotNull String query, @Nullable Integer maxResults,
                                                     @Nullable Boolean useMemory) {
        final int k;
        try {
            k = resolveMaxResults(query, maxResults);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }

        boolean consultMemory = settings.memoryEnabled() && !Boolean.FALSE.equals(useMemory);
        PipelineContext context = new PipelineContext(query.strip(), k);
        AtomicReference<CacheHandle> handleRef = new AtomicReference<>();
        long start = System.currentTimeMillis();

        CompletableFuture<Outcome> answered = context.track(embed(context.getQuery()))
            .thenCompose(embedding -> {
                context.setQueryEmbedding(embedding);
                if (!consultMemory) {
                    return answerAndSave(context);
                }
                return CompletableFuture.supplyAsync(() -> memoryService.admit(embedding), admissionExecutor)
                    .thenCompose(handle -> {
                        handleRef.set(handle);
                        return dispatch(handle, context);
                    });
            });

        return answered
            .orTimeout(settings.deadline().toMillis(), TimeUnit.MILLISECONDS)
            .exceptionally(error -> {
                Throwable cause = AsyncUtil.unwrap(error);
                if (cause instanceof TimeoutException) {
                    onDeadline(context, handleRef.get(), cause);
                    throw new QueryTimeoutException(settings.deadline(), cause);
                }
                throw error instanceof CompletionException completion ? completion : new CompletionException(cause);
            })
            .thenCompose(this::recordEvaluation)
            .thenApply(result -> {
                logger.info("Query answered in {}ms (memory_id={}, from_memory={}, low_confidence={})",
                    System.currentTimeMillis() - start, result.memoryId(),
                    result.answer().fromMemory(), result.answer().lowConfidence());
                return result;
            });
    }

    private CompletableFuture<Outcome> dispatch(CacheHandle handle, PipelineContext context) {
        switch (handle.kind()) {
            case HIT:
                return CompletableFuture.completedFuture(Outcome.remembered(fromEntry(context.getQuery(), handle.entry())));
            case FOLLOWER:
                return answerAsFollower(handle, context);
            case LEADER:
                return answerAsLeader(handle, context);
            case BYPASS:
            default:
                return answerAndSave(context);
        }
    }

    private CompletableFuture<Outcome> answerAsLeader(CacheHandle handle, PipelineContext context) {
        return pipeline.execute(context)
            .whenComplete((ignored, error) -> {
                if (error != null) {
                    handle.fail(AsyncUtil.unwrap(error));
                }
            })
            .thenCompose(ctx -> {
                QueryCacheEntry draft = toDraft(ctx);
                return handle.complete(draft).handle((stored, error) -> {
                    if (error != null) {
                        logger.warn("Answer not remembered: {}", AsyncUtil.unwrap(error).getMessage());
                        return Outcome.fresh(resultFor(ctx, QueryResult.NOT_STORED), ctx.getOrderedContext());
                    }
                    return Outcome.fresh(resultFor(ctx, stored.id()), ctx.getOrderedContext());
                });
            });
    }

    private CompletableFuture<Outcome> answerAsFollower(CacheHandle handle, PipelineContext context) {
        return context.track(handle.leaderResult()).handle((entry, error) -> {
            if (error != null) {
                Throwable cause = AsyncUtil.unwrap(error);
                if (context.isCancelled()) {
                    return CompletableFuture.<Outcome>failedFuture(cause);
                }
                logger.info("Leader of a colliding query failed ({}), answering without memory", cause.getMessage());
                return pipeline.execute(context)
                    .thenApply(ctx -> Outcome.fresh(resultFor(ctx, QueryResult.NOT_STORED), ctx.getOrderedContext()));
            }
            return memoryService.recordReuse(entry)
                .exceptionally(reuseError -> {
                    logger.warn("Could not record reuse of memory entry {}: {}", entry.id(), reuseError.getMessage());
                    return entry;
                })
                .thenApply(reused -> Outcome.remembered(fromEntry(context.getQuery(), reused)));
        }).thenCompose(next -> next);
    }

    /**
     * Runs the pipeline outside any admission and stores the answer on a best-effort basis.
     */
    private CompletableFuture<Outcome> answerAndSave(PipelineContext context) {
        return pipeline.execute(context).thenCompose(ctx -> memoryService.save(toDraft(ctx))
            .handle((stored, error) -> {
                if (error != null) {
                    logger.warn("Answer not remembered: {}", AsyncUtil.unwrap(error).getMessage());
                    return Outcome.fresh(resultFor(ctx, QueryResult.NOT_STORED), ctx.getOrderedContext());
                }
                return Outcome.fresh(resultFor(ctx, stored.id()), ctx.getOrderedContext());
            }));
    }

    private CompletableFuture<QueryResult> recordEvaluation(Outcome outcome) {
        QueryResult result = outcome.result();
        if (!settings.autoRecordEvaluations() || outcome.context() == null || !result.isStored()) {
            return CompletableFuture.completedFuture(result);
        }
        return evaluationService.recordHeuristicRun(result.memoryId(), outcome.context())
            .handle((written, error) -> {
                if (error != null) {
                    logger.warn("Could not record retrieval evaluation for memory entry {}: {}",
                        result.memoryId(), AsyncUtil.unwrap(error).getMessage());
                } else {
                    logger.debug("Recorded {} retrieval judgments for memory entry {}", written, result.memoryId());
                }
                return result;
            });
    }

    private void onDeadline(PipelineContext context, @Nullable CacheHandle handle, Throwable cause) {
        logger.warn("Query exceeded its deadline of {}ms, cancelling", settings.deadline().toMillis());
        context.cancel();
        if (handle != null && handle.kind() == CacheHandle.Kind.LEADER) {
            handle.fail(cause);
        }
    }

    private CompletableFuture<float[]> embed(String query) {
        return embeddingFunction.embedSingle(query).exceptionally(error -> {
            Throwable cause = AsyncUtil.unwrap(error);
            if (cause instanceof UpstreamUnavailableException upstream) {
                throw upstream;
            }
            throw new UpstreamUnavailableException("embedding", "Query embedding failed: " + cause.getMessage(), cause);
        });
    }

    private int resolveMaxResults(String query, @Nullable Integer maxResults) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        int k = maxResults == null ? settings.defaultMaxResults() : maxResults;
        if (k < 1 || k > settings.maxResultsLimit()) {
            throw new IllegalArgumentException(
                "max_results must be between 1 and " + settings.maxResultsLimit() + ", got " + k);
        }
        return k;
    }

    private static QueryCacheEntry toDraft(PipelineContext ctx) {
        Answer answer = requireAnswer(ctx);
        OrderedContext ordered = ctx.getOrderedContext();
        List<CitationMapping> citations = new ArrayList<>(answer.usedCitations().size());
        for (int index : answer.usedCitations()) {
            citations.add(new CitationMapping(index, ordered.chunks().get(index - 1).chunk().id()));
        }
        return new QueryCacheEntry(
            0L,
            ctx.getQuery(),
            ctx.getQueryEmbedding(),
            answer.text(),
            citations,
            ContextSnapshot.of(ordered),
            answer.lowConfidence(),
            0L,
            Instant.now()
        );
    }

    private static QueryResult resultFor(PipelineContext ctx, long memoryId) {
        return new QueryResult(ctx.getQuery(), requireAnswer(ctx), memoryId, ContextSnapshot.of(ctx.getOrderedContext()));
    }

    private static QueryResult fromEntry(String query, QueryCacheEntry entry) {
        List<Integer> used = entry.citations().stream().map(CitationMapping::citation).sorted().toList();
        Answer answer = new Answer(entry.answerText(), used, entry.lowConfidence(), true);
        return new QueryResult(query, answer, entry.id(), entry.context());
    }

    private static Answer requireAnswer(PipelineContext ctx) {
        Answer answer = ctx.getAnswer();
        if (answer == null) {
            throw new IllegalStateException("Pipeline finished without an answer");
        }
        return answer;
    }

    /**
     * A result plus, for fresh answers, the context it was synthesized from.
     */
    private record Outcome(QueryResult result, @Nullable OrderedContext context) {

        static Outcome fresh(QueryResult result, OrderedContext context) {
            return new Outcome(result, context);
        }

        static Outcome remembered(QueryResult result) {
            return new Outcome(result, null);
        }
    }

    /**
     * Query-level settings.
     */
    public record Settings(
        boolean memoryEnabled,
        boolean autoRecordEvaluations,
        int defaultMaxResults,
        int maxResultsLimit,
        @NotNull Duration deadline
    ) {

        public Settings {
            if (defaultMaxResults < 1 || defaultMaxResults > maxResultsLimit) {
                throw new IllegalArgumentException("defaultMaxResults must be between 1 and maxResultsLimit");
            }
            if (deadline.isZero() || deadline.isNegative()) {
                throw new IllegalArgumentException("deadline must be positive");
            }
        }
    }
}
