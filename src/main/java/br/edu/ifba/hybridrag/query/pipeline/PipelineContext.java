package br.edu.ifba.hybridrag.query.pipeline;

import br.edu.ifba.hybridrag.core.Answer;
import br.edu.ifba.hybridrag.core.GraphContext;
import br.edu.ifba.hybridrag.core.OrderedContext;
import br.edu.ifba.hybridrag.core.RetrievedChunk;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * State of one query as it flows through the pipeline.
 *
 * <pre>
 * embedding → [vector-search] → [graph-expansion] → [fusion] → [synthesis] → answer
 *                  ↓                   ↓               ↓            ↓
 *            vectorChunks        graphContext   orderedContext    answer
 * </pre>
 *
 * <p>The context also tracks the future of the call currently in flight, so that a
 * query past its deadline can cancel it and stop further stages from starting.</p>
 */
public final class PipelineContext {

    private final String query;
    private final int maxResults;

    @Nullable
    private volatile float[] queryEmbedding;

    private volatile List<RetrievedChunk> vectorChunks = List.of();
    private volatile GraphContext graphContext = GraphContext.empty();
    private volatile OrderedContext orderedContext = OrderedContext.empty();

    @Nullable
    private volatile Answer answer;

    private final AtomicReference<CompletableFuture<?>> inFlight = new AtomicReference<>();
    private volatile boolean cancelled = false;

    public PipelineContext(@NotNull String query, int maxResults) {
        this.query = query;
        this.maxResults = maxResults;
    }

    /**
     * Registers the future of the call now in flight. If the context was already
     * cancelled the future is cancelled immediately.
     */
    public <T> CompletableFuture<T> track(@NotNull CompletableFuture<T> future) {
        inFlight.set(future);
        if (cancelled) {
            future.cancel(true);
        }
        return future;
    }

    /**
     * Cancels the call in flight and marks the context so no further stage starts.
     */
    public void cancel() {
        cancelled = true;
        CompletableFuture<?> current = inFlight.get();
        if (current != null) {
            current.cancel(true);
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    @NotNull
    public String getQuery() {
        return query;
    }

    public int getMaxResults() {
        return maxResults;
    }

    @NotNull
    public float[] getQueryEmbedding() {
        float[] embedding = queryEmbedding;
        if (embedding == null) {
            throw new IllegalStateException("Query embedding not set");
        }
        return embedding;
    }

    public void setQueryEmbedding(@NotNull float[] queryEmbedding) {
        this.queryEmbedding = queryEmbedding;
    }

    @NotNull
    public List<RetrievedChunk> getVectorChunks() {
        return vectorChunks;
    }

    public void setVectorChunks(@NotNull List<RetrievedChunk> vectorChunks) {
        this.vectorChunks = List.copyOf(vectorChunks);
    }

    @NotNull
    public GraphContext getGraphContext() {
        return graphContext;
    }

    public void setGraphContext(@NotNull GraphContext graphContext) {
        this.graphContext = graphContext;
    }

    @NotNull
    public OrderedContext getOrderedContext() {
        return orderedContext;
    }

    public void setOrderedContext(@NotNull OrderedContext orderedContext) {
        this.orderedContext = orderedContext;
    }

    @Nullable
    public Answer getAnswer() {
        return answer;
    }

    public void setAnswer(@NotNull Answer answer) {
        this.answer = answer;
    }
}
