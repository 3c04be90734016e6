package br.edu.ifba.hybridrag.query;

import br.edu.ifba.hybridrag.core.RetrievedChunk;
import br.edu.ifba.hybridrag.exception.UpstreamUnavailableException;
import br.edu.ifba.hybridrag.storage.VectorStorage;
import br.edu.ifba.hybridrag.utils.AsyncUtil;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Top-k chunk search by cosine similarity.
 *
 * <p>Results are at most {@code k} long, ordered by descending similarity with ties going
 * to the lower chunk id. Fewer than {@code k} results, or none, is a valid outcome.</p>
 */
public class VectorRetriever {

    private static final Logger logger = LoggerFactory.getLogger(VectorRetriever.class);

    private static final Comparator<RetrievedChunk> RANKING = Comparator
        .comparingDouble(RetrievedChunk::similarity).reversed()
        .thenComparingLong(RetrievedChunk::id);

    private final VectorStorage vectorStorage;

    public VectorRetriever(@NotNull VectorStorage vectorStorage) {
        this.vectorStorage = vectorStorage;
    }

    public CompletableFuture<List<RetrievedChunk>> search(@NotNull float[] queryEmbedding, int k) {
        if (k <= 0) {
            return CompletableFuture.completedFuture(List.of());
        }

        return vectorStorage.query(queryEmbedding, k)
            .thenApply(results -> normalize(results, k))
            .exceptionally(e -> {
                Throwable cause = AsyncUtil.unwrap(e);
                logger.warn("Vector search failed: {}", cause.getMessage());
                throw new UpstreamUnavailableException("vector-store", "Vector search failed: " + cause.getMessage(), cause);
            });
    }

    /**
     * Enforces the result contract regardless of the backing store: no duplicate chunk ids,
     * deterministic order, at most k results.
     */
    private List<RetrievedChunk> normalize(List<RetrievedChunk> results, int k) {
        List<RetrievedChunk> sorted = new ArrayList<>(results);
        sorted.sort(RANKING);

        Set<Long> seen = new HashSet<>();
        List<RetrievedChunk> unique = new ArrayList<>(Math.min(k, sorted.size()));
        for (RetrievedChunk chunk : sorted) {
            if (unique.size() == k) {
                break;
            }
            if (seen.add(chunk.id())) {
                unique.add(chunk);
            }
        }

        logger.debug("Vector search returned {} chunks (k={})", unique.size(), k);
        return unique;
    }
}
