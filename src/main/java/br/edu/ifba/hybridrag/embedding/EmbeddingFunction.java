package br.edu.ifba.hybridrag.embedding;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Functional interface for text-to-vector embedding.
 * Implementations call an embedding provider; the engine treats them as a black box
 * that returns fixed-dimension vectors.
 */
@FunctionalInterface
public interface EmbeddingFunction {

    /**
     * Generate embeddings for a batch of texts.
     *
     * @param texts texts to embed
     * @return CompletableFuture with one embedding vector per input text
     */
    CompletableFuture<List<float[]>> embed(@NotNull List<String> texts);

    /**
     * Convenience method for embedding a single text.
     */
    default CompletableFuture<float[]> embedSingle(@NotNull String text) {
        return embed(List.of(text)).thenApply(embeddings -> {
            if (embeddings.isEmpty()) {
                throw new IllegalStateException("Embedding provider returned no vector");
            }
            return embeddings.get(0);
        });
    }
}
