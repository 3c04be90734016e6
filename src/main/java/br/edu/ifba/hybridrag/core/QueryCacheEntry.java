package br.edu.ifba.hybridrag.core;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.List;

/**
 * One remembered answer: the canonical answer for a semantic class of queries.
 *
 * <p>The embedding is copied on the way in and out, so an entry's
 * fingerprint can never change after creation.</p>
 */
public record QueryCacheEntry(
    long id,
    @NotNull String queryText,
    @NotNull float[] embedding,
    @NotNull String answerText,
    @NotNull List<CitationMapping> citations,
    @NotNull ContextSnapshot context,
    boolean lowConfidence,
    long hitCount,
    @NotNull Instant createdAt
) {

    public QueryCacheEntry {
        if (embedding == null || embedding.length == 0) {
            throw new IllegalArgumentException("Query cache entry requires a non-empty embedding");
        }
        embedding = embedding.clone();
        citations = List.copyOf(citations);
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    public QueryCacheEntry withHitCount(long newHitCount) {
        return new QueryCacheEntry(id, queryText, embedding, answerText, citations, context,
            lowConfidence, newHitCount, createdAt);
    }
}
