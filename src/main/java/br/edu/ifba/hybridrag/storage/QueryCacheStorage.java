package br.edu.ifba.hybridrag.storage;

import br.edu.ifba.hybridrag.core.QueryCacheEntry;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Persistent store of remembered answers. Entries are immutable apart from their hit count.
 */
public interface QueryCacheStorage {

    /**
     * Persists a new entry. The id of the given entry is ignored.
     *
     * @return the stored entry with its assigned id
     */
    CompletableFuture<QueryCacheEntry> insert(@NotNull QueryCacheEntry entry);

    /**
     * Finds the stored entry whose embedding is most similar to the given one.
     *
     * @return the best match with its cosine similarity, or empty when the store is empty
     */
    CompletableFuture<Optional<CacheMatch>> findNearest(@NotNull float[] embedding);

    /**
     * Increments the hit count of an entry.
     *
     * @return the new hit count
     */
    CompletableFuture<Long> incrementHitCount(long id);

    CompletableFuture<Optional<QueryCacheEntry>> findById(long id);

    CompletableFuture<Boolean> exists(long id);

    /**
     * @return up to {@code limit} entries, newest first
     */
    CompletableFuture<List<QueryCacheEntry>> findRecent(int limit);

    CompletableFuture<Long> count();

    record CacheMatch(@NotNull QueryCacheEntry entry, double similarity) {
    }
}
