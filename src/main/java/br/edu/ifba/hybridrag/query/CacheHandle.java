package br.edu.ifba.hybridrag.query;

import br.edu.ifba.hybridrag.core.QueryCacheEntry;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.CompletableFuture;

/**
 * Outcome of admitting a query to the memory.
 *
 * <ul>
 *   <li>{@link Kind#HIT}: a stored answer matched; {@link #entry()} holds it</li>
 *   <li>{@link Kind#LEADER}: the caller must produce the answer, then call
 *       {@link #complete(QueryCacheEntry)} or {@link #fail(Throwable)}</li>
 *   <li>{@link Kind#FOLLOWER}: a similar query is already being answered;
 *       {@link #leaderResult()} completes with its stored entry</li>
 *   <li>{@link Kind#BYPASS}: the memory is unavailable; answer without it</li>
 * </ul>
 */
public final class CacheHandle {

    public enum Kind {
        HIT, LEADER, FOLLOWER, BYPASS
    }

    private final Kind kind;
    @Nullable
    private final QueryCacheEntry entry;
    @Nullable
    private final CompletableFuture<QueryCacheEntry> leaderResult;
    @Nullable
    private final QueryMemoryService.Admission admission;

    private CacheHandle(Kind kind,
                        @Nullable QueryCacheEntry entry,
                        @Nullable CompletableFuture<QueryCacheEntry> leaderResult,
                        @Nullable QueryMemoryService.Admission admission) {
        this.kind = kind;
        this.entry = entry;
        this.leaderResult = leaderResult;
        this.admission = admission;
    }

    static CacheHandle hit(@NotNull QueryCacheEntry entry) {
        return new CacheHandle(Kind.HIT, entry, null, null);
    }

    static CacheHandle leader(@NotNull QueryMemoryService.Admission admission) {
        return new CacheHandle(Kind.LEADER, null, null, admission);
    }

    static CacheHandle follower(@NotNull CompletableFuture<QueryCacheEntry> leaderResult) {
        return new CacheHandle(Kind.FOLLOWER, null, leaderResult, null);
    }

    static CacheHandle bypass() {
        return new CacheHandle(Kind.BYPASS, null, null, null);
    }

    public Kind kind() {
        return kind;
    }

    @NotNull
    public QueryCacheEntry entry() {
        if (entry == null) {
            throw new IllegalStateException("No entry on a " + kind + " handle");
        }
        return entry;
    }

    /**
     * A view of the leader's outcome. Cancelling the returned future does not affect the leader.
     */
    @NotNull
    public CompletableFuture<QueryCacheEntry> leaderResult() {
        if (leaderResult == null) {
            throw new IllegalStateException("No leader on a " + kind + " handle");
        }
        return leaderResult.thenApply(result -> result);
    }

    /**
     * Stores the leader's answer, then releases followers with the stored entry.
     *
     * @param draft the entry to store; its id is assigned by the store
     * @return the stored entry; fails if the store write failed
     */
    public CompletableFuture<QueryCacheEntry> complete(@NotNull QueryCacheEntry draft) {
        return requireAdmission().complete(draft);
    }

    /**
     * Gives up leadership. Followers fall back to answering on their own.
     */
    public void fail(@NotNull Throwable cause) {
        requireAdmission().fail(cause);
    }

    private QueryMemoryService.Admission requireAdmission() {
        if (admission == null) {
            throw new IllegalStateException("Only a LEADER handle can be completed, this is " + kind);
        }
        return admission;
    }
}
