package br.edu.ifba.hybridrag.storage;

import br.edu.ifba.hybridrag.feedback.FavoriteEntry;
import br.edu.ifba.hybridrag.feedback.FeedbackMetrics;
import br.edu.ifba.hybridrag.feedback.FeedbackRecord;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Feedback records, one per memory entry, with version-checked writes.
 *
 * <p>Writes never overwrite blindly: {@link #insert} fails if a record already exists and
 * {@link #update}/{@link #delete} only apply when the stored version matches. Callers
 * re-read and retry when a write returns false.</p>
 */
public interface FeedbackStorage {

    CompletableFuture<Optional<FeedbackRecord>> find(long memoryId);

    /**
     * @return true if inserted, false if a record for the memory entry already exists
     */
    CompletableFuture<Boolean> insert(@NotNull FeedbackRecord record);

    /**
     * Replaces the record if its stored version still equals {@code record.version()};
     * the stored version is incremented.
     *
     * @return true if applied, false on a version mismatch or a missing record
     */
    CompletableFuture<Boolean> update(@NotNull FeedbackRecord record);

    /**
     * Deletes the record if its stored version equals {@code expectedVersion}.
     *
     * @return true if deleted
     */
    CompletableFuture<Boolean> delete(long memoryId, long expectedVersion);

    /**
     * Deletes the record unconditionally.
     *
     * @return true if a record existed
     */
    CompletableFuture<Boolean> delete(long memoryId);

    /**
     * @return favorite answers, most recently favorited first
     */
    CompletableFuture<List<FavoriteEntry>> findFavorites();

    CompletableFuture<FeedbackMetrics> metrics();
}
