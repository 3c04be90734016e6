package br.edu.ifba.hybridrag.feedback;

import br.edu.ifba.hybridrag.exception.FavoriteToggleException;
import br.edu.ifba.hybridrag.exception.InvalidFeedbackException;
import br.edu.ifba.hybridrag.exception.MemoryEntryNotFoundException;
import br.edu.ifba.hybridrag.exception.PersistenceConflictException;
import br.edu.ifba.hybridrag.storage.FeedbackStorage;
import br.edu.ifba.hybridrag.storage.QueryCacheStorage;
import br.edu.ifba.hybridrag.utils.AsyncUtil;
import br.edu.ifba.hybridrag.utils.RetryEventLogger;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * User feedback on remembered answers.
 *
 * <p>Every write is a read-modify-write against a versioned row: the current record is
 * read, the change is merged into it and the result is written only if the row has not
 * changed since. On a lost race the whole cycle is repeated, up to the configured number
 * of retries, so concurrent partial updates never overwrite each other.</p>
 *
 * <p>A record that ends up with no rating, no comment and no favorite flag is deleted.</p>
 */
public class FeedbackService {

    private static final Logger logger = LoggerFactory.getLogger(FeedbackService.class);

    private static final String FEEDBACK_OPERATION = "feedback-upsert";
    private static final String FAVORITE_OPERATION = "favorite-toggle";

    private final FeedbackStorage feedbackStorage;
    private final QueryCacheStorage queryCacheStorage;
    private final RetryEventLogger retryEventLogger;
    private final int maxConflictRetries;

    public FeedbackService(
            @NotNull FeedbackStorage feedbackStorage,
            @NotNull QueryCacheStorage queryCacheStorage,
            @NotNull RetryEventLogger retryEventLogger,
            int maxConflictRetries) {
        if (maxConflictRetries < 0) {
            throw new IllegalArgumentException("maxConflictRetries must be >= 0, got " + maxConflictRetries);
        }
        this.feedbackStorage = feedbackStorage;
        this.queryCacheStorage = queryCacheStorage;
        this.retryEventLogger = retryEventLogger;
        this.maxConflictRetries = maxConflictRetries;
    }

    /**
     * Merges a partial update into the stored feedback of a memory entry.
     *
     * @return the stored record, or empty when the update left nothing to keep and the record was removed
     */
    public CompletableFuture<Optional<FeedbackRecord>> upsertFeedback(@NotNull FeedbackRequest request) {
        final Set<FeedbackField> cleared;
        try {
            cleared = validate(request);
        } catch (InvalidFeedbackException e) {
            return CompletableFuture.failedFuture(e);
        }

        long memoryId = request.memoryId();
        return requireMemoryEntry(memoryId)
            .thenCompose(ignored -> writeWithRetry(memoryId, current -> merge(current, request, cleared),
                FEEDBACK_OPERATION, 1))
            .thenApply(stored -> {
                logger.info("Feedback for memory entry {} {}", memoryId, stored.isPresent() ? "saved" : "removed");
                return stored;
            });
    }

    public CompletableFuture<FeedbackRecord> getFeedback(long memoryId) {
        return feedbackStorage.find(memoryId).thenApply(found -> found.orElseThrow(
            () -> new MemoryEntryNotFoundException(memoryId, "No feedback for memory entry " + memoryId)));
    }

    /**
     * Deletes all feedback of a memory entry, favorite flag included.
     */
    public CompletableFuture<Void> clearFeedback(long memoryId) {
        return feedbackStorage.delete(memoryId).thenAccept(deleted -> {
            if (!deleted) {
                throw new MemoryEntryNotFoundException(memoryId, "No feedback for memory entry " + memoryId);
            }
            logger.info("Feedback for memory entry {} deleted", memoryId);
        });
    }

    /**
     * Sets or unsets the favorite flag without touching ratings or comment.
     *
     * @return the stored record, or empty when unfavoriting left nothing to keep
     * @throws FavoriteToggleException (in the future) for any failure, carrying the HTTP status to report
     */
    public CompletableFuture<Optional<FeedbackRecord>> setFavorite(long memoryId, boolean favorite) {
        return requireMemoryEntry(memoryId)
            .thenCompose(ignored -> writeWithRetry(memoryId, current -> current.withFavorite(favorite),
                FAVORITE_OPERATION, 1))
            .handle((stored, error) -> {
                if (error != null) {
                    Throwable cause = AsyncUtil.unwrap(error);
                    throw new FavoriteToggleException(memoryId, statusFor(cause), cause);
                }
                logger.info("Memory entry {} {} favorites", memoryId, favorite ? "added to" : "removed from");
                return stored;
            });
    }

    public CompletableFuture<List<FavoriteEntry>> favorites() {
        return feedbackStorage.findFavorites();
    }

    public CompletableFuture<FeedbackMetrics> metrics() {
        return feedbackStorage.metrics();
    }

    private CompletableFuture<Void> requireMemoryEntry(long memoryId) {
        return queryCacheStorage.exists(memoryId).thenAccept(exists -> {
            if (!exists) {
                throw new MemoryEntryNotFoundException(memoryId, "Memory entry " + memoryId + " not found");
            }
        });
    }

    private CompletableFuture<Optional<FeedbackRecord>> writeWithRetry(
            long memoryId, UnaryOperator<FeedbackRecord> change, String operation, int attempt) {
        return feedbackStorage.find(memoryId)
            .thenCompose(current -> writeOnce(memoryId, current, change))
            .thenCompose(outcome -> {
                if (outcome.applied()) {
                    if (attempt > 1) {
                        retryEventLogger.logRetrySuccess(operation, attempt);
                    }
                    return CompletableFuture.completedFuture(outcome.stored());
                }

                int maxAttempts = maxConflictRetries + 1;
                if (attempt >= maxAttempts) {
                    retryEventLogger.logRetryExhausted(operation, attempt, "version conflict");
                    throw new PersistenceConflictException(memoryId, attempt);
                }
                retryEventLogger.logRetryAttempt(operation, attempt, maxAttempts, "version conflict");
                return writeWithRetry(memoryId, change, operation, attempt + 1);
            });
    }

    private CompletableFuture<WriteOutcome> writeOnce(long memoryId, Optional<FeedbackRecord> current,
                                                      UnaryOperator<FeedbackRecord> change) {
        FeedbackRecord base = current.orElseGet(() -> FeedbackRecord.blank(memoryId));
        FeedbackRecord merged = change.apply(base);

        if (current.isEmpty()) {
            if (merged.isEmpty()) {
                return CompletableFuture.completedFuture(WriteOutcome.done(Optional.empty()));
            }
            return feedbackStorage.insert(merged).thenCompose(inserted -> inserted
                ? feedbackStorage.find(memoryId).thenApply(WriteOutcome::done)
                : CompletableFuture.completedFuture(WriteOutcome.conflict()));
        }

        if (merged.isEmpty()) {
            return feedbackStorage.delete(memoryId, base.version()).thenApply(deleted -> deleted
                ? WriteOutcome.done(Optional.empty())
                : WriteOutcome.conflict());
        }
        return feedbackStorage.update(merged).thenCompose(updated -> updated
            ? feedbackStorage.find(memoryId).thenApply(WriteOutcome::done)
            : CompletableFuture.completedFuture(WriteOutcome.conflict()));
    }

    static FeedbackRecord merge(FeedbackRecord current, FeedbackRequest request, Set<FeedbackField> cleared) {
        return new FeedbackRecord(
            current.memoryId(),
            pick(cleared.contains(FeedbackField.RATING), request.rating(), current.rating()),
            pick(cleared.contains(FeedbackField.ACCURACY_RATING), request.accuracyRating(), current.accuracyRating()),
            pick(cleared.contains(FeedbackField.COMPREHENSIVENESS_RATING),
                request.comprehensivenessRating(), current.comprehensivenessRating()),
            pick(cleared.contains(FeedbackField.HELPFULNESS_RATING),
                request.helpfulnessRating(), current.helpfulnessRating()),
            pick(cleared.contains(FeedbackField.FEEDBACK_TEXT), normalizeText(request.feedbackText()),
                current.feedbackText()),
            cleared.contains(FeedbackField.IS_FAVORITE)
                ? false
                : (request.favorite() != null ? request.favorite() : current.favorite()),
            current.version(),
            current.createdAt(),
            current.updatedAt()
        );
    }

    /**
     * Checks what bean validation checks, for callers that bypass the REST layer, plus the
     * rules that span fields.
     */
    static Set<FeedbackField> validate(FeedbackRequest request) {
        if (request.memoryId() == null) {
            throw new InvalidFeedbackException("memory_id is required");
        }
        checkRating("rating", request.rating());
        checkRating("accuracy_rating", request.accuracyRating());
        checkRating("comprehensiveness_rating", request.comprehensivenessRating());
        checkRating("helpfulness_rating", request.helpfulnessRating());

        Set<FeedbackField> cleared = EnumSet.noneOf(FeedbackField.class);
        if (request.clear() != null) {
            for (String name : request.clear()) {
                cleared.add(FeedbackField.fromWireName(name));
            }
        }

        for (FeedbackField field : cleared) {
            if (isProvided(field, request)) {
                throw new InvalidFeedbackException("Field " + field.wireName() + " cannot be both set and cleared");
            }
        }

        boolean anyProvided = false;
        for (FeedbackField field : FeedbackField.values()) {
            anyProvided |= isProvided(field, request);
        }
        if (!anyProvided && cleared.isEmpty()) {
            throw new InvalidFeedbackException("No feedback provided");
        }
        return cleared;
    }

    private static boolean isProvided(FeedbackField field, FeedbackRequest request) {
        return switch (field) {
            case RATING -> request.rating() != null;
            case ACCURACY_RATING -> request.accuracyRating() != null;
            case COMPREHENSIVENESS_RATING -> request.comprehensivenessRating() != null;
            case HELPFULNESS_RATING -> request.helpfulnessRating() != null;
            case FEEDBACK_TEXT -> request.feedbackText() != null;
            case IS_FAVORITE -> request.favorite() != null;
        };
    }

    private static void checkRating(String name, Integer value) {
        if (value != null && (value < 1 || value > 5)) {
            throw new InvalidFeedbackException(name + " must be between 1 and 5, got " + value);
        }
    }

    private static <T> T pick(boolean clear, T requested, T current) {
        if (clear) {
            return null;
        }
        return requested != null ? requested : current;
    }

    private static String normalizeText(String text) {
        if (text == null) {
            return null;
        }
        String stripped = text.strip();
        return stripped.isEmpty() ? null : stripped;
    }

    private static int statusFor(Throwable cause) {
        if (cause instanceof MemoryEntryNotFoundException) {
            return 404;
        }
        if (cause instanceof PersistenceConflictException) {
            return 409;
        }
        return 500;
    }

    private record WriteOutcome(boolean applied, Optional<FeedbackRecord> stored) {

        static WriteOutcome done(Optional<FeedbackRecord> stored) {
            return new WriteOutcome(true, stored);
        }

        static WriteOutcome conflict() {
            return new WriteOutcome(false, Optional.empty());
        }
    }
}
