package br.edu.ifba.hybridrag.feedback;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * Stored feedback for one memory entry. Every rating is optional; a record with no
 * rating, no comment and no favorite flag is never persisted.
 */
public record FeedbackRecord(
    @JsonProperty("memory_id") long memoryId,
    @JsonProperty("rating") @Nullable Integer rating,
    @JsonProperty("accuracy_rating") @Nullable Integer accuracyRating,
    @JsonProperty("comprehensiveness_rating") @Nullable Integer comprehensivenessRating,
    @JsonProperty("helpfulness_rating") @Nullable Integer helpfulnessRating,
    @JsonProperty("feedback_text") @Nullable String feedbackText,
    @JsonProperty("is_favorite") boolean favorite,
    @JsonIgnore long version,
    @JsonProperty("created_at") @Nullable Instant createdAt,
    @JsonProperty("updated_at") @Nullable Instant updatedAt
) {

    public static FeedbackRecord blank(long memoryId) {
        return new FeedbackRecord(memoryId, null, null, null, null, null, false, 0L, null, null);
    }

    /**
     * True when nothing worth keeping is left: no rating of any kind, no comment, not a favorite.
     */
    @JsonIgnore
    public boolean isEmpty() {
        return rating == null
            && accuracyRating == null
            && comprehensivenessRating == null
            && helpfulnessRating == null
            && (feedbackText == null || feedbackText.isBlank())
            && !favorite;
    }

    public FeedbackRecord withFavorite(boolean newFavorite) {
        return new FeedbackRecord(memoryId, rating, accuracyRating, comprehensivenessRating,
            helpfulnessRating, feedbackText, newFavorite, version, createdAt, updatedAt);
    }
}
