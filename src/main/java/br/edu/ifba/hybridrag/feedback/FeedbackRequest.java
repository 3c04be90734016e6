package br.edu.ifba.hybridrag.feedback;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Partial feedback update. Absent fields leave the stored value untouched; fields named
 * in {@code clear} are removed.
 */
public record FeedbackRequest(
    @JsonProperty("memory_id")
    @NotNull(message = "memory_id is required")
    Long memoryId,

    @JsonProperty("rating")
    @Min(value = 1, message = "rating must be between 1 and 5")
    @Max(value = 5, message = "rating must be between 1 and 5")
    Integer rating,

    @JsonProperty("accuracy_rating")
    @Min(value = 1, message = "accuracy_rating must be between 1 and 5")
    @Max(value = 5, message = "accuracy_rating must be between 1 and 5")
    Integer accuracyRating,

    @JsonProperty("comprehensiveness_rating")
    @Min(value = 1, message = "comprehensiveness_rating must be between 1 and 5")
    @Max(value = 5, message = "comprehensiveness_rating must be between 1 and 5")
    Integer comprehensivenessRating,

    @JsonProperty("helpfulness_rating")
    @Min(value = 1, message = "helpfulness_rating must be between 1 and 5")
    @Max(value = 5, message = "helpfulness_rating must be between 1 and 5")
    Integer helpfulnessRating,

    @JsonProperty("feedback_text")
    @Size(max = 5000, message = "feedback_text must be at most 5000 characters")
    String feedbackText,

    @JsonProperty("is_favorite")
    Boolean favorite,

    @JsonProperty("clear")
    List<String> clear
) {

    public static FeedbackRequest rating(long memoryId, int rating) {
        return new FeedbackRequest(memoryId, rating, null, null, null, null, null, null);
    }

    public static FeedbackRequest text(long memoryId, String feedbackText) {
        return new FeedbackRequest(memoryId, null, null, null, null, feedbackText, null, null);
    }

    public static FeedbackRequest clearing(long memoryId, List<String> fields) {
        return new FeedbackRequest(memoryId, null, null, null, null, null, null, fields);
    }
}
