package br.edu.ifba.hybridrag.feedback;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Aggregated user feedback.
 */
public record FeedbackMetrics(
    @JsonProperty("overall") Overall overall,
    @JsonProperty("rating_distribution") List<RatingCount> ratingDistribution
) {

    public record Overall(
        @JsonProperty("total_feedback") long totalFeedback,
        @JsonProperty("rated_count") long ratedCount,
        @JsonProperty("average_rating") Double averageRating,
        @JsonProperty("accuracy_rated_count") long accuracyRatedCount,
        @JsonProperty("average_accuracy_rating") Double averageAccuracyRating,
        @JsonProperty("comprehensiveness_rated_count") long comprehensivenessRatedCount,
        @JsonProperty("average_comprehensiveness_rating") Double averageComprehensivenessRating,
        @JsonProperty("helpfulness_rated_count") long helpfulnessRatedCount,
        @JsonProperty("average_helpfulness_rating") Double averageHelpfulnessRating,
        @JsonProperty("favorites_count") long favoritesCount,
        @JsonProperty("text_feedback_count") long textFeedbackCount
    ) {
    }

    public record RatingCount(
        @JsonProperty("rating") int rating,
        @JsonProperty("count") long count
    ) {
    }
}
