package br.edu.ifba.hybridrag.feedback;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A remembered answer the user marked as favorite, with the ratings given to it.
 */
public record FavoriteEntry(
    @JsonProperty("memory_id") long memoryId,
    @JsonProperty("query_text") String queryText,
    @JsonProperty("answer_text") String answerText,
    @JsonProperty("references") List<String> references,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("rating") Integer rating,
    @JsonProperty("accuracy_rating") Integer accuracyRating,
    @JsonProperty("comprehensiveness_rating") Integer comprehensivenessRating,
    @JsonProperty("helpfulness_rating") Integer helpfulnessRating,
    @JsonProperty("feedback_text") String feedbackText,
    @JsonProperty("favorited_at") Instant favoritedAt
) {
}
