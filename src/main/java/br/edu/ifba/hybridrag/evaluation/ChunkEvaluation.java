package br.edu.ifba.hybridrag.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Corpus-level quality judgment of a single chunk against one criterion.
 */
public record ChunkEvaluation(
    @JsonProperty("id") long id,
    @JsonProperty("chunk_id") long chunkId,
    @JsonProperty("evaluation_criteria") String criteria,
    @JsonProperty("score") int score,
    @JsonProperty("explanation") String explanation,
    @JsonProperty("model_used") String modelUsed,
    @JsonProperty("created_at") Instant createdAt
) {

    public ChunkEvaluation withId(long newId) {
        return new ChunkEvaluation(newId, chunkId, criteria, score, explanation, modelUsed, createdAt);
    }
}
