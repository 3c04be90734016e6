package br.edu.ifba.hybridrag.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate retrieval precision, averaged across judged queries.
 */
public record RetrievalEvalSummary(
    @JsonProperty("overall_precision") double overallPrecision,
    @JsonProperty("precision@5") double precisionAt5,
    @JsonProperty("precision@10") double precisionAt10,
    @JsonProperty("total_judgments") long totalJudgments
) {
}
