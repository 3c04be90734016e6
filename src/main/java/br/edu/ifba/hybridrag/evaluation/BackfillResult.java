package br.edu.ifba.hybridrag.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a backfill: queries re-evaluated and judgment rows appended.
 */
public record BackfillResult(
    @JsonProperty("queries") int queries,
    @JsonProperty("judgments") int judgments
) {
}
