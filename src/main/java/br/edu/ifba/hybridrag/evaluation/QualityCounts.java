package br.edu.ifba.hybridrag.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Good versus total chunk-quality judgments.
 */
public record QualityCounts(
    @JsonProperty("good") long good,
    @JsonProperty("total") long total
) {

    /**
     * Share of good judgments as a percentage rounded to one decimal, 0 when nothing was judged.
     */
    @JsonProperty("percentage")
    public double percentage() {
        if (total == 0) {
            return 0.0;
        }
        return Math.round(good * 1000.0 / total) / 10.0;
    }
}
