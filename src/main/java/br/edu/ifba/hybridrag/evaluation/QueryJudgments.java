package br.edu.ifba.hybridrag.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record QueryJudgments(
    @JsonProperty("query_id") long queryId,
    @JsonProperty("judgments") List<RetrievalJudgment> judgments
) {
}
