package br.edu.ifba.hybridrag.evaluation;

import br.edu.ifba.hybridrag.core.RetrievalMethod;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Binary relevance judgment of one retrieved chunk at one rank.
 *
 * @param chunkId judged chunk
 * @param relevance 0 or 1
 * @param llmScore raw score of an LLM judge, null for heuristic judgments
 * @param explanation free-text reason
 * @param method retrieval signal the chunk came from
 * @param rank 1-based rank position in the retrieved list
 * @param textContent chunk text, only populated when reading judgments back
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RetrievalJudgment(
    @JsonProperty("chunk_id") long chunkId,
    @JsonProperty("relevance_score") int relevance,
    @JsonProperty("llm_score") @Nullable Double llmScore,
    @JsonProperty("explanation") @Nullable String explanation,
    @JsonIgnore @NotNull RetrievalMethod method,
    @JsonProperty("rank_position") int rank,
    @JsonProperty("text_content") @Nullable String textContent
) {

    public RetrievalJudgment {
        if (relevance != 0 && relevance != 1) {
            throw new IllegalArgumentException("Relevance must be 0 or 1, got " + relevance);
        }
        if (rank < 1) {
            throw new IllegalArgumentException("Rank position must be >= 1, got " + rank);
        }
    }

    public RetrievalJudgment(long chunkId, int relevance, @Nullable Double llmScore, @Nullable String explanation,
                             @NotNull RetrievalMethod method, int rank) {
        this(chunkId, relevance, llmScore, explanation, method, rank, null);
    }

    @JsonProperty("retrieval_method")
    public String methodTag() {
        return method.tag();
    }

    @JsonIgnore
    public boolean isRelevant() {
        return relevance == 1;
    }
}
