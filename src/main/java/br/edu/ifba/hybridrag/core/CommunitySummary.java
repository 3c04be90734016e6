package br.edu.ifba.hybridrag.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

/**
 * Summary of an entity community, scored by its best member entity.
 */
public record CommunitySummary(
    @JsonProperty("community_id") long communityId,
    @JsonProperty("summary") @NotNull String summary,
    @JsonProperty("relevance") double relevance
) {
}
