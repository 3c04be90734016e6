package br.edu.ifba.hybridrag.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Knowledge-graph entity linked to the retrieved chunks, scored against the query.
 */
public record GraphEntity(
    @JsonProperty("entity") @NotNull String name,
    @JsonProperty("entity_type") @Nullable String entityType,
    @JsonProperty("relevance") double relevance
) {
}
