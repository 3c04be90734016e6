package br.edu.ifba.hybridrag.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The retrieval context of an answer as stored with its memory entry, so that a memory
 * hit can be returned in the same shape as a fresh answer.
 */
public record ContextSnapshot(
    @JsonProperty("chunks") @NotNull List<RetrievedChunk> chunks,
    @JsonProperty("entities") @NotNull List<GraphEntity> entities,
    @JsonProperty("communities") @NotNull List<CommunitySummary> communities,
    @JsonProperty("references") @NotNull List<String> references
) {

    public ContextSnapshot {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
        entities = entities == null ? List.of() : List.copyOf(entities);
        communities = communities == null ? List.of() : List.copyOf(communities);
        references = references == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(references));
    }

    public static ContextSnapshot of(@NotNull OrderedContext context) {
        return new ContextSnapshot(
            context.retrievedChunks(),
            context.entities(),
            context.communities(),
            context.references()
        );
    }

    public static ContextSnapshot empty() {
        return new ContextSnapshot(List.of(), List.of(), List.of(), List.of());
    }
}
