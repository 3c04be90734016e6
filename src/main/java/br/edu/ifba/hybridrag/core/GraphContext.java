package br.edu.ifba.hybridrag.core;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Additive context produced by graph expansion.
 *
 * @param entities entities ordered by descending relevance
 * @param communities community summaries ordered by descending relevance
 * @param relatedChunks chunks reached through the entities, ordered by descending score
 */
public record GraphContext(
    @NotNull List<GraphEntity> entities,
    @NotNull List<CommunitySummary> communities,
    @NotNull List<RetrievedChunk> relatedChunks
) {

    private static final GraphContext EMPTY = new GraphContext(List.of(), List.of(), List.of());

    public GraphContext {
        entities = List.copyOf(entities);
        communities = List.copyOf(communities);
        relatedChunks = List.copyOf(relatedChunks);
    }

    public static GraphContext empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return entities.isEmpty() && communities.isEmpty() && relatedChunks.isEmpty();
    }
}
