package br.edu.ifba.hybridrag.query;

import br.edu.ifba.hybridrag.core.Answer;
import br.edu.ifba.hybridrag.core.ContextSnapshot;
import org.jetbrains.annotations.NotNull;

/**
 * Outcome of one query.
 *
 * @param query the query as asked
 * @param answer the answer, fresh or remembered
 * @param memoryId id of the memory entry holding the answer, -1 when it could not be stored
 * @param context retrieval context the answer was produced from
 */
public record QueryResult(
    @NotNull String query,
    @NotNull Answer answer,
    long memoryId,
    @NotNull ContextSnapshot context
) {

    public static final long NOT_STORED = -1L;

    public boolean isStored() {
        return memoryId != NOT_STORED;
    }
}
