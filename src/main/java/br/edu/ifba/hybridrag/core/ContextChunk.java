package br.edu.ifba.hybridrag.core;

import org.jetbrains.annotations.NotNull;

/**
 * A chunk placed in the assembled context under its citation index.
 *
 * @param citationIndex 1-based index; the only number an answer may cite for this chunk
 * @param chunk the chunk
 * @param method the signal(s) that contributed the chunk
 */
public record ContextChunk(
    int citationIndex,
    @NotNull RetrievedChunk chunk,
    @NotNull RetrievalMethod method
) {
}
