package br.edu.ifba.hybridrag.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A document chunk returned by retrieval, with its similarity to the current query.
 *
 * @param id chunk id
 * @param text chunk text
 * @param source source file name of the owning document (nullable)
 * @param documentId owning document id
 * @param position position of the chunk inside its document
 * @param reference resolved academic reference of the owning document (nullable)
 * @param similarity cosine similarity to the query; transient, computed per query
 */
public record RetrievedChunk(
    long id,
    @NotNull String text,
    @Nullable String source,
    long documentId,
    int position,
    @Nullable String reference,
    double similarity
) {

    public RetrievedChunk withSimilarity(double newSimilarity) {
        return new RetrievedChunk(id, text, source, documentId, position, reference, newSimilarity);
    }

    /**
     * The string shown in the reference list for this chunk: the document's academic
     * reference when one was fetched, otherwise the source file name, otherwise null.
     */
    @Nullable
    public String displayReference() {
        if (reference != null && !reference.isBlank()) {
            return reference;
        }
        if (source != null && !source.isBlank()) {
            return source;
        }
        return null;
    }
}
