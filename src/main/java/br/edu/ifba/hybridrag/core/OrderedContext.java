package br.edu.ifba.hybridrag.core;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The deduplicated, citation-indexed context sent to the synthesizer.
 *
 * <p>{@code references} is parallel to {@code chunks}: element {@code i} is the
 * reference of the chunk cited as {@code [chunk(i+1)]}, or null when the chunk has no
 * resolvable reference. Entities and communities are auxiliary blocks and carry no
 * citation index.</p>
 */
public record OrderedContext(
    @NotNull List<ContextChunk> chunks,
    @NotNull List<String> references,
    @NotNull List<GraphEntity> entities,
    @NotNull List<CommunitySummary> communities
) {

    public OrderedContext {
        if (chunks.size() != references.size()) {
            throw new IllegalArgumentException(
                "references must be parallel to chunks: " + chunks.size() + " vs " + references.size());
        }
        for (int i = 0; i < chunks.size(); i++) {
            if (chunks.get(i).citationIndex() != i + 1) {
                throw new IllegalArgumentException("Citation indices must be 1-based and contiguous");
            }
        }
        chunks = List.copyOf(chunks);
        // List.copyOf rejects null elements, references may legitimately be null
        references = Collections.unmodifiableList(new ArrayList<>(references));
        entities = List.copyOf(entities);
        communities = List.copyOf(communities);
    }

    public static OrderedContext empty() {
        return new OrderedContext(List.of(), List.of(), List.of(), List.of());
    }

    public int size() {
        return chunks.size();
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public boolean isValidCitation(int index) {
        return index >= 1 && index <= chunks.size();
    }

    public List<RetrievedChunk> retrievedChunks() {
        return chunks.stream().map(ContextChunk::chunk).toList();
    }
}
