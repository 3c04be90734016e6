package br.edu.ifba.hybridrag.query;

import br.edu.ifba.hybridrag.core.ContextChunk;
import br.edu.ifba.hybridrag.core.GraphContext;
import br.edu.ifba.hybridrag.core.OrderedContext;
import br.edu.ifba.hybridrag.core.RetrievalMethod;
import br.edu.ifba.hybridrag.core.RetrievedChunk;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fuses vector and graph results into one citation-indexed context.
 *
 * <p>Vector order is primary and graph-related chunks are appended after it. A chunk
 * reached by both signals keeps its earlier position and is tagged {@link RetrievalMethod#FUSED}.
 * Citation indices are assigned 1..n in final order, and {@code references} holds exactly
 * one entry per chunk.</p>
 */
public class ContextAssembler {

    public OrderedContext assemble(@NotNull List<RetrievedChunk> vectorChunks, @NotNull GraphContext graphContext) {
        Map<Long, Slot> slots = new LinkedHashMap<>();

        for (RetrievedChunk chunk : vectorChunks) {
            slots.putIfAbsent(chunk.id(), new Slot(chunk, RetrievalMethod.VECTOR));
        }
        for (RetrievedChunk chunk : graphContext.relatedChunks()) {
            Slot existing = slots.get(chunk.id());
            if (existing == null) {
                slots.put(chunk.id(), new Slot(chunk, RetrievalMethod.GRAPH));
            } else if (existing.method != RetrievalMethod.GRAPH) {
                existing.method = RetrievalMethod.FUSED;
            }
        }

        List<ContextChunk> chunks = new ArrayList<>(slots.size());
        List<String> references = new ArrayList<>(slots.size());
        int index = 1;
        for (Slot slot : slots.values()) {
            chunks.add(new ContextChunk(index++, slot.chunk, slot.method));
            references.add(slot.chunk.displayReference());
        }

        return new OrderedContext(chunks, references, graphContext.entities(), graphContext.communities());
    }

    private static final class Slot {
        private final RetrievedChunk chunk;
        private RetrievalMethod method;

        private Slot(RetrievedChunk chunk, RetrievalMethod method) {
            this.chunk = chunk;
            this.method = method;
        }
    }
}
