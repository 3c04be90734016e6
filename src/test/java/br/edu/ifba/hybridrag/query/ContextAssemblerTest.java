package br.edu.ifba.hybridrag.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import br.edu.ifba.hybridrag.core.CommunitySummary;
import br.edu.ifba.hybridrag.core.ContextChunk;
import br.edu.ifba.hybridrag.core.GraphContext;
import br.edu.ifba.hybridrag.core.GraphEntity;
import br.edu.ifba.hybridrag.core.OrderedContext;
import br.edu.ifba.hybridrag.core.RetrievalMethod;
import br.edu.ifba.hybridrag.core.RetrievedChunk;

class ContextAssemblerTest {

    private final ContextAssembler assembler = new ContextAssembler();

    @Test
    void testVectorFirstThenGraphWithFusedOverlap() {
        List<RetrievedChunk> vector = List.of(chunk(5, "Smith (2020)", "a.pdf"), chunk(2, null, "b.pdf"));
        GraphContext graph = new GraphContext(
            List.of(new GraphEntity("RAG", "CONCEPT", 0.8)),
            List.of(new CommunitySummary(1, "Retrieval methods", 0.8)),
            List.of(chunk(2, null, "b.pdf"), chunk(9, null, null)));

        OrderedContext context = assembler.assemble(vector, graph);

        assertEquals(List.of(5L, 2L, 9L), context.chunks().stream().map(c -> c.chunk().id()).toList());
        assertEquals(List.of(1, 2, 3), context.chunks().stream().map(ContextChunk::citationIndex).toList());
        assertEquals(List.of(RetrievalMethod.VECTOR, RetrievalMethod.FUSED, RetrievalMethod.GRAPH),
            context.chunks().stream().map(ContextChunk::method).toList());
        assertEquals(Arrays.asList("Smith (2020)", "b.pdf", null), context.references());
        assertEquals(1, context.entities().size());
        assertEquals(1, context.communities().size());
    }

    @Test
    void testDuplicateVectorChunksCollapse() {
        OrderedContext context = assembler.assemble(
            List.of(chunk(1, null, "a.pdf"), chunk(1, null, "a.pdf")), GraphContext.empty());

        assertEquals(1, context.size());
        assertEquals(1, context.references().size());
    }

    @Test
    void testEmptyInputsGiveEmptyContext() {
        OrderedContext context = assembler.assemble(List.of(), GraphContext.empty());

        assertTrue(context.isEmpty());
        assertTrue(context.references().isEmpty());
    }

    @Test
    void testBlankReferenceFallsBackToSource() {
        OrderedContext context = assembler.assemble(List.of(chunk(1, "  ", null)), GraphContext.empty());

        assertNull(context.references().get(0));
    }

    private static RetrievedChunk chunk(long id, String reference, String source) {
        return new RetrievedChunk(id, "text " + id, source, 1, (int) id, reference, 0.5);
    }
}
