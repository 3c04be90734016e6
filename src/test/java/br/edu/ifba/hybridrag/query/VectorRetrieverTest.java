package br.edu.ifba.hybridrag.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import br.edu.ifba.hybridrag.core.RetrievedChunk;
import br.edu.ifba.hybridrag.exception.UpstreamUnavailableException;
import br.edu.ifba.hybridrag.storage.VectorStorage;

class VectorRetrieverTest {

    private static final float[] QUERY = {1f, 0f, 0f};

    private VectorStorage vectorStorage;
    private VectorRetriever retriever;

    @BeforeEach
    void setUp() {
        vectorStorage = mock(VectorStorage.class);
        retriever = new VectorRetriever(vectorStorage);
    }

    @Test
    void testFewerChunksThanRequested() {
        when(vectorStorage.query(any(float[].class), anyInt())).thenReturn(CompletableFuture.completedFuture(List.of(
            chunk(1, 0.9), chunk(2, 0.7), chunk(3, 0.4))));

        List<RetrievedChunk> results = retriever.search(QUERY, 5).join();

        assertEquals(List.of(1L, 2L, 3L), results.stream().map(RetrievedChunk::id).toList());
    }

    @Test
    void testDuplicatesRemovedAndOrderDeterministic() {
        when(vectorStorage.query(any(float[].class), anyInt())).thenReturn(CompletableFuture.completedFuture(List.of(
            chunk(7, 0.5), chunk(3, 0.8), chunk(3, 0.8), chunk(4, 0.5), chunk(9, 0.1))));

        List<RetrievedChunk> results = retriever.search(QUERY, 3).join();

        assertEquals(List.of(3L, 4L, 7L), results.stream().map(RetrievedChunk::id).toList());
    }

    @Test
    void testNonPositiveKReturnsEmptyWithoutSearching() {
        assertTrue(retriever.search(QUERY, 0).join().isEmpty());
        assertTrue(retriever.search(QUERY, -2).join().isEmpty());
        verify(vectorStorage, never()).query(any(float[].class), anyInt());
    }

    @Test
    void testStorageFailureSurfacesAsUpstreamUnavailable() {
        when(vectorStorage.query(any(float[].class), anyInt()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("database locked")));

        CompletionException thrown = assertThrows(CompletionException.class, () -> retriever.search(QUERY, 3).join());

        UpstreamUnavailableException cause = assertInstanceOf(UpstreamUnavailableException.class, thrown.getCause());
        assertEquals("vector-store", cause.getUpstream());
    }

    static RetrievedChunk chunk(long id, double similarity) {
        return new RetrievedChunk(id, "chunk " + id, "doc.pdf", 1, (int) id, null, similarity);
    }
}
