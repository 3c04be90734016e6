package br.edu.ifba.hybridrag.storage;

import br.edu.ifba.hybridrag.core.RetrievedChunk;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Read access to the chunk embedding index populated by ingestion.
 */
public interface VectorStorage {

    /**
     * Finds the chunks most similar to a query vector.
     *
     * @param queryVector the query embedding
     * @param topK maximum number of results
     * @return at most {@code topK} chunks, descending similarity, ties broken by lower chunk id
     */
    CompletableFuture<List<RetrievedChunk>> query(@NotNull float[] queryVector, int topK);

    /**
     * Loads chunks by id. Returned chunks carry similarity 0; unknown ids are skipped.
     */
    CompletableFuture<List<RetrievedChunk>> getChunks(@NotNull Collection<Long> chunkIds);

    CompletableFuture<Optional<RetrievedChunk>> getChunk(long chunkId);

    /**
     * @return number of chunks and number of distinct source documents
     */
    CompletableFuture<CorpusStats> getCorpusStats();

    record CorpusStats(long totalChunks, long uniqueDocuments) {
    }
}
