package br.edu.ifba.hybridrag.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import br.edu.ifba.hybridrag.core.RetrievedChunk;
import br.edu.ifba.hybridrag.storage.VectorStorage.CorpusStats;

class SQLiteVectorStorageTest {

    @TempDir
    Path tempDir;

    private SQLiteTestDatabase database;
    private SQLiteVectorStorage vectorStorage;

    @BeforeEach
    void setUp() throws Exception {
        database = SQLiteTestDatabase.create(tempDir);
        vectorStorage = database.vectorStorage();

        database.document(1, "paper.pdf", "Smith, J. (2020). Paper. Journal.");
        database.chunk(10, 1, "Chunk about graphs.", 1.0f, 0.0f, 0.0f);
        database.chunk(11, 1, "Chunk about vectors.", 0.0f, 1.0f, 0.0f);
        database.chunk(12, 1, "Chunk about both.", 0.7f, 0.7f, 0.0f);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    @DisplayName("k larger than the corpus returns every chunk")
    void testTopKLargerThanCorpus() {
        List<RetrievedChunk> results = vectorStorage.query(new float[] {1.0f, 0.0f, 0.0f}, 5).join();

        assertEquals(3, results.size());
        assertEquals(List.of(10L, 12L, 11L), results.stream().map(RetrievedChunk::id).toList());
        assertEquals(1.0, results.get(0).similarity(), 1e-6);
    }

    @Test
    void testTopKLimitsResults() {
        List<RetrievedChunk> results = vectorStorage.query(new float[] {0.0f, 1.0f, 0.0f}, 1).join();

        assertEquals(1, results.size());
        assertEquals(11L, results.get(0).id());
    }

    @Test
    @DisplayName("ties are broken by the lower chunk id")
    void testTiesPreferLowerId() throws Exception {
        database.chunk(5, 1, "Duplicate of chunk 10.", 1.0f, 0.0f, 0.0f);

        List<RetrievedChunk> results = vectorStorage.query(new float[] {1.0f, 0.0f, 0.0f}, 2).join();

        assertEquals(List.of(5L, 10L), results.stream().map(RetrievedChunk::id).toList());
    }

    @Test
    void testEmbeddingsOfAnotherDimensionAreSkipped() throws Exception {
        database.chunk(20, 1, "Legacy embedding.", 1.0f, 0.0f);

        List<RetrievedChunk> results = vectorStorage.query(new float[] {1.0f, 0.0f, 0.0f}, 10).join();

        assertEquals(3, results.size());
        assertTrue(results.stream().noneMatch(chunk -> chunk.id() == 20L));
    }

    @Test
    void testChunksCarryDocumentReference() {
        RetrievedChunk chunk = vectorStorage.getChunk(10).join().orElseThrow();

        assertEquals("Chunk about graphs.", chunk.text());
        assertEquals("Smith, J. (2020). Paper. Journal.", chunk.displayReference());
        assertEquals(0.0, chunk.similarity());
    }

    @Test
    void testGetChunksSkipsUnknownIds() {
        List<RetrievedChunk> chunks = vectorStorage.getChunks(List.of(11L, 999L, 10L)).join();

        assertEquals(List.of(10L, 11L), chunks.stream().map(RetrievedChunk::id).toList());
        assertTrue(vectorStorage.getChunk(999).join().isEmpty());
    }

    @Test
    void testCorpusStats() throws Exception {
        database.document(2, "other.pdf", null);
        database.chunk(30, 2, "Second document.", 0.0f, 0.0f, 1.0f);

        CorpusStats stats = vectorStorage.getCorpusStats().join();

        assertEquals(4, stats.totalChunks());
        assertEquals(2, stats.uniqueDocuments());
    }
}
