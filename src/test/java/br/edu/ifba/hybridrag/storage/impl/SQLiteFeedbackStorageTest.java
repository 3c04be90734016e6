package br.edu.ifba.hybridrag.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import br.edu.ifba.hybridrag.core.ContextSnapshot;
import br.edu.ifba.hybridrag.core.QueryCacheEntry;
import br.edu.ifba.hybridrag.feedback.FavoriteEntry;
import br.edu.ifba.hybridrag.feedback.FeedbackMetrics;
import br.edu.ifba.hybridrag.feedback.FeedbackRecord;

/**
 * Tests the version-checked writes of SQLiteFeedbackStorage.
 */
class SQLiteFeedbackStorageTest {

    @TempDir
    Path tempDir;

    private SQLiteTestDatabase database;
    private SQLiteFeedbackStorage storage;
    private long memoryId;

    @BeforeEach
    void setUp() throws Exception {
        database = SQLiteTestDatabase.create(tempDir);
        storage = database.feedbackStorage();
        memoryId = database.queryCacheStorage().insert(new QueryCacheEntry(0, "what is rag?", new float[] {1, 0},
            "RAG is retrieval augmented generation [chunk1].", List.of(),
            new ContextSnapshot(List.of(), List.of(), List.of(), List.of("Lewis et al. (2020)")),
            false, 0, Instant.now())).join().id();
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void testInsertOnlyOnce() {
        assertTrue(storage.insert(record(4, "useful", false, 0)).join());
        assertFalse(storage.insert(record(2, null, false, 0)).join());

        FeedbackRecord stored = storage.find(memoryId).join().orElseThrow();
        assertEquals(4, stored.rating());
        assertEquals("useful", stored.feedbackText());
        assertEquals(0L, stored.version());
    }

    @Test
    void testUpdateRequiresCurrentVersion() {
        storage.insert(record(4, null, false, 0)).join();

        assertTrue(storage.update(record(5, null, false, 0)).join());
        // version is now 1, a writer still holding version 0 loses
        assertFalse(storage.update(record(1, null, false, 0)).join());

        FeedbackRecord stored = storage.find(memoryId).join().orElseThrow();
        assertEquals(5, stored.rating());
        assertEquals(1L, stored.version());
    }

    @Test
    void testConditionalDelete() {
        storage.insert(record(3, null, false, 0)).join();

        assertFalse(storage.delete(memoryId, 7).join());
        assertTrue(storage.delete(memoryId, 0).join());
        assertTrue(storage.find(memoryId).join().isEmpty());
        assertFalse(storage.delete(memoryId).join());
    }

    @Test
    void testFavoritesCarryAnswerAndReferences() {
        storage.insert(record(5, "keep this", true, 0)).join();

        List<FavoriteEntry> favorites = storage.findFavorites().join();

        assertEquals(1, favorites.size());
        FavoriteEntry favorite = favorites.get(0);
        assertEquals(memoryId, favorite.memoryId());
        assertEquals("what is rag?", favorite.queryText());
        assertEquals(List.of("Lewis et al. (2020)"), favorite.references());
        assertEquals("keep this", favorite.feedbackText());
    }

    @Test
    void testMetrics() {
        storage.insert(record(4, "good", true, 0)).join();

        FeedbackMetrics metrics = storage.metrics().join();

        assertEquals(1, metrics.overall().totalFeedback());
        assertEquals(4.0, metrics.overall().averageRating());
        assertNull(metrics.overall().averageAccuracyRating());
        assertEquals(1, metrics.overall().favoritesCount());
        assertEquals(1, metrics.overall().textFeedbackCount());
        assertEquals(List.of(new FeedbackMetrics.RatingCount(4, 1)), metrics.ratingDistribution());
    }

    private FeedbackRecord record(Integer rating, String text, boolean favorite, long version) {
        return new FeedbackRecord(memoryId, rating, null, null, null, text, favorite, version, null, null);
    }
}
