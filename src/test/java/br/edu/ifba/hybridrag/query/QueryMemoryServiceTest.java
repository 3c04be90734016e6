package br.edu.ifba.hybridrag.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import br.edu.ifba.hybridrag.core.ContextSnapshot;
import br.edu.ifba.hybridrag.core.QueryCacheEntry;
import br.edu.ifba.hybridrag.storage.QueryCacheStorage;
import br.edu.ifba.hybridrag.storage.impl.SQLiteQueryCacheStorage;
import br.edu.ifba.hybridrag.storage.impl.SQLiteTestDatabase;

class QueryMemoryServiceTest {

    private static final float[] RAG = {1f, 0f, 0f};
    private static final float[] RAG_PARAPHRASE = {0.99f, 0.05f, 0f};
    private static final float[] UNRELATED = {0f, 1f, 0f};

    @TempDir
    Path tempDir;

    private SQLiteTestDatabase database;
    private SQLiteQueryCacheStorage storage;
    private QueryMemoryService memory;

    @BeforeEach
    void setUp() throws Exception {
        database = SQLiteTestDatabase.create(tempDir);
        storage = database.queryCacheStorage();
        memory = new QueryMemoryService(storage, 0.95);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void testMissThenHit() {
        CacheHandle first = memory.admit(RAG);
        assertEquals(CacheHandle.Kind.LEADER, first.kind());
        QueryCacheEntry stored = first.complete(draft("what is rag?", RAG)).join();

        CacheHandle second = memory.admit(RAG_PARAPHRASE);

        assertEquals(CacheHandle.Kind.HIT, second.kind());
        assertEquals(stored.id(), second.entry().id());
        assertEquals(1L, second.entry().hitCount());
        assertEquals(0, memory.inFlightCount());
    }

    @Test
    void testDissimilarQueriesDoNotCollide() {
        CacheHandle first = memory.admit(RAG);
        CacheHandle second = memory.admit(UNRELATED);

        assertEquals(CacheHandle.Kind.LEADER, first.kind());
        assertEquals(CacheHandle.Kind.LEADER, second.kind());
        assertEquals(2, memory.inFlightCount());
    }

    @Test
    void testInvalidThresholdRejected() {
        assertThrows(IllegalArgumentException.class, () -> new QueryMemoryService(storage, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new QueryMemoryService(storage, 1.5));
    }

    @Test
    @DisplayName("concurrent colliding queries create exactly one memory entry")
    void testConcurrentCollidingAdmissions() throws Exception {
        int callers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<CacheHandle>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                float[] embedding = i % 2 == 0 ? RAG : RAG_PARAPHRASE;
                Callable<CacheHandle> admit = () -> {
                    start.await();
                    return memory.admit(embedding);
                };
                futures.add(executor.submit(admit));
            }
            start.countDown();

            List<CacheHandle> handles = new ArrayList<>();
            for (Future<CacheHandle> future : futures) {
                handles.add(future.get(10, TimeUnit.SECONDS));
            }

            List<CacheHandle> leaders = handles.stream().filter(h -> h.kind() == CacheHandle.Kind.LEADER).toList();
            assertEquals(1, leaders.size());
            assertEquals(callers - 1, handles.stream().filter(h -> h.kind() == CacheHandle.Kind.FOLLOWER).count());

            QueryCacheEntry stored = leaders.get(0).complete(draft("what is rag?", RAG)).join();

            for (CacheHandle handle : handles) {
                if (handle.kind() == CacheHandle.Kind.FOLLOWER) {
                    assertEquals(stored.id(), handle.leaderResult().get(5, TimeUnit.SECONDS).id());
                }
            }
            assertEquals(1L, storage.count().join());
            assertEquals(0, memory.inFlightCount());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testFailedLeaderReleasesFollowers() {
        CacheHandle leader = memory.admit(RAG);
        CacheHandle follower = memory.admit(RAG_PARAPHRASE);
        assertEquals(CacheHandle.Kind.FOLLOWER, follower.kind());

        leader.fail(new IllegalStateException("synthesis failed"));

        assertThrows(CompletionException.class, () -> follower.leaderResult().join());
        assertEquals(0, memory.inFlightCount());
        assertEquals(CacheHandle.Kind.LEADER, memory.admit(RAG).kind());
    }

    @Test
    void testLeaderResolvesOnlyOnce() {
        CacheHandle leader = memory.admit(RAG);
        leader.complete(draft("what is rag?", RAG)).join();

        assertThrows(CompletionException.class, () -> leader.complete(draft("again", RAG)).join());
        assertEquals(1L, storage.count().join());
    }

    @Test
    void testCancellingFollowerViewKeepsLeaderAlive() {
        CacheHandle leader = memory.admit(RAG);
        CacheHandle follower = memory.admit(RAG);

        follower.leaderResult().cancel(true);
        QueryCacheEntry stored = leader.complete(draft("what is rag?", RAG)).join();

        assertEquals(stored.id(), follower.leaderResult().join().id());
    }

    @Test
    void testUnavailableStoreBypassesMemory() {
        QueryCacheStorage broken = mock(QueryCacheStorage.class);
        when(broken.findNearest(any(float[].class)))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk I/O error")));
        QueryMemoryService degraded = new QueryMemoryService(broken, 0.95);

        CacheHandle handle = degraded.admit(RAG);

        assertEquals(CacheHandle.Kind.BYPASS, handle.kind());
        assertEquals(0, degraded.inFlightCount());
    }

    @Test
    void testFailedStoreWriteReportedToLeaderOnly() {
        QueryCacheStorage flaky = mock(QueryCacheStorage.class);
        when(flaky.findNearest(any(float[].class)))
            .thenReturn(CompletableFuture.completedFuture(Optional.empty()));
        when(flaky.insert(any(QueryCacheEntry.class)))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));
        QueryMemoryService service = new QueryMemoryService(flaky, 0.95);

        CacheHandle leader = service.admit(RAG);
        CacheHandle follower = service.admit(RAG);

        assertThrows(CompletionException.class, () -> leader.complete(draft("q", RAG)).join());
        assertThrows(CompletionException.class, () -> follower.leaderResult().join());
        assertEquals(0, service.inFlightCount());
    }

    @Test
    @DisplayName("a slow store lookup does not hold up an unrelated admission")
    void testUnrelatedAdmissionsDoNotWaitOnEachOther() throws Exception {
        QueryCacheStorage slow = mock(QueryCacheStorage.class);
        CompletableFuture<Optional<QueryCacheStorage.CacheMatch>> slowScan = new CompletableFuture<>();
        CountDownLatch scanStarted = new CountDownLatch(1);
        when(slow.findNearest(any(float[].class))).thenAnswer(invocation -> {
            float[] embedding = invocation.getArgument(0);
            if (embedding[1] > 0.5f) {
                scanStarted.countDown();
                return slowScan;
            }
            return CompletableFuture.completedFuture(Optional.empty());
        });
        QueryMemoryService service = new QueryMemoryService(slow, 0.95);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<CacheHandle> unrelated = executor.submit(() -> service.admit(UNRELATED));
            assertTrue(scanStarted.await(5, TimeUnit.SECONDS));

            CacheHandle rag = executor.submit(() -> service.admit(RAG)).get(5, TimeUnit.SECONDS);
            assertEquals(CacheHandle.Kind.LEADER, rag.kind());
            assertFalse(unrelated.isDone());

            slowScan.complete(Optional.empty());
            assertEquals(CacheHandle.Kind.LEADER, unrelated.get(5, TimeUnit.SECONDS).kind());
            assertEquals(2, service.inFlightCount());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("an entry stored while a similar lookup was running is reused, not duplicated")
    void testEntryStoredDuringLookupIsReused() throws Exception {
        QueryCacheStorage store = mock(QueryCacheStorage.class);
        CompletableFuture<Optional<QueryCacheStorage.CacheMatch>> staleScan = new CompletableFuture<>();
        CountDownLatch secondScanStarted = new CountDownLatch(1);
        AtomicInteger scans = new AtomicInteger();
        when(store.findNearest(any(float[].class))).thenAnswer(invocation -> {
            if (scans.incrementAndGet() == 1) {
                return CompletableFuture.completedFuture(Optional.empty());
            }
            secondScanStarted.countDown();
            return staleScan;
        });
        QueryCacheEntry stored = new QueryCacheEntry(7L, "what is rag?", RAG, "RAG retrieves then generates [chunk1].",
            List.of(), ContextSnapshot.empty(), false, 0L, Instant.now());
        when(store.insert(any(QueryCacheEntry.class))).thenReturn(CompletableFuture.completedFuture(stored));
        when(store.incrementHitCount(anyLong())).thenReturn(CompletableFuture.completedFuture(1L));
        QueryMemoryService service = new QueryMemoryService(store, 0.95);

        CacheHandle leader = service.admit(RAG);
        assertEquals(CacheHandle.Kind.LEADER, leader.kind());

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<CacheHandle> late = executor.submit(() -> service.admit(RAG_PARAPHRASE));
            assertTrue(secondScanStarted.await(5, TimeUnit.SECONDS));

            leader.complete(draft("what is rag?", RAG)).join();
            staleScan.complete(Optional.empty());

            CacheHandle handle = late.get(5, TimeUnit.SECONDS);
            assertEquals(CacheHandle.Kind.HIT, handle.kind());
            assertEquals(7L, handle.entry().id());
            assertEquals(1L, handle.entry().hitCount());
            assertEquals(0, service.inFlightCount());
        } finally {
            executor.shutdownNow();
        }

        assertEquals(CacheHandle.Kind.LEADER, service.admit(UNRELATED).kind());
    }

    private static QueryCacheEntry draft(String query, float[] embedding) {
        return new QueryCacheEntry(0L, query, embedding, "RAG retrieves then generates [chunk1].", List.of(),
            ContextSnapshot.empty(), false, 0L, Instant.now());
    }
}
