package br.edu.ifba.hybridrag.query;

import br.edu.ifba.hybridrag.core.QueryCacheEntry;
import br.edu.ifba.hybridrag.storage.QueryCacheStorage;
import br.edu.ifba.hybridrag.storage.QueryCacheStorage.CacheMatch;
import br.edu.ifba.hybridrag.utils.AsyncUtil;
import br.edu.ifba.hybridrag.utils.EmbeddingUtil;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Semantic query memory: reuses the answer of a previous query whose embedding is at
 * least {@code similarityThreshold} cosine-similar to the new one.
 *
 * <p>Colliding admissions are serialized. While a leader is answering, any admission
 * similar to it becomes a follower and waits for the leader's stored entry instead of
 * running its own retrieval. The store lookup runs outside the registry lock, so
 * unrelated admissions never wait on each other's scan. To close the gap between that
 * lookup and the lock, a leader publishes its stored entry under the lock as it leaves
 * the registry, and an admitter re-checks every entry published since its lookup began.
 * A class of similar concurrent queries therefore produces exactly one new entry.</p>
 *
 * <p>Store failures are never fatal: a failed lookup yields a BYPASS handle and a failed
 * write is reported to the leader only.</p>
 */
public class QueryMemoryService {

    private static final Logger logger = LoggerFactory.getLogger(QueryMemoryService.class);

    private final QueryCacheStorage storage;
    private final double similarityThreshold;

    private final ReentrantLock registryLock = new ReentrantLock();
    private final List<Admission> inFlight = new ArrayList<>();
    // guarded by registryLock
    private final List<PublishedEntry> published = new ArrayList<>();
    private final TreeMap<Long, Integer> openLookups = new TreeMap<>();
    private long publishEpoch;

    public QueryMemoryService(@NotNull QueryCacheStorage storage, double similarityThreshold) {
        if (similarityThreshold <= 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("Similarity threshold must be in (0, 1], got " + similarityThreshold);
        }
        this.storage = storage;
        this.similarityThreshold = similarityThreshold;
    }

    /**
     * Finds a stored answer for a similar query. A hit increments the entry's hit count.
     *
     * @return the matching entry with its updated hit count, or empty on a miss
     */
    public CompletableFuture<Optional<QueryCacheEntry>> lookup(@NotNull float[] embedding) {
        return storage.findNearest(embedding).thenCompose(match -> {
            if (match.isEmpty() || match.get().similarity() < similarityThreshold) {
                return CompletableFuture.completedFuture(Optional.<QueryCacheEntry>empty());
            }
            return recordHit(match.get());
        });
    }

    /**
     * Admits a query to the memory. Blocks the calling thread on the store lookup, so call
     * it off the event loop.
     */
    @NotNull
    public CacheHandle admit(@NotNull float[] embedding) {
        long lookupEpoch = openLookup();
        boolean lookupOpen = true;
        try {
            Optional<QueryCacheEntry> stored;
            try {
                stored = lookup(embedding).join();
            } catch (RuntimeException e) {
                Throwable cause = AsyncUtil.unwrap(e);
                logger.warn("Query memory unavailable, answering without it: {}", cause.getMessage());
                return CacheHandle.bypass();
            }

            if (stored.isPresent()) {
                logger.info("Memory hit for entry {}", stored.get().id());
                return CacheHandle.hit(stored.get());
            }

            QueryCacheEntry racedEntry = null;
            registryLock.lock();
            try {
                closeLookup(lookupEpoch);
                lookupOpen = false;

                for (Admission admission : inFlight) {
                    if (isSimilar(admission.embedding, embedding)) {
                        logger.info("Query collides with an in-flight query, waiting for its answer");
                        return CacheHandle.follower(admission.result);
                    }
                }

                for (PublishedEntry entry : published) {
                    if (entry.epoch > lookupEpoch && isSimilar(entry.embedding, embedding)) {
                        racedEntry = entry.entry;
                        break;
                    }
                }

                if (racedEntry == null) {
                    Admission admission = new Admission(embedding.clone());
                    inFlight.add(admission);
                    logger.info("Memory miss, query admitted as leader ({} in flight)", inFlight.size());
                    return CacheHandle.leader(admission);
                }
            } finally {
                registryLock.unlock();
            }

            logger.info("Memory hit for entry {} stored while the lookup ran", racedEntry.id());
            return CacheHandle.hit(reuseRaced(racedEntry));
        } finally {
            if (lookupOpen) {
                registryLock.lock();
                try {
                    closeLookup(lookupEpoch);
                } finally {
                    registryLock.unlock();
                }
            }
        }
    }

    /**
     * Stores an entry without coordination, for answers produced outside an admission.
     */
    public CompletableFuture<QueryCacheEntry> save(@NotNull QueryCacheEntry draft) {
        return storage.insert(draft);
    }

    /**
     * Records a reuse of an entry obtained from a leader.
     *
     * @return the entry with its updated hit count
     */
    public CompletableFuture<QueryCacheEntry> recordReuse(@NotNull QueryCacheEntry entry) {
        return storage.incrementHitCount(entry.id()).thenApply(entry::withHitCount);
    }

    int inFlightCount() {
        registryLock.lock();
        try {
            return inFlight.size();
        } finally {
            registryLock.unlock();
        }
    }

    private CompletableFuture<Optional<QueryCacheEntry>> recordHit(CacheMatch match) {
        QueryCacheEntry entry = match.entry();
        logger.debug("Entry {} matched with similarity {}", entry.id(), match.similarity());
        return storage.incrementHitCount(entry.id())
            .thenApply(count -> Optional.of(entry.withHitCount(count)));
    }

    private boolean isSimilar(float[] a, float[] b) {
        return a.length == b.length && EmbeddingUtil.cosineSimilarity(a, b) >= similarityThreshold;
    }

    private QueryCacheEntry reuseRaced(QueryCacheEntry entry) {
        try {
            return recordReuse(entry).join();
        } catch (RuntimeException e) {
            logger.warn("Could not count reuse of memory entry {}: {}", entry.id(), AsyncUtil.unwrap(e).getMessage());
            return entry;
        }
    }

    private long openLookup() {
        registryLock.lock();
        try {
            openLookups.merge(publishEpoch, 1, Integer::sum);
            return publishEpoch;
        } finally {
            registryLock.unlock();
        }
    }

    // caller holds registryLock
    private void closeLookup(long epoch) {
        openLookups.computeIfPresent(epoch, (key, count) -> count > 1 ? count - 1 : null);
        prunePublished();
    }

    // caller holds registryLock; an entry only matters to lookups that began before it was published
    private void prunePublished() {
        if (openLookups.isEmpty()) {
            published.clear();
            return;
        }
        long oldest = openLookups.firstKey();
        published.removeIf(entry -> entry.epoch <= oldest);
    }

    private void release(Admission admission) {
        registryLock.lock();
        try {
            inFlight.remove(admission);
        } finally {
            registryLock.unlock();
        }
    }

    private void releaseStored(Admission admission, QueryCacheEntry stored) {
        registryLock.lock();
        try {
            publishEpoch++;
            if (!openLookups.isEmpty()) {
                published.add(new PublishedEntry(publishEpoch, admission.embedding, stored));
            }
            inFlight.remove(admission);
        } finally {
            registryLock.unlock();
        }
    }

    private record PublishedEntry(long epoch, float[] embedding, QueryCacheEntry entry) {
    }

    /**
     * A leader's slot in the in-flight registry.
     */
    final class Admission {
        private final float[] embedding;
        private final CompletableFuture<QueryCacheEntry> result = new CompletableFuture<>();
        private final AtomicBoolean resolved = new AtomicBoolean(false);

        private Admission(float[] embedding) {
            this.embedding = embedding;
        }

        CompletableFuture<QueryCacheEntry> complete(QueryCacheEntry draft) {
            if (!resolved.compareAndSet(false, true)) {
                return CompletableFuture.failedFuture(
                    new IllegalStateException("Admission already resolved, answer not stored"));
            }
            return storage.insert(draft).whenComplete((stored, error) -> {
                // store first, then leave the registry
                if (error != null) {
                    release(this);
                    logger.warn("Could not store answer in query memory: {}", error.getMessage());
                    result.completeExceptionally(error);
                } else {
                    releaseStored(this, stored);
                    logger.info("Stored answer as memory entry {}", stored.id());
                    result.complete(stored);
                }
            });
        }

        void fail(Throwable cause) {
            if (resolved.compareAndSet(false, true)) {
                release(this);
                result.completeExceptionally(cause);
            }
        }
    }
}
