package br.edu.ifba.hybridrag.storage;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Read access to the entity/community graph built by the graph-construction service.
 */
public interface GraphStorage {

    /**
     * Entity links touching any of the given chunks.
     */
    CompletableFuture<List<EntityLink>> getEntityLinksForChunks(@NotNull Collection<Long> chunkIds);

    /**
     * Every chunk link of the given entities.
     */
    CompletableFuture<List<EntityLink>> getChunkLinksForEntities(@NotNull Collection<Long> entityIds);

    /**
     * Community memberships of the given entities.
     */
    CompletableFuture<List<CommunityMembership>> getCommunitiesForEntities(@NotNull Collection<Long> entityIds);

    /**
     * A weighted link between an entity and a chunk that mentions it.
     */
    record EntityLink(long entityId, @NotNull String entityName, @Nullable String entityType, long chunkId, double weight) {
    }

    /**
     * One member entity of a community.
     */
    record CommunityMembership(long communityId, @NotNull String summary, long entityId) {
    }
}
