package br.edu.ifba.hybridrag.query;

import br.edu.ifba.hybridrag.core.CommunitySummary;
import br.edu.ifba.hybridrag.core.GraphContext;
import br.edu.ifba.hybridrag.core.GraphEntity;
import br.edu.ifba.hybridrag.core.RetrievedChunk;
import br.edu.ifba.hybridrag.storage.GraphStorage;
import br.edu.ifba.hybridrag.storage.GraphStorage.CommunityMembership;
import br.edu.ifba.hybridrag.storage.GraphStorage.EntityLink;
import br.edu.ifba.hybridrag.storage.VectorStorage;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Expands vector results through the entity/community graph.
 *
 * <p>Scoring is query-relative through the chunk similarities:</p>
 * <ul>
 *   <li>entity relevance = max over its linked retrieved chunks of (similarity x link weight)</li>
 *   <li>community relevance = max relevance of its member entities among the selected ones</li>
 *   <li>related chunk score = max over selected entities linking it of (entity relevance x link weight)</li>
 * </ul>
 *
 * <p>Graph enhancement is additive: an empty or unreachable graph yields an empty
 * {@link GraphContext}, never a failure.</p>
 */
public class GraphRetriever {

    private static final Logger logger = LoggerFactory.getLogger(GraphRetriever.class);

    private final GraphStorage graphStorage;
    private final VectorStorage vectorStorage;
    private final boolean enabled;
    private final int maxEntities;
    private final int maxCommunities;
    private final int maxRelatedChunks;

    public GraphRetriever(
            @NotNull GraphStorage graphStorage,
            @NotNull VectorStorage vectorStorage,
            boolean enabled,
            int maxEntities,
            int maxCommunities,
            int maxRelatedChunks) {
        this.graphStorage = graphStorage;
        this.vectorStorage = vectorStorage;
        this.enabled = enabled;
        this.maxEntities = maxEntities;
        this.maxCommunities = maxCommunities;
        this.maxRelatedChunks = maxRelatedChunks;
    }

    public CompletableFuture<GraphContext> expand(@NotNull List<RetrievedChunk> chunks) {
        if (!enabled || chunks.isEmpty() || maxEntities <= 0) {
            return CompletableFuture.completedFuture(GraphContext.empty());
        }

        Map<Long, Double> similarityByChunk = new HashMap<>();
        for (RetrievedChunk chunk : chunks) {
            similarityByChunk.merge(chunk.id(), chunk.similarity(), Math::max);
        }

        return graphStorage.getEntityLinksForChunks(similarityByChunk.keySet())
            .thenCompose(links -> {
                List<ScoredEntity> entities = scoreEntities(links, similarityByChunk);
                if (entities.isEmpty()) {
                    return CompletableFuture.completedFuture(GraphContext.empty());
                }
                Map<Long, ScoredEntity> byId = entities.stream()
                    .collect(Collectors.toMap(ScoredEntity::id, e -> e, (a, b) -> a, LinkedHashMap::new));

                CompletableFuture<List<CommunitySummary>> communities = maxCommunities <= 0
                    ? CompletableFuture.completedFuture(List.of())
                    : graphStorage.getCommunitiesForEntities(byId.keySet())
                        .thenApply(memberships -> scoreCommunities(memberships, byId));

                CompletableFuture<List<RetrievedChunk>> related = maxRelatedChunks <= 0
                    ? CompletableFuture.completedFuture(List.of())
                    : graphStorage.getChunkLinksForEntities(byId.keySet())
                        .thenCompose(chunkLinks -> loadRelatedChunks(chunkLinks, byId, similarityByChunk.keySet()));

                return communities.thenCombine(related, (c, r) -> new GraphContext(
                    entities.stream().map(ScoredEntity::toGraphEntity).toList(), c, r));
            })
            .thenApply(context -> {
                logger.debug("Graph expansion: {} entities, {} communities, {} related chunks",
                    context.entities().size(), context.communities().size(), context.relatedChunks().size());
                return context;
            })
            .exceptionally(e -> {
                logger.warn("Graph store unavailable, continuing with vector results only: {}", e.getMessage());
                return GraphContext.empty();
            });
    }

    private List<ScoredEntity> scoreEntities(List<EntityLink> links, Map<Long, Double> similarityByChunk) {
        Map<Long, ScoredEntity> best = new HashMap<>();
        for (EntityLink link : links) {
            Double similarity = similarityByChunk.get(link.chunkId());
            if (similarity == null) {
                continue;
            }
            double relevance = similarity * link.weight();
            best.merge(link.entityId(),
                new ScoredEntity(link.entityId(), link.entityName(), link.entityType(), relevance),
                (current, candidate) -> candidate.relevance() > current.relevance() ? candidate : current);
        }

        return best.values().stream()
            .sorted(Comparator.comparingDouble(ScoredEntity::relevance).reversed()
                .thenComparing(ScoredEntity::name))
            .limit(maxEntities)
            .toList();
    }

    private List<CommunitySummary> scoreCommunities(List<CommunityMembership> memberships,
                                                    Map<Long, ScoredEntity> entities) {
        Map<Long, CommunitySummary> best = new HashMap<>();
        for (CommunityMembership membership : memberships) {
            ScoredEntity member = entities.get(membership.entityId());
            if (member == null) {
                continue;
            }
            CommunitySummary candidate = new CommunitySummary(
                membership.communityId(), membership.summary(), member.relevance());
            best.merge(membership.communityId(), candidate,
                (current, next) -> next.relevance() > current.relevance() ? next : current);
        }

        return best.values().stream()
            .sorted(Comparator.comparingDouble(CommunitySummary::relevance).reversed()
                .thenComparingLong(CommunitySummary::communityId))
            .limit(maxCommunities)
            .toList();
    }

    private CompletableFuture<List<RetrievedChunk>> loadRelatedChunks(List<EntityLink> links,
                                                                      Map<Long, ScoredEntity> entities,
                                                                      Set<Long> alreadyRetrieved) {
        Map<Long, Double> scoreByChunk = new HashMap<>();
        for (EntityLink link : links) {
            ScoredEntity entity = entities.get(link.entityId());
            if (entity == null || alreadyRetrieved.contains(link.chunkId())) {
                continue;
            }
            scoreByChunk.merge(link.chunkId(), entity.relevance() * link.weight(), Math::max);
        }
        if (scoreByChunk.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }

        List<Long> selected = scoreByChunk.entrySet().stream()
            .sorted(Map.Entry.<Long, Double>comparingByValue().reversed()
                .thenComparing(Map.Entry.<Long, Double>comparingByKey()))
            .limit(maxRelatedChunks)
            .map(Map.Entry::getKey)
            .toList();

        return vectorStorage.getChunks(selected).thenApply(loaded -> {
            Map<Long, RetrievedChunk> byId = new HashMap<>();
            loaded.forEach(chunk -> byId.put(chunk.id(), chunk));

            List<RetrievedChunk> ordered = new ArrayList<>(selected.size());
            for (Long id : selected) {
                RetrievedChunk chunk = byId.get(id);
                if (chunk != null) {
                    ordered.add(chunk.withSimilarity(scoreByChunk.get(id)));
                }
            }
            return ordered;
        });
    }

    private record ScoredEntity(long id, String name, String type, double relevance) {

        GraphEntity toGraphEntity() {
            return new GraphEntity(name, type, relevance);
        }
    }
}
