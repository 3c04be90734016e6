package br.edu.ifba.hybridrag.storage.impl;

import br.edu.ifba.hybridrag.storage.GraphStorage;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * SQLite-based implementation of GraphStorage over the {@code entities},
 * {@code entity_chunks}, {@code communities} and {@code community_entities} tables.
 */
public final class SQLiteGraphStorage implements GraphStorage {

    private final SQLiteConnectionManager connectionManager;

    public SQLiteGraphStorage(SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public CompletableFuture<List<EntityLink>> getEntityLinksForChunks(@NotNull Collection<Long> chunkIds) {
        return CompletableFuture.supplyAsync(() -> queryLinks("ec.chunk_id", chunkIds));
    }

    @Override
    public CompletableFuture<List<EntityLink>> getChunkLinksForEntities(@NotNull Collection<Long> entityIds) {
        return CompletableFuture.supplyAsync(() -> queryLinks("ec.entity_id", entityIds));
    }

    @Override
    public CompletableFuture<List<CommunityMembership>> getCommunitiesForEntities(@NotNull Collection<Long> entityIds) {
        return CompletableFuture.supplyAsync(() -> {
            if (entityIds.isEmpty()) {
                return List.of();
            }

            String sql = """
                SELECT c.id, c.summary, ce.entity_id
                FROM community_entities ce
                JOIN communities c ON c.id = ce.community_id
                WHERE ce.entity_id IN (%s)
                ORDER BY c.id, ce.entity_id
                """.formatted(placeholders(entityIds.size()));

            List<CommunityMembership> memberships = new ArrayList<>();
            Connection conn = connectionManager.getReadConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                bindIds(stmt, entityIds);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        memberships.add(new CommunityMembership(
                            rs.getLong("id"),
                            rs.getString("summary"),
                            rs.getLong("entity_id")
                        ));
                    }
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to load communities for entities", e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
            return memberships;
        });
    }

    private List<EntityLink> queryLinks(String filterColumn, Collection<Long> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }

        String sql = """
            SELECT e.id, e.name, e.entity_type, ec.chunk_id, ec.weight
            FROM entity_chunks ec
            JOIN entities e ON e.id = ec.entity_id
            WHERE %s IN (%s)
            ORDER BY e.id, ec.chunk_id
            """.formatted(filterColumn, placeholders(ids.size()));

        List<EntityLink> links = new ArrayList<>();
        Connection conn = connectionManager.getReadConnection();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            bindIds(stmt, ids);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    links.add(new EntityLink(
                        rs.getLong("id"),
                        rs.getString("name"),
                        rs.getString("entity_type"),
                        rs.getLong("chunk_id"),
                        rs.getDouble("weight")
                    ));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load entity links", e);
        } finally {
            connectionManager.releaseReadConnection(conn);
        }
        return links;
    }

    private static String placeholders(int count) {
        return String.join(",", Collections.nCopies(count, "?"));
    }

    private static void bindIds(PreparedStatement stmt, Collection<Long> ids) throws SQLException {
        int index = 1;
        for (Long id : ids) {
            stmt.setLong(index++, id);
        }
    }
}
