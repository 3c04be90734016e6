package br.edu.ifba.hybridrag.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import br.edu.ifba.hybridrag.storage.GraphStorage.CommunityMembership;
import br.edu.ifba.hybridrag.storage.GraphStorage.EntityLink;

class SQLiteGraphStorageTest {

    @TempDir
    Path tempDir;

    private SQLiteTestDatabase database;
    private SQLiteGraphStorage storage;

    @BeforeEach
    void setUp() throws Exception {
        database = SQLiteTestDatabase.create(tempDir);
        storage = database.graphStorage();

        database.document(1, "paper.pdf", null);
        database.chunk(10, 1, "Transformers use attention.");
        database.chunk(11, 1, "Attention weighs tokens.");
        database.chunk(12, 1, "Unrelated text.");
        database.entity(100, "Transformer", "MODEL");
        database.entity(101, "Attention", "CONCEPT");
        database.link(100, 10, 1.0);
        database.link(101, 10, 0.5);
        database.link(101, 11, 0.8);
        database.community(7, "Neural sequence models", 100, 101);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void testEntityLinksForChunks() {
        List<EntityLink> links = storage.getEntityLinksForChunks(List.of(10L)).join();

        assertEquals(2, links.size());
        assertEquals(new EntityLink(100, "Transformer", "MODEL", 10, 1.0), links.get(0));
        assertEquals("Attention", links.get(1).entityName());
    }

    @Test
    void testChunkLinksForEntities() {
        List<EntityLink> links = storage.getChunkLinksForEntities(List.of(101L)).join();

        assertEquals(List.of(10L, 11L), links.stream().map(EntityLink::chunkId).toList());
    }

    @Test
    void testCommunitiesForEntities() {
        List<CommunityMembership> memberships = storage.getCommunitiesForEntities(List.of(100L, 101L)).join();

        assertEquals(2, memberships.size());
        assertTrue(memberships.stream().allMatch(m -> m.communityId() == 7));
        assertEquals("Neural sequence models", memberships.get(0).summary());
    }

    @Test
    void testEmptyInputsReturnNothing() {
        assertTrue(storage.getEntityLinksForChunks(List.of()).join().isEmpty());
        assertTrue(storage.getChunkLinksForEntities(List.of()).join().isEmpty());
        assertTrue(storage.getCommunitiesForEntities(List.of()).join().isEmpty());
        assertTrue(storage.getEntityLinksForChunks(List.of(12L)).join().isEmpty());
    }
}
