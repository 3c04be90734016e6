package br.edu.ifba.hybridrag.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Engine configuration, loaded from application.properties with the "hybridrag" prefix.
 *
 * <p>Example configuration:
 * <pre>
 * hybridrag.memory.similarity-threshold=0.92
 * hybridrag.retrieval.default-max-results=5
 * hybridrag.graph.max-entities=10
 * hybridrag.query.deadline-ms=45000
 * hybridrag.storage.sqlite.path=data/hybridrag.db
 * </pre>
 */
@ConfigMapping(prefix = "hybridrag")
public interface HybridRagConfig {

    Memory memory();

    Retrieval retrieval();

    Graph graph();

    Synthesis synthesis();

    Query query();

    Evaluation evaluation();

    Feedback feedback();

    Vector vector();

    Storage storage();

    interface Memory {

        /**
         * Whether answers are remembered and reused for similar queries.
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Cosine similarity at or above which a remembered query counts as the same question.
         */
        @WithName("similarity-threshold")
        @WithDefault("0.92")
        double similarityThreshold();
    }

    interface Retrieval {

        @WithName("default-max-results")
        @WithDefault("5")
        int defaultMaxResults();

        @WithName("max-results-limit")
        @WithDefault("50")
        int maxResultsLimit();
    }

    interface Graph {

        @WithDefault("true")
        boolean enabled();

        @WithName("max-entities")
        @WithDefault("10")
        int maxEntities();

        @WithName("max-communities")
        @WithDefault("5")
        int maxCommunities();

        @WithName("max-related-chunks")
        @WithDefault("2")
        int maxRelatedChunks();
    }

    interface Synthesis {

        @WithName("max-tokens")
        @WithDefault("500")
        int maxTokens();

        @WithDefault("0.5")
        double temperature();
    }

    interface Query {

        /**
         * Overall deadline for one query, in milliseconds.
         */
        @WithName("deadline-ms")
        @WithDefault("45000")
        long deadlineMs();
    }

    interface Evaluation {

        /**
         * Record heuristic retrieval judgments after every freshly synthesized answer.
         */
        @WithName("auto-record")
        @WithDefault("true")
        boolean autoRecord();

        @WithName("similarity-threshold")
        @WithDefault("0.35")
        double similarityThreshold();

        @WithName("llm-threshold")
        @WithDefault("0.5")
        double llmThreshold();
    }

    interface Feedback {

        @WithName("max-conflict-retries")
        @WithDefault("3")
        int maxConflictRetries();
    }

    interface Vector {

        @WithDefault("384")
        int dimension();
    }

    interface Storage {

        Sqlite sqlite();

        interface Sqlite {

            @WithDefault("data/hybridrag.db")
            String path();

            @WithName("read-pool-size")
            @WithDefault("4")
            int readPoolSize();

            /**
             * Busy timeout in milliseconds.
             */
            @WithName("busy-timeout")
            @WithDefault("30000")
            long busyTimeout();

            @WithName("wal-mode")
            @WithDefault("true")
            boolean walMode();
        }
    }
}
