package br.edu.ifba.hybridrag.config;

import java.time.Duration;

import org.jboss.logging.Logger;

import br.edu.ifba.hybridrag.embedding.EmbeddingFunction;
import br.edu.ifba.hybridrag.evaluation.ChunkQualityEvaluator;
import br.edu.ifba.hybridrag.evaluation.EvaluationService;
import br.edu.ifba.hybridrag.evaluation.LlmRelevanceJudge;
import br.edu.ifba.hybridrag.evaluation.SimilarityRelevanceJudge;
import br.edu.ifba.hybridrag.feedback.FeedbackService;
import br.edu.ifba.hybridrag.llm.LLMFunction;
import br.edu.ifba.hybridrag.query.AnswerSynthesizer;
import br.edu.ifba.hybridrag.query.ContextAssembler;
import br.edu.ifba.hybridrag.query.GraphRetriever;
import br.edu.ifba.hybridrag.query.QueryMemoryService;
import br.edu.ifba.hybridrag.query.QueryService;
import br.edu.ifba.hybridrag.query.VectorRetriever;
import br.edu.ifba.hybridrag.query.pipeline.FusionStage;
import br.edu.ifba.hybridrag.query.pipeline.GraphExpansionStage;
import br.edu.ifba.hybridrag.query.pipeline.QueryPipeline;
import br.edu.ifba.hybridrag.query.pipeline.SynthesisStage;
import br.edu.ifba.hybridrag.query.pipeline.VectorSearchStage;
import br.edu.ifba.hybridrag.storage.EvaluationStorage;
import br.edu.ifba.hybridrag.storage.FeedbackStorage;
import br.edu.ifba.hybridrag.storage.GraphStorage;
import br.edu.ifba.hybridrag.storage.QueryCacheStorage;
import br.edu.ifba.hybridrag.storage.VectorStorage;
import br.edu.ifba.hybridrag.utils.RetryEventLogger;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/**
 * CDI producer that wires the engine from configuration.
 *
 * <p>The engine classes take plain constructor values and know nothing about CDI, so they
 * can be built directly in unit tests. This class is the only place that reads
 * {@link HybridRagConfig} for them.</p>
 */
@ApplicationScoped
public class EngineProducer {

    private static final Logger LOG = Logger.getLogger(EngineProducer.class);

    @Produces
    @Singleton
    public VectorRetriever produceVectorRetriever(final VectorStorage vectorStorage) {
        return new VectorRetriever(vectorStorage);
    }

    @Produces
    @Singleton
    public GraphRetriever produceGraphRetriever(final HybridRagConfig config,
                                                final GraphStorage graphStorage,
                                                final VectorStorage vectorStorage) {
        final HybridRagConfig.Graph graph = config.graph();
        LOG.infof("Graph enhancement %s (max entities=%d, communities=%d, related chunks=%d)",
            graph.enabled() ? "enabled" : "disabled", graph.maxEntities(), graph.maxCommunities(),
            graph.maxRelatedChunks());
        return new GraphRetriever(graphStorage, vectorStorage, graph.enabled(), graph.maxEntities(),
            graph.maxCommunities(), graph.maxRelatedChunks());
    }

    @Produces
    @Singleton
    public AnswerSynthesizer produceAnswerSynthesizer(final HybridRagConfig config, final LLMFunction llmFunction) {
        return new AnswerSynthesizer(llmFunction, config.synthesis().maxTokens(), config.synthesis().temperature());
    }

    @Produces
    @Singleton
    public QueryPipeline produceQueryPipeline(final VectorRetriever vectorRetriever,
                                              final GraphRetriever graphRetriever,
                                              final AnswerSynthesizer answerSynthesizer) {
        return QueryPipeline.builder()
            .addStage(new VectorSearchStage(vectorRetriever))
            .addStage(new GraphExpansionStage(graphRetriever))
            .addStage(new FusionStage(new ContextAssembler()))
            .addStage(new SynthesisStage(answerSynthesizer))
            .build();
    }

    @Produces
    @Singleton
    public QueryMemoryService produceQueryMemoryService(final HybridRagConfig config,
                                                       final QueryCacheStorage queryCacheStorage) {
        LOG.infof("Query memory %s (similarity threshold=%s)",
            config.memory().enabled() ? "enabled" : "disabled", config.memory().similarityThreshold());
        return new QueryMemoryService(queryCacheStorage, config.memory().similarityThreshold());
    }

    @Produces
    @Singleton
    public EvaluationService produceEvaluationService(final HybridRagConfig config,
                                                      final EvaluationStorage evaluationStorage,
                                                      final QueryCacheStorage queryCacheStorage,
                                                      final VectorStorage vectorStorage,
                                                      final VectorRetriever vectorRetriever,
                                                      final LLMFunction llmFunction) {
        final HybridRagConfig.Evaluation evaluation = config.evaluation();
        return new EvaluationService(
            evaluationStorage,
            queryCacheStorage,
            vectorStorage,
            vectorRetriever,
            new SimilarityRelevanceJudge(evaluation.similarityThreshold()),
            new LlmRelevanceJudge(llmFunction, evaluation.llmThreshold()),
            new ChunkQualityEvaluator()
        );
    }

    @Produces
    @Singleton
    public FeedbackService produceFeedbackService(final HybridRagConfig config,
                                                  final FeedbackStorage feedbackStorage,
                                                  final QueryCacheStorage queryCacheStorage,
                                                  final RetryEventLogger retryEventLogger) {
        return new FeedbackService(feedbackStorage, queryCacheStorage, retryEventLogger,
            config.feedback().maxConflictRetries());
    }

    @Produces
    @Singleton
    public QueryService produceQueryService(final HybridRagConfig config,
                                            final EmbeddingFunction embeddingFunction,
                                            final QueryMemoryService queryMemoryService,
                                            final QueryPipeline queryPipeline,
                                            final EvaluationService evaluationService) {
        final QueryService.Settings settings = new QueryService.Settings(
            config.memory().enabled(),
            config.evaluation().autoRecord(),
            config.retrieval().defaultMaxResults(),
            config.retrieval().maxResultsLimit(),
            Duration.ofMillis(config.query().deadlineMs())
        );
        LOG.infof("Query service ready (default max_results=%d, deadline=%dms)",
            settings.defaultMaxResults(), settings.deadline().toMillis());
        return new QueryService(embeddingFunction, queryMemoryService, queryPipeline, evaluationService, settings);
    }
}
