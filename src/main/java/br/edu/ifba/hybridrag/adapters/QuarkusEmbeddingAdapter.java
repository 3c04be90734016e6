package br.edu.ifba.hybridrag.adapters;

import br.edu.ifba.hybridrag.client.EmbeddingRequest;
import br.edu.ifba.hybridrag.client.EmbeddingResponse;
import br.edu.ifba.hybridrag.client.LlmEmbeddingClient;
import br.edu.ifba.hybridrag.embedding.EmbeddingFunction;
import br.edu.ifba.hybridrag.exception.UpstreamUnavailableException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jetbrains.annotations.NotNull;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bridges the embedding REST client to the engine's {@link EmbeddingFunction}.
 */
@ApplicationScoped
public class QuarkusEmbeddingAdapter implements EmbeddingFunction {

    private static final Logger LOG = Logger.getLogger(QuarkusEmbeddingAdapter.class);
    private static final ClassLoader QUARKUS_CLASSLOADER = QuarkusEmbeddingAdapter.class.getClassLoader();
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private static final ThreadFactory THREAD_FACTORY = task -> {
        final Thread thread = new Thread(() -> {
            Thread.currentThread().setContextClassLoader(QUARKUS_CLASSLOADER);
            task.run();
        }, "hybridrag-embedding-" + THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    };

    private static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(THREAD_FACTORY);

    @Inject
    @RestClient
    LlmEmbeddingClient embeddingClient;

    @ConfigProperty(name = "embedding.model")
    String embeddingModel;

    @ConfigProperty(name = "hybridrag.vector.dimension", defaultValue = "384")
    Integer vectorDimension;

    @Override
    public CompletableFuture<List<float[]>> embed(@NotNull final List<String> texts) {
        if (texts.isEmpty()) {
            LOG.warn("Empty text list provided for embedding");
            return CompletableFuture.completedFuture(List.of());
        }

        return CompletableFuture.supplyAsync(() -> {
            try {
                LOG.debugf("Embedding request - texts count: %d, model: %s",
                        Integer.valueOf(texts.size()), embeddingModel);

                final EmbeddingResponse response = embeddingClient.embed(new EmbeddingRequest(embeddingModel, texts));

                if (response == null || response.data() == null || response.data().isEmpty()) {
                    throw new IllegalStateException("Embedding API returned no data");
                }
                if (response.data().size() != texts.size()) {
                    throw new IllegalStateException(String.format("Expected %d embeddings but received %d",
                            Integer.valueOf(texts.size()), Integer.valueOf(response.data().size())));
                }

                final List<EmbeddingResponse.Embedding> ordered = new ArrayList<>(response.data());
                ordered.sort(Comparator.comparingInt(EmbeddingResponse.Embedding::index));

                final List<float[]> embeddings = new ArrayList<>(ordered.size());
                for (final EmbeddingResponse.Embedding embeddingData : ordered) {
                    embeddings.add(toFloatVector(embeddingData.embedding()));
                }

                LOG.debugf("Generated %d embeddings with dimension %d",
                        Integer.valueOf(embeddings.size()), Integer.valueOf(embeddings.get(0).length));
                return embeddings;

            } catch (Exception e) {
                LOG.errorf(e, "Error calling embedding API via QuarkusEmbeddingAdapter");
                throw new UpstreamUnavailableException("embedding", "Failed to generate embeddings: " + e.getMessage(), e);
            }
        }, EXECUTOR);
    }

    private float[] toFloatVector(final List<Double> doubleVector) {
        if (doubleVector == null || doubleVector.isEmpty()) {
            throw new IllegalStateException("Embedding API returned null or empty vector");
        }

        final int actualDimension = doubleVector.size();
        if (actualDimension != vectorDimension) {
            LOG.warnf("Vector dimension mismatch: expected %d but got %d, truncating to the smaller one",
                    vectorDimension, Integer.valueOf(actualDimension));
        }

        final int targetDimension = Math.min(actualDimension, vectorDimension);
        final float[] floatVector = new float[targetDimension];
        for (int i = 0; i < targetDimension; i++) {
            floatVector[i] = doubleVector.get(i).floatValue();
        }
        return floatVector;
    }
}
