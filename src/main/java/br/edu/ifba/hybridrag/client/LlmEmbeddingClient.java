package br.edu.ifba.hybridrag.client;

import java.time.temporal.ChronoUnit;

import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import org.eclipse.microprofile.config.ConfigProvider;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

@RegisterRestClient(configKey = "llm-embedding")
@RegisterProvider(LlmClientExceptionMapper.class)
@ClientHeaderParam(name = "Authorization", value = "{lookupAuth}")
public interface LlmEmbeddingClient {

    @POST
    @Path("/embeddings")
    @Retry(maxRetries = 2, delay = 200, delayUnit = ChronoUnit.MILLIS)
    @Timeout(value = 10, unit = ChronoUnit.SECONDS)
    EmbeddingResponse embed(EmbeddingRequest request);

    default String lookupAuth() {
        return ConfigProvider.getConfig()
            .getOptionalValue("llm-embedding.api-key", String.class)
            .map(key -> "Bearer " + key)
            .orElse(null);
    }
}
