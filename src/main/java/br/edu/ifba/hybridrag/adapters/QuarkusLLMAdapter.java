package br.edu.ifba.hybridrag.adapters;

import br.edu.ifba.hybridrag.client.ChatMessage;
import br.edu.ifba.hybridrag.client.LlmChatClient;
import br.edu.ifba.hybridrag.client.LlmChatRequest;
import br.edu.ifba.hybridrag.client.LlmChatResponse;
import br.edu.ifba.hybridrag.exception.UpstreamUnavailableException;
import br.edu.ifba.hybridrag.llm.LLMFunction;
import io.quarkus.arc.Arc;
import io.quarkus.arc.ManagedContext;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bridges the chat-completion REST client to the engine's {@link LLMFunction}.
 * Calls run on a dedicated pool whose threads carry the Quarkus classloader, with a
 * request context activated for the duration of the call.
 */
@ApplicationScoped
public class QuarkusLLMAdapter implements LLMFunction {

    private static final Logger LOG = Logger.getLogger(QuarkusLLMAdapter.class);
    private static final ClassLoader QUARKUS_CLASSLOADER = QuarkusLLMAdapter.class.getClassLoader();
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private static final ThreadFactory THREAD_FACTORY = task -> {
        final Thread thread = new Thread(() -> {
            Thread.currentThread().setContextClassLoader(QUARKUS_CLASSLOADER);
            task.run();
        }, "hybridrag-llm-" + THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    };

    private static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(THREAD_FACTORY);

    @Inject
    @RestClient
    LlmChatClient chatClient;

    @ConfigProperty(name = "chat.model")
    String defaultModel;

    @ConfigProperty(name = "hybridrag.synthesis.temperature", defaultValue = "0.5")
    Double defaultTemperature;

    @ConfigProperty(name = "hybridrag.synthesis.max-tokens", defaultValue = "500")
    Integer defaultMaxTokens;

    @Override
    public CompletableFuture<String> apply(
            @NotNull final String prompt,
            @Nullable final String systemPrompt,
            @Nullable final List<Message> historyMessages,
            @NotNull final Map<String, Object> kwargs) {

        return CompletableFuture.supplyAsync(() -> {
            final ManagedContext requestContext = Arc.container().requestContext();
            final boolean activated = !requestContext.isActive();
            if (activated) {
                requestContext.activate();
            }

            try {
                final List<ChatMessage> messages = buildMessages(prompt, systemPrompt, historyMessages);

                final String model = (String) kwargs.getOrDefault("model", defaultModel);
                final Double temperature = getDoubleParam(kwargs, "temperature", defaultTemperature);
                final Integer maxTokens = getIntegerParam(kwargs, "max_tokens", defaultMaxTokens);

                LOG.debugf("LLM request - model: %s, prompt length: %d, history size: %d, max tokens: %d",
                        model,
                        Integer.valueOf(prompt.length()),
                        Integer.valueOf(historyMessages != null ? historyMessages.size() : 0),
                        maxTokens);

                final LlmChatResponse response = chatClient.chat(
                        new LlmChatRequest(model, messages, Boolean.FALSE, maxTokens, temperature));

                if (response == null || response.choices() == null || response.choices().isEmpty()
                        || response.choices().get(0).message() == null) {
                    throw new IllegalStateException("LLM returned no choices in response");
                }

                final String content = response.choices().get(0).message().content();
                if (content == null) {
                    throw new IllegalStateException("LLM returned an empty message");
                }

                LOG.debugf("LLM response received - length: %d characters, tokens: %s",
                        Integer.valueOf(content.length()),
                        response.usage() != null ? String.valueOf(response.usage().totalTokens()) : "unknown");

                return content;

            } catch (Exception e) {
                LOG.errorf(e, "Error calling LLM via QuarkusLLMAdapter");
                throw new UpstreamUnavailableException("llm", "Failed to get LLM completion: " + e.getMessage(), e);
            } finally {
                if (activated) {
                    requestContext.deactivate();
                }
            }
        }, EXECUTOR);
    }

    /**
     * Message order: [system], [history...], [user prompt]
     */
    private List<ChatMessage> buildMessages(
            @NotNull final String prompt,
            @Nullable final String systemPrompt,
            @Nullable final List<Message> historyMessages) {

        final List<ChatMessage> messages = new ArrayList<>();

        if (systemPrompt != null && !systemPrompt.isEmpty()) {
            messages.add(new ChatMessage("system", systemPrompt));
        }

        if (historyMessages != null) {
            for (final Message msg : historyMessages) {
                messages.add(new ChatMessage(convertRole(msg.role()), msg.content()));
            }
        }

        messages.add(new ChatMessage("user", prompt));
        return messages;
    }

    private String convertRole(@NotNull final Message.Role role) {
        return switch (role) {
            case SYSTEM -> "system";
            case USER -> "user";
            case ASSISTANT -> "assistant";
        };
    }

    private Double getDoubleParam(final Map<String, Object> kwargs, final String key, final Double defaultValue) {
        final Object value = kwargs.get(key);
        if (value instanceof Number number) {
            return Double.valueOf(number.doubleValue());
        }
        return defaultValue;
    }

    private Integer getIntegerParam(final Map<String, Object> kwargs, final String key, final Integer defaultValue) {
        final Object value = kwargs.get(key);
        if (value instanceof Number number) {
            return Integer.valueOf(number.intValue());
        }
        return defaultValue;
    }
}
