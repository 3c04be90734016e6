package br.edu.ifba.hybridrag.llm;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Functional interface for Large Language Model completion.
 * Implementations call a chat-completion provider.
 */
@FunctionalInterface
public interface LLMFunction {

    /**
     * Generate a completion from the LLM.
     *
     * @param prompt the user prompt
     * @param systemPrompt optional system prompt
     * @param historyMessages optional earlier turns, e.g. a rejected answer and a correction
     * @param kwargs additional parameters (temperature, max_tokens, model)
     * @return CompletableFuture with the generated text
     */
    CompletableFuture<String> apply(
        @NotNull String prompt,
        @Nullable String systemPrompt,
        @Nullable List<Message> historyMessages,
        @NotNull Map<String, Object> kwargs
    );

    /**
     * Convenience method for simple prompts without history or system prompt.
     */
    default CompletableFuture<String> apply(@NotNull String prompt) {
        return apply(prompt, null, null, Map.of());
    }

    /**
     * Convenience method with system prompt but no history.
     */
    default CompletableFuture<String> apply(@NotNull String prompt, @Nullable String systemPrompt) {
        return apply(prompt, systemPrompt, null, Map.of());
    }

    /**
     * A message in the conversation history.
     */
    record Message(@NotNull Role role, @NotNull String content) {
        public enum Role {
            SYSTEM, USER, ASSISTANT
        }
    }
}
