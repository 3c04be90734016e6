package br.edu.ifba.hybridrag.query;

import br.edu.ifba.hybridrag.core.Answer;
import br.edu.ifba.hybridrag.core.CommunitySummary;
import br.edu.ifba.hybridrag.core.ContextChunk;
import br.edu.ifba.hybridrag.core.GraphEntity;
import br.edu.ifba.hybridrag.core.OrderedContext;
import br.edu.ifba.hybridrag.exception.UpstreamUnavailableException;
import br.edu.ifba.hybridrag.llm.LLMFunction;
import br.edu.ifba.hybridrag.query.CitationValidator.CitationCheck;
import br.edu.ifba.hybridrag.utils.AsyncUtil;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Produces a cited answer from an ordered context.
 *
 * <p>The answer may only cite {@code [chunk1]..[chunkN]} where N is the context size. An
 * answer citing anything else gets one corrective retry; if the retry still violates the
 * contract every citation is stripped and the answer is flagged low-confidence. Invalid
 * citations therefore never reach the caller.</p>
 */
public class AnswerSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(AnswerSynthesizer.class);

    static final String SYSTEM_PROMPT =
        "You are a knowledgeable assistant that provides well-researched answers with proper citations.";

    static final String NO_CONTEXT_SYSTEM_PROMPT =
        "You are a careful assistant. You only answer from provided documents and never invent sources.";

    private final LLMFunction llmFunction;
    private final int maxTokens;
    private final double temperature;

    public AnswerSynthesizer(@NotNull LLMFunction llmFunction, int maxTokens, double temperature) {
        this.llmFunction = llmFunction;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
    }

    public CompletableFuture<Answer> synthesize(@NotNull String query, @NotNull OrderedContext context) {
        String prompt = context.isEmpty() ? buildNoContextPrompt(query) : buildPrompt(query, context);
        String systemPrompt = context.isEmpty() ? NO_CONTEXT_SYSTEM_PROMPT : SYSTEM_PROMPT;
        Map<String, Object> kwargs = Map.of("max_tokens", maxTokens, "temperature", temperature);

        logger.debug("Synthesizing answer over {} chunks, prompt length {}", context.size(), prompt.length());

        return llmFunction.apply(prompt, systemPrompt, null, kwargs)
            .thenCompose(first -> {
                CitationCheck check = CitationValidator.check(first, context.size());
                if (check.isValid()) {
                    return CompletableFuture.completedFuture(new Answer(first.trim(), check.used(), false, false));
                }

                logger.warn("Answer cited {} outside 1..{}, retrying with a correction", check.invalid(), context.size());
                List<LLMFunction.Message> history = List.of(
                    new LLMFunction.Message(LLMFunction.Message.Role.USER, prompt),
                    new LLMFunction.Message(LLMFunction.Message.Role.ASSISTANT, first)
                );
                return llmFunction.apply(buildCorrection(check, context.size()), systemPrompt, history, kwargs)
                    .handle((second, retryError) -> {
                        if (retryError != null) {
                            logger.warn("Corrective retry failed ({}), returning the first answer without citations",
                                AsyncUtil.unwrap(retryError).toString());
                            return new Answer(CitationValidator.stripCitations(first), List.of(), true, false);
                        }
                        return finish(second, context.size());
                    });
            })
            .exceptionally(e -> {
                Throwable cause = AsyncUtil.unwrap(e);
                if (cause instanceof UpstreamUnavailableException upstream) {
                    throw upstream;
                }
                throw new UpstreamUnavailableException("llm", "Answer synthesis failed: " + cause.getMessage(), cause);
            });
    }

    private Answer finish(String retried, int contextSize) {
        CitationCheck check = CitationValidator.check(retried, contextSize);
        if (check.isValid()) {
            return new Answer(retried.trim(), check.used(), false, false);
        }
        logger.warn("Corrected answer still cited {}, returning it without citations", check.invalid());
        return new Answer(CitationValidator.stripCitations(retried), List.of(), true, false);
    }

    String buildPrompt(String query, OrderedContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("Generate a comprehensive answer to the following query based on the provided context.\n\n");
        sb.append("Query: ").append(query).append("\n\n");
        sb.append("Context:\n");
        for (ContextChunk chunk : context.chunks()) {
            sb.append("[chunk").append(chunk.citationIndex()).append("] ")
                .append(chunk.chunk().text().strip())
                .append("\n\n");
        }

        if (!context.entities().isEmpty()) {
            sb.append("Related entities (background only, not citable):\n");
            for (GraphEntity entity : context.entities()) {
                sb.append("- ").append(entity.name());
                if (entity.entityType() != null) {
                    sb.append(" (").append(entity.entityType()).append(')');
                }
                sb.append('\n');
            }
            sb.append('\n');
        }
        if (!context.communities().isEmpty()) {
            sb.append("Topic summaries (background only, not citable):\n");
            for (CommunitySummary community : context.communities()) {
                sb.append("- ").append(community.summary().strip()).append('\n');
            }
            sb.append('\n');
        }

        sb.append("""
            Guidelines:
            1. Answer the query using ONLY the information in the provided context.
            2. If the context doesn't contain enough information to fully answer the query, acknowledge the limitations.
            3. Include parenthetical citations when referring to specific information, using the format [chunk1], [chunk2], etc.
            """);
        sb.append("4. Only [chunk1] through [chunk").append(context.size())
            .append("] exist. Never cite any other number and never use another citation format.\n");
        sb.append("""
            5. Write in a clear, informative, and authoritative style, making connections between sources where relevant.
            6. The answer should be 1-2 paragraphs (3-8 sentences).

            References to use (in order):
            """);
        List<String> references = context.references();
        for (int i = 0; i < references.size(); i++) {
            String reference = references.get(i);
            sb.append("[chunk").append(i + 1).append("] ")
                .append(reference != null ? reference : "Unknown source")
                .append('\n');
        }
        return sb.toString();
    }

    String buildNoContextPrompt(String query) {
        return """
            No documents in the collection matched the following query.

            Query: %s

            Tell the user briefly that the document collection does not contain information to answer it. \
            Do not answer from general knowledge and do not include any citations.
            """.formatted(query);
    }

    private String buildCorrection(CitationCheck check, int contextSize) {
        if (contextSize == 0) {
            return "Your answer contained citations " + String.join(", ", check.invalid())
                + " but there are no documents to cite. Rewrite the answer without any citation.";
        }
        return "Your answer contained citations " + String.join(", ", check.invalid())
            + " that do not exist. Only [chunk1] through [chunk" + contextSize
            + "] are valid. Rewrite the answer using only those citations.";
    }
}
