package br.edu.ifba.hybridrag.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import br.edu.ifba.hybridrag.core.Answer;
import br.edu.ifba.hybridrag.core.GraphContext;
import br.edu.ifba.hybridrag.core.GraphEntity;
import br.edu.ifba.hybridrag.core.OrderedContext;
import br.edu.ifba.hybridrag.core.RetrievedChunk;
import br.edu.ifba.hybridrag.exception.UpstreamUnavailableException;
import br.edu.ifba.hybridrag.llm.LLMFunction;
import br.edu.ifba.hybridrag.llm.ScriptedLLMFunction;

class AnswerSynthesizerTest {

    private static final OrderedContext TWO_CHUNKS = new ContextAssembler().assemble(
        List.of(
            new RetrievedChunk(10, "RAG retrieves passages before generating.", "rag.pdf", 1, 0, "Lewis et al. (2020)", 0.9),
            new RetrievedChunk(11, "Dense retrievers embed queries.", "dpr.pdf", 2, 0, null, 0.7)),
        new GraphContext(List.of(new GraphEntity("RAG", "METHOD", 0.9)), List.of(), List.of()));

    private static AnswerSynthesizer synthesizer(LLMFunction llm) {
        return new AnswerSynthesizer(llm, 500, 0.3);
    }

    @Nested
    @DisplayName("valid answers")
    class ValidAnswers {

        @Test
        void testValidAnswerPassesThroughUnchanged() {
            ScriptedLLMFunction llm = ScriptedLLMFunction.replying("Retrieval comes first [chunk2], then generation [chunk1].");

            Answer answer = synthesizer(llm).synthesize("How does RAG work?", TWO_CHUNKS).join();

            assertEquals("Retrieval comes first [chunk2], then generation [chunk1].", answer.text());
            assertEquals(List.of(1, 2), answer.usedCitations());
            assertFalse(answer.lowConfidence());
            assertFalse(answer.fromMemory());
            assertEquals(1, llm.callCount());
        }

        @Test
        void testPromptListsChunksAndReferences() {
            ScriptedLLMFunction llm = ScriptedLLMFunction.replying("ok [chunk1]");

            synthesizer(llm).synthesize("How does RAG work?", TWO_CHUNKS).join();

            ScriptedLLMFunction.Call call = llm.calls().get(0);
            assertTrue(call.prompt().contains("[chunk1] RAG retrieves passages before generating."));
            assertTrue(call.prompt().contains("[chunk2] Dense retrievers embed queries."));
            assertTrue(call.prompt().contains("Only [chunk1] through [chunk2] exist."));
            assertTrue(call.prompt().contains("[chunk1] Lewis et al. (2020)"));
            assertTrue(call.prompt().contains("[chunk2] dpr.pdf"));
            assertTrue(call.prompt().contains("- RAG (METHOD)"));
            assertEquals(AnswerSynthesizer.SYSTEM_PROMPT, call.systemPrompt());
            assertEquals(500, call.kwargs().get("max_tokens"));
        }

        @Test
        void testEmptyContextAsksForAnUncitedAnswer() {
            ScriptedLLMFunction llm = ScriptedLLMFunction.replying("The collection has no information on that.");

            Answer answer = synthesizer(llm).synthesize("Who won the 1950 World Cup?", OrderedContext.empty()).join();

            assertTrue(answer.usedCitations().isEmpty());
            assertFalse(answer.lowConfidence());
            assertEquals(AnswerSynthesizer.NO_CONTEXT_SYSTEM_PROMPT, llm.calls().get(0).systemPrompt());
            assertFalse(llm.calls().get(0).prompt().contains("[chunk"));
        }
    }

    @Nested
    @DisplayName("citation contract violations")
    class Violations {

        @Test
        void testOneCorrectiveRetry() {
            ScriptedLLMFunction llm = ScriptedLLMFunction.replying("Invented [chunk7].", "Fixed [chunk2].");

            Answer answer = synthesizer(llm).synthesize("q", TWO_CHUNKS).join();

            assertEquals("Fixed [chunk2].", answer.text());
            assertEquals(List.of(2), answer.usedCitations());
            assertFalse(answer.lowConfidence());
            assertEquals(2, llm.callCount());

            ScriptedLLMFunction.Call retry = llm.calls().get(1);
            assertTrue(retry.prompt().contains("[chunk7]"));
            assertEquals(2, retry.history().size());
            assertEquals(LLMFunction.Message.Role.ASSISTANT, retry.history().get(1).role());
            assertEquals("Invented [chunk7].", retry.history().get(1).content());
        }

        @Test
        void testSecondViolationStripsAllCitations() {
            ScriptedLLMFunction llm = ScriptedLLMFunction.replying("Bad [chunk7].", "Still [chunk0] bad [chunk1].");

            Answer answer = synthesizer(llm).synthesize("q", TWO_CHUNKS).join();

            assertEquals("Still bad.", answer.text());
            assertTrue(answer.usedCitations().isEmpty());
            assertTrue(answer.lowConfidence());
        }

        @Test
        @DisplayName("a failed corrective retry degrades the first answer instead of failing")
        void testFailedRetryFallsBackToUncitedFirstAnswer() {
            ScriptedLLMFunction llm = ScriptedLLMFunction.answering(prompt -> prompt.startsWith("Generate")
                ? CompletableFuture.completedFuture("Invented [chunk7].")
                : CompletableFuture.failedFuture(new UpstreamUnavailableException("llm", "timeout on retry", null)));

            Answer answer = synthesizer(llm).synthesize("q", TWO_CHUNKS).join();

            assertEquals("Invented.", answer.text());
            assertTrue(answer.usedCitations().isEmpty());
            assertTrue(answer.lowConfidence());
            assertFalse(answer.fromMemory());
            assertEquals(2, llm.callCount());
        }

        @Test
        @DisplayName("no adversarial reply gets an out-of-range citation through")
        void testAdversarialRepliesNeverLeakInvalidCitations() {
            List<String> adversarial = List.of(
                "See [chunk3].",
                "See [chunk0].",
                "See [chunk-1].",
                "See [chunk01].",
                "See [chunk99999999999].",
                "See [chunk[chunk1]3].",
                "See ([chunk1], [chunk5]).",
                "[chunk2][chunk3][chunk2]"
            );

            for (String reply : adversarial) {
                ScriptedLLMFunction llm = ScriptedLLMFunction.always(reply);

                Answer answer = synthesizer(llm).synthesize("q", TWO_CHUNKS).join();

                CitationValidator.CitationCheck check = CitationValidator.check(answer.text(), TWO_CHUNKS.size());
                assertTrue(check.isValid(), () -> "invalid citation leaked for reply: " + reply + " -> " + answer.text());
                assertTrue(answer.usedCitations().stream().allMatch(TWO_CHUNKS::isValidCitation));
                assertTrue(llm.callCount() <= 2);
            }
        }

        @Test
        void testCitationsAgainstEmptyContextAreStripped() {
            ScriptedLLMFunction llm = ScriptedLLMFunction.always("Nothing found [chunk1].");

            Answer answer = synthesizer(llm).synthesize("q", OrderedContext.empty()).join();

            assertEquals("Nothing found.", answer.text());
            assertTrue(answer.lowConfidence());
        }
    }

    @Test
    void testLlmFailureSurfacesAsUpstreamUnavailable() {
        LLMFunction failing = (prompt, system, history, kwargs) ->
            CompletableFuture.failedFuture(new IllegalStateException("connection refused"));

        CompletionException thrown = assertThrows(CompletionException.class,
            () -> synthesizer(failing).synthesize("q", TWO_CHUNKS).join());

        UpstreamUnavailableException cause = assertInstanceOf(UpstreamUnavailableException.class, thrown.getCause());
        assertEquals("llm", cause.getUpstream());
    }
}
