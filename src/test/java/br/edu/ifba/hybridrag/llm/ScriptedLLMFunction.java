package br.edu.ifba.hybridrag.llm;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * LLM stand-in that replays canned replies and records every call it receives.
 * Once the script runs out, the fallback produces the reply.
 */
public final class ScriptedLLMFunction implements LLMFunction {

    private final Deque<String> replies;
    private final Function<String, CompletableFuture<String>> fallback;
    private final List<Call> calls = Collections.synchronizedList(new ArrayList<>());

    private ScriptedLLMFunction(List<String> replies, Function<String, CompletableFuture<String>> fallback) {
        this.replies = new ArrayDeque<>(replies);
        this.fallback = fallback;
    }

    public static ScriptedLLMFunction replying(String... replies) {
        return new ScriptedLLMFunction(List.of(replies), prompt -> CompletableFuture.failedFuture(
            new IllegalStateException("No scripted reply left")));
    }

    public static ScriptedLLMFunction always(String reply) {
        return new ScriptedLLMFunction(List.of(), prompt -> CompletableFuture.completedFuture(reply));
    }

    public static ScriptedLLMFunction answering(Function<String, CompletableFuture<String>> responder) {
        return new ScriptedLLMFunction(List.of(), responder);
    }

    @Override
    public synchronized CompletableFuture<String> apply(String prompt, String systemPrompt,
                                                        List<Message> historyMessages, Map<String, Object> kwargs) {
        calls.add(new Call(prompt, systemPrompt, historyMessages == null ? List.of() : List.copyOf(historyMessages), kwargs));
        String reply = replies.poll();
        return reply != null ? CompletableFuture.completedFuture(reply) : fallback.apply(prompt);
    }

    public List<Call> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public int callCount() {
        return calls.size();
    }

    public record Call(String prompt, String systemPrompt, List<Message> history, Map<String, Object> kwargs) {
    }
}
