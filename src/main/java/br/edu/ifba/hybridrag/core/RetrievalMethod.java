package br.edu.ifba.hybridrag.core;

import org.jetbrains.annotations.NotNull;

/**
 * Which retrieval signal produced a chunk, as recorded with retrieval evaluations.
 */
public enum RetrievalMethod {
    VECTOR("vector"),
    GRAPH("graph"),
    FUSED("fused"),
    LLM("llm");

    private final String tag;

    RetrievalMethod(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    @NotNull
    public static RetrievalMethod fromTag(@NotNull String tag) {
        for (RetrievalMethod method : values()) {
            if (method.tag.equalsIgnoreCase(tag)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown retrieval method: " + tag);
    }
}
