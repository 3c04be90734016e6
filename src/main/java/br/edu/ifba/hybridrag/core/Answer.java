package br.edu.ifba.hybridrag.core;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * A synthesized (or remembered) answer.
 *
 * @param text answer text containing {@code [chunkN]} citation tokens
 * @param usedCitations distinct citation indices present in the text, ascending
 * @param lowConfidence true when citations had to be stripped after a contract violation
 * @param fromMemory true when the answer was served from the query memory
 */
public record Answer(
    @NotNull String text,
    @NotNull List<Integer> usedCitations,
    boolean lowConfidence,
    boolean fromMemory
) {

    public Answer {
        usedCitations = List.copyOf(usedCitations);
    }

    public Answer asRemembered() {
        return new Answer(text, usedCitations, lowConfidence, true);
    }
}
