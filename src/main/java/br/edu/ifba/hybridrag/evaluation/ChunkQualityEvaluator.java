package br.edu.ifba.hybridrag.evaluation;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight heuristic for chunk quality. A chunk passes when it has enough content,
 * few formatting artifacts and looks like complete prose.
 */
public class ChunkQualityEvaluator {

    public static final String CRITERIA = "chunk_quality";
    public static final String MODEL = "heuristic:v0";

    static final int MIN_CHARACTERS = 40;
    static final double MAX_NON_WORD_RATIO = 0.15;
    static final int MIN_WORDS_WHEN_UNTERMINATED = 12;

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s.,;:()\\-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public ChunkEvaluation evaluate(long chunkId, @Nullable String chunkText) {
        String text = chunkText == null ? "" : chunkText;
        String trimmed = text.strip();

        boolean hasContent = trimmed.length() >= MIN_CHARACTERS;
        boolean formattingArtifacts = nonWordRatio(text) > MAX_NON_WORD_RATIO;
        boolean complete = trimmed.endsWith(".") || trimmed.endsWith("!") || trimmed.endsWith("?")
            || wordCount(trimmed) > MIN_WORDS_WHEN_UNTERMINATED;

        List<String> problems = new ArrayList<>();
        if (!hasContent) {
            problems.add("insufficient content length");
        }
        if (formattingArtifacts) {
            problems.add("formatting artifacts detected");
        }
        if (!complete) {
            problems.add("chunk likely incomplete");
        }

        int score = problems.isEmpty() ? 1 : 0;
        String explanation = problems.isEmpty() ? "chunk looks good" : String.join(", ", problems);
        return new ChunkEvaluation(0L, chunkId, CRITERIA, score, explanation, MODEL, Instant.now());
    }

    static double nonWordRatio(String text) {
        if (text.isEmpty()) {
            return 0.0;
        }
        Matcher matcher = NON_WORD.matcher(text);
        int nonWord = 0;
        while (matcher.find()) {
            nonWord++;
        }
        return (double) nonWord / text.length();
    }

    private static int wordCount(String trimmed) {
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }
}
