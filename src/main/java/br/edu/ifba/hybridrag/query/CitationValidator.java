package br.edu.ifba.hybridrag.query;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks {@code [chunkN]} citation tokens against the size of the context they refer to.
 *
 * <p>Only the exact form {@code [chunkN]} is a citation; any other bracketed text is plain
 * text. A citation is valid when N is a canonical decimal (no leading zero) in
 * {@code 1..contextSize}.</p>
 */
public final class CitationValidator {

    private static final Pattern CITATION = Pattern.compile("\\[chunk(\\d+)\\]");
    private static final Pattern PARENTHESIZED_CITATIONS =
        Pattern.compile("\\s*\\((?:\\s*\\[chunk\\d+\\]\\s*[,;]?)+\\s*\\)");

    private CitationValidator() {
        throw new UnsupportedOperationException("Utility class");
    }

    @NotNull
    public static CitationCheck check(@NotNull String text, int contextSize) {
        TreeSet<Integer> used = new TreeSet<>();
        List<String> invalid = new ArrayList<>();

        Matcher matcher = CITATION.matcher(text);
        while (matcher.find()) {
            Integer index = parseIndex(matcher.group(1));
            if (index == null || index < 1 || index > contextSize) {
                invalid.add(matcher.group());
            } else {
                used.add(index);
            }
        }
        return new CitationCheck(List.copyOf(used), List.copyOf(invalid));
    }

    /**
     * Removes every citation token and collapses the whitespace left behind.
     */
    @NotNull
    public static String stripCitations(@NotNull String text) {
        String stripped = text;
        // removal can splice a new token together, e.g. "[chunk[chunk1]2]"
        while (CITATION.matcher(stripped).find()) {
            stripped = PARENTHESIZED_CITATIONS.matcher(stripped).replaceAll("");
            stripped = CITATION.matcher(stripped).replaceAll("");
        }
        return stripped
            .replaceAll("[ \\t]+([.,;:!?)])", "$1")
            .replaceAll("[ \\t]{2,}", " ")
            .trim();
    }

    private static Integer parseIndex(String digits) {
        if (digits.length() > 1 && digits.charAt(0) == '0') {
            return null;
        }
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException e) {
            // more digits than an int holds
            return null;
        }
    }

    /**
     * @param used distinct valid citation indices, ascending
     * @param invalid offending tokens in order of appearance
     */
    public record CitationCheck(List<Integer> used, List<String> invalid) {

        public boolean isValid() {
            return invalid.isEmpty();
        }
    }
}
