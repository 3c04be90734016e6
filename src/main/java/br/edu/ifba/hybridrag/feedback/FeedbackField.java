package br.edu.ifba.hybridrag.feedback;

import br.edu.ifba.hybridrag.exception.InvalidFeedbackException;
import org.jetbrains.annotations.NotNull;

/**
 * Feedback fields that a request may clear by name.
 */
public enum FeedbackField {
    RATING("rating"),
    ACCURACY_RATING("accuracy_rating"),
    COMPREHENSIVENESS_RATING("comprehensiveness_rating"),
    HELPFULNESS_RATING("helpfulness_rating"),
    FEEDBACK_TEXT("feedback_text"),
    IS_FAVORITE("is_favorite");

    private final String wireName;

    FeedbackField(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    @NotNull
    public static FeedbackField fromWireName(String name) {
        for (FeedbackField field : values()) {
            if (field.wireName.equals(name)) {
                return field;
            }
        }
        throw new InvalidFeedbackException("Unknown feedback field to clear: " + name);
    }
}
