package br.edu.ifba.hybridrag.feedback;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FeedbackResponse(
    @JsonProperty("status") String status,
    @JsonProperty("message") String message,
    @JsonProperty("feedback") FeedbackRecord feedback
) {

    public static FeedbackResponse success(String message, FeedbackRecord feedback) {
        return new FeedbackResponse("success", message, feedback);
    }
}
