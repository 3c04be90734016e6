package br.edu.ifba.hybridrag.feedback;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

public record FavoriteRequest(
    @JsonProperty("is_favorite")
    @NotNull(message = "is_favorite is required")
    Boolean favorite
) {
}
