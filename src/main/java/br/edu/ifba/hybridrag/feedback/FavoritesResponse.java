package br.edu.ifba.hybridrag.feedback;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record FavoritesResponse(
    @JsonProperty("status") String status,
    @JsonProperty("favorites") List<FavoriteEntry> favorites
) {
}
