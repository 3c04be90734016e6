package br.edu.ifba.hybridrag.client;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbeddingResponse(String model, List<Embedding> data) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Embedding(int index, List<Double> embedding) {
    }
}
