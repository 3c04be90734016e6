package br.edu.ifba.hybridrag.client;

import java.util.List;

public record EmbeddingRequest(String model, List<String> input) {
}
