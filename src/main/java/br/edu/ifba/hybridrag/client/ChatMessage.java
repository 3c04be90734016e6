package br.edu.ifba.hybridrag.client;

public record ChatMessage(String role, String content) {
}
