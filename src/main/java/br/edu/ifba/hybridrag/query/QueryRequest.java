package br.edu.ifba.hybridrag.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record QueryRequest(
    @JsonProperty("query")
    @NotBlank(message = "query is required")
    @Size(max = 4000, message = "query must be at most 4000 characters")
    String query,

    /*
     * Number of vector results to retrieve. The configured default when absent; the upper
     * bound is checked against hybridrag.retrieval.max-results-limit.
     */
    @JsonProperty("max_results")
    @Min(value = 1, message = "max_results must be at least 1")
    Integer maxResults,

    @JsonProperty("use_memory")
    Boolean useMemory
) {
    public QueryRequest(final String query) {
        this(query, null, null);
    }
}
