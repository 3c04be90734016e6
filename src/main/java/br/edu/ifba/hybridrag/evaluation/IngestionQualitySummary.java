package br.edu.ifba.hybridrag.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Corpus quality overview: chunk-quality judgments plus corpus size.
 */
public record IngestionQualitySummary(
    @JsonProperty("chunk_quality") QualityCounts chunkQuality,
    @JsonProperty("overall") Overall overall
) {

    public record Overall(
        @JsonProperty("unique_documents") long uniqueDocuments,
        @JsonProperty("total_chunks") long totalChunks
    ) {
    }
}
