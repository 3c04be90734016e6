package br.edu.ifba.hybridrag.core;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Maps a citation index used in an answer to the chunk it refers to.
 */
public record CitationMapping(
    @JsonProperty("citation") int citation,
    @JsonProperty("chunk_id") long chunkId
) {
}
