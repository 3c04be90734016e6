package br.edu.ifba.hybridrag.query;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import br.edu.ifba.hybridrag.core.CommunitySummary;
import br.edu.ifba.hybridrag.core.GraphEntity;
import br.edu.ifba.hybridrag.core.RetrievedChunk;

public record QueryResponse(
    @JsonProperty("query") String query,
    @JsonProperty("answer") String answer,
    @JsonProperty("memory_id") long memoryId,
    @JsonProperty("from_memory") boolean fromMemory,
    @JsonProperty("low_confidence") boolean lowConfidence,
    @JsonProperty("chunks") List<ChunkView> chunks,
    @JsonProperty("entities") List<GraphEntity> entities,
    @JsonProperty("communities") List<CommunitySummary> communities,
    @JsonProperty("references") List<String> references
) {

    public static QueryResponse from(final QueryResult result) {
        return new QueryResponse(
            result.query(),
            result.answer().text(),
            result.memoryId(),
            result.answer().fromMemory(),
            result.answer().lowConfidence(),
            result.context().chunks().stream().map(ChunkView::of).toList(),
            result.context().entities(),
            result.context().communities(),
            result.context().references()
        );
    }

    public record ChunkView(
        @JsonProperty("id") long id,
        @JsonProperty("text") String text,
        @JsonProperty("source") String source,
        @JsonProperty("similarity") double similarity
    ) {
        static ChunkView of(final RetrievedChunk chunk) {
            return new ChunkView(chunk.id(), chunk.text(), chunk.source(), chunk.similarity());
        }
    }
}
