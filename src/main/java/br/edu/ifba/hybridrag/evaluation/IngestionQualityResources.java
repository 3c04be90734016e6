package br.edu.ifba.hybridrag.evaluation;

import br.edu.ifba.hybridrag.utils.AsyncUtil;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

@Path("/api/ingestion/quality")
public class IngestionQualityResources {

    private static final Logger LOG = Logger.getLogger(IngestionQualityResources.class);

    @Inject
    EvaluationService evaluationService;

    @GET
    @Path("/summary")
    @Produces(MediaType.APPLICATION_JSON)
    public IngestionQualitySummary summary() {
        return AsyncUtil.await(evaluationService.qualitySummary());
    }

    @POST
    @Path("/chunks/{chunkId}")
    @Produces(MediaType.APPLICATION_JSON)
    public ChunkEvaluation evaluateChunk(@PathParam("chunkId") final long chunkId) {
        final ChunkEvaluation evaluation = AsyncUtil.await(evaluationService.evaluateChunk(chunkId));
        LOG.infof("Chunk %d evaluated: score=%d (%s)", chunkId, evaluation.score(), evaluation.explanation());
        return evaluation;
    }
}
