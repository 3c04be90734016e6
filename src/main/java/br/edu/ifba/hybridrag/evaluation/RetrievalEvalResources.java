package br.edu.ifba.hybridrag.evaluation;

import br.edu.ifba.hybridrag.utils.AsyncUtil;
import jakarta.inject.Inject;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

@Path("/api/retrieval/eval")
public class RetrievalEvalResources {

    @Inject
    EvaluationService evaluationService;

    @GET
    @Path("/summary")
    @Produces(MediaType.APPLICATION_JSON)
    public RetrievalEvalSummary summary() {
        return AsyncUtil.await(evaluationService.summary());
    }

    @GET
    @Path("/query/{queryId}")
    @Produces(MediaType.APPLICATION_JSON)
    public QueryJudgments queryJudgments(@PathParam("queryId") final long queryId) {
        return AsyncUtil.await(evaluationService.queryJudgments(queryId));
    }

    @POST
    @Path("/backfill")
    @Produces(MediaType.APPLICATION_JSON)
    public BackfillResult backfill(
            @QueryParam("limit") @DefaultValue("50") @Min(1) @Max(1000) final int limit,
            @QueryParam("max_results") @DefaultValue("10") @Min(1) @Max(50) final int maxResults,
            @QueryParam("use_llm") @DefaultValue("false") final boolean useLlm) {
        return AsyncUtil.await(evaluationService.backfill(limit, maxResults, useLlm));
    }
}
