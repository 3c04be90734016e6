package br.edu.ifba.hybridrag.query;

import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

@Path("/api/query")
public class QueryResources {

    private static final Logger LOG = Logger.getLogger(QueryResources.class);

    @Inject
    QueryService queryService;

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public QueryResponse query(@Valid @NotNull final QueryRequest request) {
        LOG.debugf("Query received (max_results=%s, use_memory=%s)", request.maxResults(), request.useMemory());
        final QueryResult result = queryService.query(request.query(), request.maxResults(), request.useMemory());
        return QueryResponse.from(result);
    }
}
