package br.edu.ifba.hybridrag.exception;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class QueryTimeoutExceptionMapper implements ExceptionMapper<QueryTimeoutException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final QueryTimeoutException exception) {
        final ErrorResponse error = new ErrorResponse(
            "about:blank",
            "Query Timeout",
            Response.Status.GATEWAY_TIMEOUT.getStatusCode(),
            exception.getMessage(),
            uriInfo.getPath(),
            Boolean.TRUE
        );

        return Response.status(Response.Status.GATEWAY_TIMEOUT.getStatusCode())
                .entity(error)
                .type("application/problem+json")
                .build();
    }
}
