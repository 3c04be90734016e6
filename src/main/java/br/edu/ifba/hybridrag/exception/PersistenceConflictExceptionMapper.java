package br.edu.ifba.hybridrag.exception;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class PersistenceConflictExceptionMapper implements ExceptionMapper<PersistenceConflictException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final PersistenceConflictException exception) {
        final ErrorResponse error = new ErrorResponse(
            "about:blank",
            "Persistence Conflict",
            Response.Status.CONFLICT.getStatusCode(),
            exception.getMessage(),
            uriInfo.getPath(),
            Boolean.TRUE
        );

        return Response.status(Response.Status.CONFLICT.getStatusCode())
                .entity(error)
                .type("application/problem+json")
                .build();
    }
}
