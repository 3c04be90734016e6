package br.edu.ifba.hybridrag.exception;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class InvalidFeedbackExceptionMapper implements ExceptionMapper<InvalidFeedbackException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final InvalidFeedbackException exception) {
        final ErrorResponse error = new ErrorResponse(
            "about:blank",
            "Bad Request",
            Response.Status.BAD_REQUEST.getStatusCode(),
            exception.getMessage(),
            uriInfo.getPath(),
            null
        );

        return Response.status(Response.Status.BAD_REQUEST.getStatusCode())
                .entity(error)
                .type("application/problem+json")
                .build();
    }
}
