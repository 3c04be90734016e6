package br.edu.ifba.hybridrag.exception;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class FavoriteToggleExceptionMapper implements ExceptionMapper<FavoriteToggleException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final FavoriteToggleException exception) {
        final ErrorResponse error = new ErrorResponse(
            "about:blank",
            "Favorite Toggle Failed",
            exception.getStatus(),
            exception.getMessage(),
            uriInfo.getPath(),
            Boolean.valueOf(exception.getStatus() == Response.Status.CONFLICT.getStatusCode())
        );

        return Response.status(exception.getStatus())
                .entity(error)
                .type("application/problem+json")
                .build();
    }
}
