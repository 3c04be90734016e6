package br.edu.ifba.hybridrag.exception;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import org.jboss.logging.Logger;

@Provider
public class UpstreamUnavailableExceptionMapper implements ExceptionMapper<UpstreamUnavailableException> {

    private static final Logger LOG = Logger.getLogger(UpstreamUnavailableExceptionMapper.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final UpstreamUnavailableException exception) {
        LOG.warnf("Query failed, %s unavailable: %s", exception.getUpstream(), exception.getMessage());

        final ErrorResponse error = new ErrorResponse(
            "about:blank",
            "Upstream Unavailable",
            Response.Status.SERVICE_UNAVAILABLE.getStatusCode(),
            exception.getMessage(),
            uriInfo.getPath(),
            Boolean.valueOf(exception.isRetryable())
        );

        return Response.status(Response.Status.SERVICE_UNAVAILABLE.getStatusCode())
                .entity(error)
                .type("application/problem+json")
                .build();
    }
}
