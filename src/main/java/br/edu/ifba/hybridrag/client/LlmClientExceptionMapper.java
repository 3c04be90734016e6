package br.edu.ifba.hybridrag.client;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;
import org.jboss.logging.Logger;

/**
 * Turns error responses of the LLM and embedding providers into exceptions that carry
 * the provider's response body, which is otherwise lost.
 */
public class LlmClientExceptionMapper implements ResponseExceptionMapper<RuntimeException> {

    private static final Logger LOG = Logger.getLogger(LlmClientExceptionMapper.class);

    @Override
    public RuntimeException toThrowable(Response response) {
        if (response.getStatus() < 400) {
            return null;
        }

        String responseBody = null;
        try {
            if (response.hasEntity()) {
                responseBody = response.readEntity(String.class);
            }
        } catch (Exception e) {
            LOG.warn("Failed to read provider error response body", e);
        }

        int status = response.getStatus();
        String reason = response.getStatusInfo().getReasonPhrase();
        LOG.errorf("Provider returned %d %s: %s", status, reason,
            responseBody != null && !responseBody.isEmpty() ? responseBody : "(empty body)");

        return new WebApplicationException(
            String.format("Provider returned %d %s%s", status, reason,
                responseBody != null ? " - " + responseBody : ""),
            response);
    }

    @Override
    public int getPriority() {
        return 4000;
    }
}
