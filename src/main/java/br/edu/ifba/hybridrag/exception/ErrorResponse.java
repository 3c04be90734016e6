package br.edu.ifba.hybridrag.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * RFC 7807 problem body returned by every exception mapper.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String type,
    String title,
    int status,
    String detail,
    String instance,
    Boolean retryable
) {

    public ErrorResponse(String type, String title, int status, String detail, String instance) {
        this(type, title, status, detail, instance, null);
    }
}
