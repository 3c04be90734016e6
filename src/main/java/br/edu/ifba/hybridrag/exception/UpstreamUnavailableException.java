package br.edu.ifba.hybridrag.exception;

/**
 * An embedding, LLM or graph-store call failed or timed out and the failure could not be
 * degraded locally. Mapped to HTTP 503.
 */
public class UpstreamUnavailableException extends RuntimeException {

    private final String upstream;
    private final boolean retryable;

    public UpstreamUnavailableException(String upstream, String message, Throwable cause) {
        this(upstream, message, true, cause);
    }

    public UpstreamUnavailableException(String upstream, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.upstream = upstream;
        this.retryable = retryable;
    }

    public String getUpstream() {
        return upstream;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
