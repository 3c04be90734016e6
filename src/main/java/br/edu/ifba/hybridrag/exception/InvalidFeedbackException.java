package br.edu.ifba.hybridrag.exception;

/**
 * Malformed feedback payload. Rejected before anything is persisted.
 */
public class InvalidFeedbackException extends RuntimeException {

    public InvalidFeedbackException(String message) {
        super(message);
    }
}
