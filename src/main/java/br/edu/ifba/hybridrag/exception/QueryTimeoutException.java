package br.edu.ifba.hybridrag.exception;

import java.time.Duration;

/**
 * A query exceeded its overall deadline. Outstanding sub-calls were cancelled and no
 * partial answer is returned.
 */
public class QueryTimeoutException extends RuntimeException {

    private final Duration deadline;

    public QueryTimeoutException(Duration deadline, Throwable cause) {
        super("Query exceeded its deadline of " + deadline.toMillis() + " ms", cause);
        this.deadline = deadline;
    }

    public Duration getDeadline() {
        return deadline;
    }
}
