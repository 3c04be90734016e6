package br.edu.ifba.hybridrag.exception;

/**
 * A read-modify-write could not be applied because the row kept changing underneath it.
 */
public class PersistenceConflictException extends RuntimeException {

    private final long memoryId;
    private final int attempts;

    public PersistenceConflictException(long memoryId, int attempts) {
        super(String.format("Feedback for memory entry %d changed concurrently; gave up after %d attempts",
            memoryId, attempts));
        this.memoryId = memoryId;
        this.attempts = attempts;
    }

    public long getMemoryId() {
        return memoryId;
    }

    public int getAttempts() {
        return attempts;
    }
}
