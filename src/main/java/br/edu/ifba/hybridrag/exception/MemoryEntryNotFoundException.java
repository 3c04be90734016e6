package br.edu.ifba.hybridrag.exception;

/**
 * The referenced query memory entry, or its feedback record, does not exist.
 */
public class MemoryEntryNotFoundException extends RuntimeException {

    private final long memoryId;

    public MemoryEntryNotFoundException(long memoryId, String message) {
        super(message);
        this.memoryId = memoryId;
    }

    public long getMemoryId() {
        return memoryId;
    }
}
