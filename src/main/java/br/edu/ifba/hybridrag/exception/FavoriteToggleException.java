package br.edu.ifba.hybridrag.exception;

/**
 * Toggling the favorite flag failed. Reported separately from feedback failures since
 * the two are independent user actions.
 */
public class FavoriteToggleException extends RuntimeException {

    private final long memoryId;
    private final int status;

    public FavoriteToggleException(long memoryId, int status, Throwable cause) {
        super("Could not update favorite for memory entry " + memoryId + ": " + cause.getMessage(), cause);
        this.memoryId = memoryId;
        this.status = status;
    }

    public long getMemoryId() {
        return memoryId;
    }

    public int getStatus() {
        return status;
    }
}
