package br.edu.ifba.hybridrag.exception;

/**
 * The referenced document chunk does not exist in the corpus.
 */
public class ChunkNotFoundException extends RuntimeException {

    private final long chunkId;

    public ChunkNotFoundException(long chunkId) {
        super("Chunk " + chunkId + " not found");
        this.chunkId = chunkId;
    }

    public long getChunkId() {
        return chunkId;
    }
}
