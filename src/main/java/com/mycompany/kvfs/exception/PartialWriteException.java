package com.mycompany.kvfs.exception;

import com.mycompany.kvfs.enums.ErrorCode;
import com.mycompany.kvfs.enums.WritePhase;
import lombok.Getter;

/**
 * A range write stopped part way. Chunks already stored stay in place: with phase
 * {@link WritePhase#METADATA} every chunk is ahead of the metadata record, with
 * {@link WritePhase#CHUNKS} the first {@code chunksWritten} chunks of the range are.
 */
@Getter
public class PartialWriteException extends KvfsException {

    private final String path;
    private final WritePhase phase;
    private final long failedChunkIndex;
    private final int chunksWritten;

    public PartialWriteException(ErrorCode errorCode, String path, WritePhase phase, long failedChunkIndex,
                                 int chunksWritten, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.path = path;
        this.phase = phase;
        this.failedChunkIndex = failedChunkIndex;
        this.chunksWritten = chunksWritten;
    }

    public static PartialWriteException chunkFailed(String path, long chunkIndex, int chunksWritten, KvfsException cause) {
        return new PartialWriteException(cause.getErrorCode(), path, WritePhase.CHUNKS, chunkIndex, chunksWritten,
                "Failed to write chunk " + chunkIndex + " of " + path + ": " + cause.getMessage(), cause);
    }

    public static PartialWriteException metadataFailed(String path, int chunksWritten, KvfsException cause) {
        return new PartialWriteException(cause.getErrorCode(), path, WritePhase.METADATA, -1, chunksWritten,
                "Write succeeded but failed to update metadata of " + path + ": " + cause.getMessage(), cause);
    }
}
