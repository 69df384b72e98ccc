package com.mycompany.kvfs.POJO;

import lombok.Value;

/**
 * The part of one chunk a read needs: {@code length} bytes starting at {@code startInChunk},
 * copied to {@code outputOffset} of the read result.
 */
@Value
public class ChunkSlice {
    long chunkIndex;
    int startInChunk;
    int length;
    int outputOffset;
}
