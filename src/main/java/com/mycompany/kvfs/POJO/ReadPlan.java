package com.mycompany.kvfs.POJO;

import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Chunk slices covering a read range after it was clipped to the file size, in index order.
 */
@Value
public class ReadPlan {
    String path;
    long offset;
    int length;
    List<ChunkSlice> slices;

    public static ReadPlan empty(String path, long offset) {
        return new ReadPlan(path, offset, 0, Collections.emptyList());
    }

    public boolean isEmpty() {
        return length == 0;
    }
}
