package com.mycompany.kvfs.enums;

/**
 * Step of a range write that failed. Chunks are always stored before the metadata record.
 */
public enum WritePhase {
    CHUNKS,
    METADATA
}
