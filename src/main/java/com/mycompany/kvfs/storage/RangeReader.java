package com.mycompany.kvfs.storage;

import com.mycompany.kvfs.POJO.ChunkSlice;
import com.mycompany.kvfs.POJO.Metadata;
import com.mycompany.kvfs.POJO.ReadPlan;
import com.mycompany.kvfs.exception.KvfsException;
import com.mycompany.kvfs.store.ChunkStore;
import com.mycompany.kvfs.store.MetadataStore;
import com.mycompany.kvfs.utils.KeyCodec;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.mycompany.kvfs.constant.GlobalConstant.MAX_CHUNK_SIZE;

/**
 * Reads a byte range of a file. Missing chunks and bytes a short chunk does not hold read as zero.
 */
@Slf4j
public class RangeReader {

    private final MetadataStore metadataStore;
    private final ChunkStore chunkStore;

    public RangeReader(MetadataStore metadataStore, ChunkStore chunkStore) {
        this.metadataStore = metadataStore;
        this.chunkStore = chunkStore;
    }

    public byte[] read(String rawPath, long offset, long size) {
        ReadPlan plan = plan(rawPath, offset, size);
        byte[] out = new byte[plan.getLength()];
        for (ChunkSlice slice : plan.getSlices()) {
            copySlice(plan.getPath(), slice, out, slice.getOutputOffset());
        }
        log.debug("Read {} bytes of {} at offset {}", out.length, plan.getPath(), offset);
        return out;
    }

    /**
     * Clips {@code [offset, offset + size)} to the file size and splits it per chunk.
     *
     * @throws KvfsException NOT_FOUND, IS_A_DIRECTORY or INVALID_ARGUMENT
     */
    public ReadPlan plan(String rawPath, long offset, long size) {
        String path = KeyCodec.requireValidPath(rawPath);
        if (offset < 0) {
            throw KvfsException.invalidArgument("Offset must not be negative: " + offset);
        }
        if (size < 0) {
            throw KvfsException.invalidArgument("Size must not be negative: " + size);
        }
        Metadata metadata = metadataStore.get(path).orElseThrow(() -> KvfsException.notFound(path));
        if (metadata.isDirectory()) {
            throw KvfsException.isADirectory(path);
        }
        long fileSize = metadata.getSize();
        if (offset >= fileSize || size == 0) {
            return ReadPlan.empty(path, offset);
        }
        long readSize = Math.min(size, fileSize - offset);
        if (readSize > Integer.MAX_VALUE - 8) {
            throw KvfsException.invalidArgument("Read of " + readSize + " bytes from " + path + " is too large");
        }

        long readEnd = offset + readSize;
        List<ChunkSlice> slices = new ArrayList<>();
        for (long index = offset / MAX_CHUNK_SIZE; index <= (readEnd - 1) / MAX_CHUNK_SIZE; index++) {
            long chunkStart = index * MAX_CHUNK_SIZE;
            long sliceStart = Math.max(offset, chunkStart);
            long sliceEnd = Math.min(readEnd, chunkStart + MAX_CHUNK_SIZE);
            slices.add(new ChunkSlice(index, (int) (sliceStart - chunkStart), (int) (sliceEnd - sliceStart),
                    (int) (sliceStart - offset)));
        }
        return new ReadPlan(path, offset, (int) readSize, slices);
    }

    /**
     * Fetches one planned slice on its own, zero filled where the chunk holds nothing.
     */
    public byte[] readSlice(String path, ChunkSlice slice) {
        byte[] out = new byte[slice.getLength()];
        copySlice(path, slice, out, 0);
        return out;
    }

    private void copySlice(String path, ChunkSlice slice, byte[] out, int outOffset) {
        Optional<byte[]> chunk = chunkStore.get(path, slice.getChunkIndex());
        if (!chunk.isPresent()) {
            return;
        }
        byte[] bytes = chunk.get();
        int available = Math.min(slice.getLength(), bytes.length - slice.getStartInChunk());
        if (available > 0) {
            System.arraycopy(bytes, slice.getStartInChunk(), out, outOffset, available);
        }
    }
}
