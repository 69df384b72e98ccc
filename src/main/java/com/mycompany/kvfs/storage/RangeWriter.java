package com.mycompany.kvfs.storage;

import com.mycompany.kvfs.POJO.Metadata;
import com.mycompany.kvfs.POJO.Owner;
import com.mycompany.kvfs.exception.KvfsException;
import com.mycompany.kvfs.exception.PartialWriteException;
import com.mycompany.kvfs.store.ChunkStore;
import com.mycompany.kvfs.store.MetadataStore;
import com.mycompany.kvfs.utils.KeyCodec;
import com.mycompany.kvfs.utils.PathUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Optional;

import static com.mycompany.kvfs.constant.GlobalConstant.MAX_CHUNK_SIZE;

/**
 * Writes a byte range into a file by read-modify-write of every chunk it touches.
 * <p>
 * Chunks are stored first, in ascending index order, and the metadata record last, so a failed
 * write never publishes a size whose bytes were not stored. Nothing is rolled back on failure.
 */
@Slf4j
public class RangeWriter {

    private final MetadataStore metadataStore;
    private final ChunkStore chunkStore;
    private final Owner owner;
    private final Clock clock;

    public RangeWriter(MetadataStore metadataStore, ChunkStore chunkStore, Owner owner, Clock clock) {
        this.metadataStore = metadataStore;
        this.chunkStore = chunkStore;
        this.owner = owner;
        this.clock = clock;
    }

    /**
     * @return the number of bytes written, always {@code data.length}
     * @throws PartialWriteException when a chunk or the metadata record could not be stored
     */
    public int write(String rawPath, long offset, byte[] data) {
        String path = KeyCodec.requireValidPath(rawPath);
        if (PathUtils.isRoot(path)) {
            throw KvfsException.isADirectory(path);
        }
        if (offset < 0) {
            throw KvfsException.invalidArgument("Offset must not be negative: " + offset);
        }
        if (data == null) {
            throw KvfsException.invalidArgument("No data to write to " + path);
        }
        if (offset > Long.MAX_VALUE - data.length) {
            throw KvfsException.invalidArgument("Write of " + data.length + " bytes at offset " + offset + " overflows");
        }

        long now = clock.instant().getEpochSecond();
        Optional<Metadata> existing = metadataStore.get(path);
        boolean created = !existing.isPresent();
        Metadata metadata;
        if (created) {
            requireDirectoryParent(path);
            metadata = Metadata.newFile(owner, now);
        } else {
            metadata = existing.get();
            if (metadata.isDirectory()) {
                throw KvfsException.isADirectory(path);
            }
        }

        if (data.length == 0) {
            if (created) {
                storeMetadata(path, metadata, 0);
            }
            return 0;
        }

        long writeEnd = offset + data.length;
        long startChunk = offset / MAX_CHUNK_SIZE;
        long endChunk = (writeEnd - 1) / MAX_CHUNK_SIZE;

        int chunksWritten = 0;
        for (long index = startChunk; index <= endChunk; index++) {
            try {
                writeChunk(path, index, offset, data);
            } catch (KvfsException e) {
                log.error("Write to {} failed at chunk {} after {} chunk(s)", path, index, chunksWritten, e);
                throw PartialWriteException.chunkFailed(path, index, chunksWritten, e);
            }
            chunksWritten++;
        }

        metadata.setSize(Math.max(metadata.getSize(), writeEnd));
        metadata.setMtime(now);
        metadata.setAtime(now);
        metadata.setNumChunks(Metadata.chunkCountFor(metadata.getSize()));
        storeMetadata(path, metadata, chunksWritten);

        log.debug("Wrote {} bytes to {} at offset {} (chunks {}..{}), size now {}",
                data.length, path, offset, startChunk, endChunk, metadata.getSize());
        return data.length;
    }

    private void writeChunk(String path, long index, long offset, byte[] data) {
        long chunkStart = index * MAX_CHUNK_SIZE;
        long writeEnd = offset + data.length;
        int windowStart = (int) Math.max(0, offset - chunkStart);
        int windowEnd = (int) Math.min(MAX_CHUNK_SIZE, writeEnd - chunkStart);

        byte[] old = chunkStore.get(path, index).orElse(new byte[0]);
        byte[] chunk = new byte[Math.max(old.length, windowEnd)];
        // bytes between the old end and windowStart stay zero
        System.arraycopy(old, 0, chunk, 0, Math.min(old.length, windowStart));
        int sourceOffset = (int) (chunkStart + windowStart - offset);
        System.arraycopy(data, sourceOffset, chunk, windowStart, windowEnd - windowStart);
        if (old.length > windowEnd) {
            System.arraycopy(old, windowEnd, chunk, windowEnd, old.length - windowEnd);
        }
        chunkStore.put(path, index, chunk);
    }

    private void storeMetadata(String path, Metadata metadata, int chunksWritten) {
        try {
            metadataStore.put(path, metadata);
        } catch (KvfsException e) {
            log.error("Chunks of {} stored but its metadata was not", path, e);
            throw PartialWriteException.metadataFailed(path, chunksWritten, e);
        }
    }

    private void requireDirectoryParent(String path) {
        String parent = PathUtils.parent(path);
        if (parent == null) {
            return;
        }
        metadataStore.get(parent).ifPresent(parentMetadata -> {
            if (!parentMetadata.isDirectory()) {
                throw KvfsException.notADirectory(parent);
            }
        });
    }
}
