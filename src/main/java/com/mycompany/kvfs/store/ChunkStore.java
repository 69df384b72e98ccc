package com.mycompany.kvfs.store;

import com.mycompany.kvfs.enums.ChunkEncoding;
import com.mycompany.kvfs.exception.KvfsException;
import com.mycompany.kvfs.kv.KvClient;
import com.mycompany.kvfs.utils.KeyCodec;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.mycompany.kvfs.constant.GlobalConstant.MAX_CHUNK_SIZE;

/**
 * Chunk values of a file, at most {@code MAX_CHUNK_SIZE} bytes each, stored under
 * {@code path.chunkN}.
 */
@Slf4j
public class ChunkStore {

    private final KvClient kvClient;
    private final ChunkEncoding encoding;
    private final PrefixScanner scanner;

    public ChunkStore(KvClient kvClient, ChunkEncoding encoding) {
        int encodedMax = encoding.encodedLength(MAX_CHUNK_SIZE);
        if (encodedMax > kvClient.maxValueSize()) {
            throw new IllegalArgumentException("Chunk encoding " + encoding + " needs values of " + encodedMax
                    + " bytes, store limit is " + kvClient.maxValueSize());
        }
        this.kvClient = kvClient;
        this.encoding = encoding;
        this.scanner = new PrefixScanner(kvClient);
    }

    /**
     * @return the chunk bytes, empty for a sparse chunk
     */
    public Optional<byte[]> get(String path, long index) {
        String key = KeyCodec.chunkKey(path, index);
        Optional<byte[]> value = kvClient.get(key);
        if (!value.isPresent()) {
            log.debug("Chunk {} is absent", key);
            return Optional.empty();
        }
        byte[] chunk = encoding.decode(value.get());
        if (chunk.length > MAX_CHUNK_SIZE) {
            throw KvfsException.storeError("Chunk " + key + " holds " + chunk.length
                    + " bytes, more than " + MAX_CHUNK_SIZE, null);
        }
        return Optional.of(chunk);
    }

    public void put(String path, long index, byte[] chunk) {
        if (chunk.length > MAX_CHUNK_SIZE) {
            throw KvfsException.invalidArgument("Chunk " + index + " of " + path + " is " + chunk.length
                    + " bytes, limit is " + MAX_CHUNK_SIZE);
        }
        String key = KeyCodec.chunkKey(path, index);
        kvClient.put(key, encoding.encode(chunk));
        log.debug("Chunk saved: {} ({} bytes)", key, chunk.length);
    }

    public void delete(String path, long index) {
        deleteKey(KeyCodec.chunkKey(path, index));
    }

    public void deleteKey(String chunkKey) {
        kvClient.delete(chunkKey);
    }

    /**
     * Every stored chunk key of {@code path}; keys of other paths sharing the prefix are skipped.
     */
    public List<String> listChunkKeys(String path) {
        return scanner.scanAll(KeyCodec.chunkKeyPrefix(path)).stream()
                .filter(key -> KeyCodec.isChunkKeyOf(path, key))
                .collect(Collectors.toList());
    }
}
