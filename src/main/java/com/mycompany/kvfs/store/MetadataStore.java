package com.mycompany.kvfs.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mycompany.kvfs.POJO.Metadata;
import com.mycompany.kvfs.exception.KvfsException;
import com.mycompany.kvfs.kv.KvClient;
import com.mycompany.kvfs.utils.KeyCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

import static com.mycompany.kvfs.constant.GlobalConstant.DEFAULT_GID;
import static com.mycompany.kvfs.constant.GlobalConstant.DEFAULT_UID;

/**
 * Reads and writes the JSON metadata record of a path.
 */
public class MetadataStore {
    private static final Logger logger = LoggerFactory.getLogger(MetadataStore.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final KvClient kvClient;

    public MetadataStore(KvClient kvClient) {
        this.kvClient = kvClient;
    }

    /**
     * @return the record with {@code numChunks} always set, or empty when the path has none
     * @throws KvfsException CORRUPT_METADATA when the stored value is not a metadata object
     */
    public Optional<Metadata> get(String path) {
        String key = KeyCodec.metadataKey(path);
        Optional<byte[]> value = kvClient.get(key);
        if (!value.isPresent()) {
            return Optional.empty();
        }
        Metadata metadata = parse(key, value.get());
        normalizeChunkCount(key, metadata);
        return Optional.of(metadata);
    }

    public boolean exists(String path) {
        return kvClient.get(KeyCodec.metadataKey(path)).isPresent();
    }

    /**
     * Unconditional overwrite.
     */
    public void put(String path, Metadata metadata) {
        String key = KeyCodec.metadataKey(path);
        byte[] value;
        try {
            value = objectMapper.writeValueAsBytes(metadata);
        } catch (JsonProcessingException e) {
            throw KvfsException.storeError("Failed to serialize metadata of " + path, e);
        }
        kvClient.put(key, value);
        logger.debug("Metadata saved: {} size={} numChunks={}", key, metadata.getSize(), metadata.getNumChunks());
    }

    public void delete(String path) {
        kvClient.delete(KeyCodec.metadataKey(path));
    }

    static Metadata parse(String key, byte[] value) {
        if (value.length == 0) {
            throw KvfsException.corruptMetadata(key, null);
        }
        try {
            JsonNode tree = objectMapper.readTree(value);
            if (tree == null || !tree.isObject()) {
                throw KvfsException.corruptMetadata(key, null);
            }
            Metadata metadata = objectMapper.treeToValue(tree, Metadata.class);
            // records written without an owner belong to the default user, not root
            if (!tree.hasNonNull("uid")) {
                metadata.setUid(DEFAULT_UID);
            }
            if (!tree.hasNonNull("gid")) {
                metadata.setGid(DEFAULT_GID);
            }
            return metadata;
        } catch (IOException e) {
            throw KvfsException.corruptMetadata(key, e);
        }
    }

    // older records have no num_chunks, and size is the source of truth when both disagree
    private static void normalizeChunkCount(String key, Metadata metadata) {
        long expected = Metadata.chunkCountFor(metadata.getSize());
        Long stored = metadata.getNumChunks();
        if (stored != null && !Objects.equals(stored, expected) && metadata.getSize() > 0) {
            logger.warn("Metadata {} has num_chunks={} but size={} needs {}", key, stored, metadata.getSize(), expected);
        }
        metadata.setNumChunks(expected);
    }
}
