package com.mycompany.kvfs.kv;

import java.util.Optional;

/**
 * Flat key-value store the filesystem is laid out on. Keys are strings, values are bounded
 * byte arrays. Every method reports store failures as a
 * {@link com.mycompany.kvfs.exception.KvfsException} with code {@code STORE_ERROR}
 * (or {@code UNAUTHORIZED} when the store rejects the credentials).
 */
public interface KvClient extends AutoCloseable {

    /**
     * @return the value, or empty when the key does not exist
     */
    Optional<byte[]> get(String key);

    /**
     * Upsert. Values longer than {@link #maxValueSize()} are rejected.
     */
    void put(String key, byte[] value);

    /**
     * Deleting a missing key succeeds.
     */
    void delete(String key);

    /**
     * Keys starting with {@code prefix} in ascending order, strictly after {@code marker} when
     * one is given. With a delimiter, keys that contain it past the prefix are rolled up into a
     * single {@code prefix + segment + delimiter} entry.
     *
     * @param delimiter nullable
     * @param marker    nullable, the {@code nextMarker} of the previous page
     */
    ListPage list(String prefix, String delimiter, String marker);

    int maxValueSize();

    @Override
    default void close() {
    }
}
