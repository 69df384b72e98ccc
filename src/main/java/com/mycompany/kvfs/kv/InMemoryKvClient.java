package com.mycompany.kvfs.kv;

import com.mycompany.kvfs.exception.KvfsException;

import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

import static com.mycompany.kvfs.constant.GlobalConstant.DEFAULT_MAX_VALUE_SIZE;

/**
 * Process-local store on a sorted concurrent map. Values are copied on the way in and out so
 * callers can never alias stored bytes.
 */
public class InMemoryKvClient implements KvClient {

    public static final int DEFAULT_PAGE_SIZE = 1000;

    private final ConcurrentSkipListMap<String, byte[]> records = new ConcurrentSkipListMap<>();

    private final int pageSize;
    private final int maxValueSize;

    public InMemoryKvClient() {
        this(DEFAULT_PAGE_SIZE, DEFAULT_MAX_VALUE_SIZE);
    }

    public InMemoryKvClient(int pageSize, int maxValueSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        this.pageSize = pageSize;
        this.maxValueSize = maxValueSize;
    }

    @Override
    public Optional<byte[]> get(String key) {
        byte[] value = records.get(key);
        return value == null ? Optional.empty() : Optional.of(Arrays.copyOf(value, value.length));
    }

    @Override
    public void put(String key, byte[] value) {
        if (value.length > maxValueSize) {
            throw KvfsException.storeError("Value of " + key + " is " + value.length
                    + " bytes, store limit is " + maxValueSize, null);
        }
        records.put(key, Arrays.copyOf(value, value.length));
    }

    @Override
    public void delete(String key) {
        records.remove(key);
    }

    @Override
    public ListPage list(String prefix, String delimiter, String marker) {
        String start = marker != null && marker.compareTo(prefix) > 0 ? marker : prefix;
        return ListPage.paginate(records.tailMap(start, true).keySet().iterator(), prefix, delimiter, marker, pageSize);
    }

    @Override
    public int maxValueSize() {
        return maxValueSize;
    }

    public int size() {
        return records.size();
    }

    public boolean containsKey(String key) {
        return records.containsKey(key);
    }
}
