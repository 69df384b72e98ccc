package com.mycompany.kvfs.POJO;

import com.mycompany.kvfs.enums.BackendType;
import com.mycompany.kvfs.enums.ChunkEncoding;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.commons.lang3.EnumUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static com.mycompany.kvfs.POJO.KvfsConfigKeys.*;

/**
 * Runtime settings. Built from a flat key/value map so the same keys work in
 * {@code kvfs.properties}, as JVM system properties and in tests.
 */
@Getter
@EqualsAndHashCode
public class KvfsConfig {
    private final BackendType backend;
    private final String rocksDbPath;
    private final String hpkvUrl;
    private final String hpkvApiKey;
    private final Charset hpkvCharset;
    private final long hpkvTimeoutMs;
    private final int maxValueSize;
    private final ChunkEncoding chunkEncoding;
    private final int listPageSize;
    private final boolean resolveEntryTypes;
    private final int deleteParallelism;
    private final Owner owner;
    private final String httpHost;
    private final int httpPort;

    public static final KvfsConfig DEFAULT_CONFIG = new KvfsConfig(Collections.emptyMap());

    public KvfsConfig(Map<String, String> map) {
        this.backend = parseEnum(BackendType.class, BACKEND_KEY, map.getOrDefault(BACKEND_KEY, DEFAULT_BACKEND));
        this.rocksDbPath = map.getOrDefault(ROCKSDB_PATH_KEY, DEFAULT_ROCKSDB_PATH);
        this.hpkvUrl = map.getOrDefault(HPKV_URL_KEY, DEFAULT_HPKV_URL);
        this.hpkvApiKey = map.getOrDefault(HPKV_API_KEY_KEY, DEFAULT_HPKV_API_KEY);
        this.hpkvCharset = Charset.forName(map.getOrDefault(HPKV_CHARSET_KEY, DEFAULT_HPKV_CHARSET));
        this.hpkvTimeoutMs = parsePositive(HPKV_TIMEOUT_MS_KEY, map.getOrDefault(HPKV_TIMEOUT_MS_KEY, DEFAULT_HPKV_TIMEOUT_MS));
        this.maxValueSize = (int) parsePositive(MAX_VALUE_SIZE_KEY, map.getOrDefault(MAX_VALUE_SIZE_KEY, DEFAULT_MAX_VALUE_SIZE));
        this.chunkEncoding = parseEnum(ChunkEncoding.class, CHUNK_ENCODING_KEY, map.getOrDefault(CHUNK_ENCODING_KEY, DEFAULT_CHUNK_ENCODING));
        this.listPageSize = (int) parsePositive(LIST_PAGE_SIZE_KEY, map.getOrDefault(LIST_PAGE_SIZE_KEY, DEFAULT_LIST_PAGE_SIZE));
        this.resolveEntryTypes = Boolean.parseBoolean(map.getOrDefault(LIST_RESOLVE_TYPES_KEY, DEFAULT_LIST_RESOLVE_TYPES));
        this.deleteParallelism = (int) parsePositive(DELETE_PARALLELISM_KEY, map.getOrDefault(DELETE_PARALLELISM_KEY, DEFAULT_DELETE_PARALLELISM));
        this.owner = new Owner(
                Integer.parseInt(map.getOrDefault(OWNER_UID_KEY, DEFAULT_OWNER_UID).trim()),
                Integer.parseInt(map.getOrDefault(OWNER_GID_KEY, DEFAULT_OWNER_GID).trim()));
        this.httpHost = map.getOrDefault(HTTP_HOST_KEY, DEFAULT_HTTP_HOST);
        this.httpPort = Integer.parseInt(map.getOrDefault(HTTP_PORT_KEY, DEFAULT_HTTP_PORT).trim());
    }

    /**
     * Classpath {@code kvfs.properties} first, JVM system properties win.
     */
    public static KvfsConfig load() {
        return load(System.getProperties());
    }

    static KvfsConfig load(Properties overrides) {
        Map<String, String> map = new HashMap<>();
        try (InputStream in = KvfsConfig.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (in != null) {
                Properties properties = new Properties();
                properties.load(in);
                properties.stringPropertyNames().forEach(name -> map.put(name, properties.getProperty(name)));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + CONFIG_RESOURCE, e);
        }
        for (String key : ALL_KEYS) {
            String value = overrides.getProperty(key);
            if (value != null) {
                map.put(key, value);
            }
        }
        return new KvfsConfig(map);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        E parsed = EnumUtils.getEnumIgnoreCase(type, StringUtils.trimToEmpty(value));
        if (parsed == null) {
            throw new IllegalArgumentException("Unsupported value for " + key + ": " + value);
        }
        return parsed;
    }

    private static long parsePositive(String key, String value) {
        long parsed = Long.parseLong(StringUtils.trimToEmpty(value));
        if (parsed <= 0) {
            throw new IllegalArgumentException(key + " must be positive, got " + value);
        }
        return parsed;
    }

    @Override
    public String toString() {
        return "backend:" + backend
                + " maxValueSize:" + maxValueSize
                + " chunkEncoding:" + chunkEncoding
                + " listPageSize:" + listPageSize
                + " resolveEntryTypes:" + resolveEntryTypes
                + " deleteParallelism:" + deleteParallelism
                + " owner:" + owner.getUid() + "/" + owner.getGid()
                + " http:" + httpHost + ":" + httpPort;
    }
}
