package com.mycompany.kvfs.POJO;

public class KvfsConfigKeys {
    public static final String CONFIG_RESOURCE = "kvfs.properties";

    public static final String BACKEND_KEY = "kvfs.backend";
    public static final String ROCKSDB_PATH_KEY = "kvfs.rocksdb.path";
    public static final String HPKV_URL_KEY = "kvfs.hpkv.url";
    public static final String HPKV_API_KEY_KEY = "kvfs.hpkv.api-key";
    public static final String HPKV_CHARSET_KEY = "kvfs.hpkv.charset";
    public static final String HPKV_TIMEOUT_MS_KEY = "kvfs.hpkv.timeout-ms";
    public static final String MAX_VALUE_SIZE_KEY = "kvfs.max-value-size";
    public static final String CHUNK_ENCODING_KEY = "kvfs.chunk.encoding";
    public static final String LIST_PAGE_SIZE_KEY = "kvfs.list.page-size";
    public static final String LIST_RESOLVE_TYPES_KEY = "kvfs.list.resolve-types";
    public static final String DELETE_PARALLELISM_KEY = "kvfs.delete.parallelism";
    public static final String OWNER_UID_KEY = "kvfs.owner.uid";
    public static final String OWNER_GID_KEY = "kvfs.owner.gid";
    public static final String HTTP_HOST_KEY = "kvfs.http.host";
    public static final String HTTP_PORT_KEY = "kvfs.http.port";

    public static final String DEFAULT_BACKEND = "memory";
    public static final String DEFAULT_ROCKSDB_PATH = "kvfs-data";
    public static final String DEFAULT_HPKV_URL = "";
    public static final String DEFAULT_HPKV_API_KEY = "";
    public static final String DEFAULT_HPKV_CHARSET = "ISO-8859-1";
    public static final String DEFAULT_HPKV_TIMEOUT_MS = "10000";
    public static final String DEFAULT_MAX_VALUE_SIZE = "3072";
    public static final String DEFAULT_CHUNK_ENCODING = "RAW";
    public static final String DEFAULT_LIST_PAGE_SIZE = "1000";
    public static final String DEFAULT_LIST_RESOLVE_TYPES = "true";
    public static final String DEFAULT_DELETE_PARALLELISM = "8";
    public static final String DEFAULT_OWNER_UID = "1000";
    public static final String DEFAULT_OWNER_GID = "1000";
    public static final String DEFAULT_HTTP_HOST = "0.0.0.0";
    public static final String DEFAULT_HTTP_PORT = "8080";

    public static final String[] ALL_KEYS = {
            BACKEND_KEY, ROCKSDB_PATH_KEY, HPKV_URL_KEY, HPKV_API_KEY_KEY, HPKV_CHARSET_KEY,
            HPKV_TIMEOUT_MS_KEY, MAX_VALUE_SIZE_KEY, CHUNK_ENCODING_KEY, LIST_PAGE_SIZE_KEY,
            LIST_RESOLVE_TYPES_KEY, DELETE_PARALLELISM_KEY, OWNER_UID_KEY, OWNER_GID_KEY,
            HTTP_HOST_KEY, HTTP_PORT_KEY
    };

    private KvfsConfigKeys() {
    }
}
