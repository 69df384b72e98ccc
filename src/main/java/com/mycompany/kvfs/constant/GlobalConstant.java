package com.mycompany.kvfs.constant;

public class GlobalConstant {
    // /dir/file.txt -> /dir/file.txt.__meta__
    public static final String METADATA_SUFFIX = ".__meta__";

    // /dir/file.txt -> /dir/file.txt.chunk0, /dir/file.txt.chunk1 ...
    public static final String CHUNK_SUFFIX = ".chunk";

    public static final String ROOT_PATH = "/";

    public static final String PATH_SEPARATOR = "/";

    public static final String ROOT_METADATA_KEY = ROOT_PATH + METADATA_SUFFIX;

    // HPKV rejects values above 3072 bytes, keep some headroom.
    // Changing this breaks every file already written to a shared store.
    public static final int MAX_CHUNK_SIZE = 3000;

    public static final int DEFAULT_MAX_VALUE_SIZE = 3072;

    // 040755
    public static final int DEFAULT_DIR_MODE = 0040755;

    // 0100644
    public static final int DEFAULT_FILE_MODE = 0100644;

    public static final int DEFAULT_UID = 1000;

    public static final int DEFAULT_GID = 1000;

    private GlobalConstant() {
    }
}
