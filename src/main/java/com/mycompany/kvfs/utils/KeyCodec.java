package com.mycompany.kvfs.utils;

import com.mycompany.kvfs.exception.KvfsException;

import static com.mycompany.kvfs.constant.GlobalConstant.CHUNK_SUFFIX;
import static com.mycompany.kvfs.constant.GlobalConstant.METADATA_SUFFIX;
import static com.mycompany.kvfs.constant.GlobalConstant.PATH_SEPARATOR;
import static com.mycompany.kvfs.constant.GlobalConstant.ROOT_METADATA_KEY;

/**
 * Derives store keys from normalized paths. The layout is shared with every other client of the
 * store and must not change:
 *
 * <pre>
 * /                  -> /.__meta__
 * /docs/a.txt        -> /docs/a.txt.__meta__
 * /docs/a.txt  #0    -> /docs/a.txt.chunk0
 * /docs/a.txt  #12   -> /docs/a.txt.chunk12
 * </pre>
 */
public class KeyCodec {

    private KeyCodec() {
    }

    public static String metadataKey(String path) {
        return PathUtils.isRoot(path) ? ROOT_METADATA_KEY : path + METADATA_SUFFIX;
    }

    public static String chunkKey(String path, long index) {
        if (index < 0) {
            throw new IllegalArgumentException("chunk index must not be negative: " + index);
        }
        return chunkKeyPrefix(path) + index;
    }

    public static String chunkKeyPrefix(String path) {
        return path + CHUNK_SUFFIX;
    }

    public static boolean isMetadataKey(String key) {
        return key.endsWith(METADATA_SUFFIX);
    }

    /**
     * /docs/a.txt.__meta__ -> /docs/a.txt, /.__meta__ -> /
     */
    public static String pathOfMetadataKey(String key) {
        if (!isMetadataKey(key)) {
            throw new IllegalArgumentException("Not a metadata key: " + key);
        }
        return key.substring(0, key.length() - METADATA_SUFFIX.length());
    }

    /**
     * True only for {@code path.chunkN} with N a decimal index without leading zeros.
     */
    public static boolean isChunkKeyOf(String path, String key) {
        return chunkIndexOf(path, key) >= 0;
    }

    /**
     * @return the chunk index encoded in {@code key}, or -1 when it is not a chunk key of {@code path}
     */
    public static long chunkIndexOf(String path, String key) {
        String prefix = chunkKeyPrefix(path);
        if (!key.startsWith(prefix) || key.length() == prefix.length()) {
            return -1;
        }
        String digits = key.substring(prefix.length());
        if (digits.length() > 1 && digits.charAt(0) == '0') {
            return -1;
        }
        // 18 digits always fit in a long
        if (digits.length() > 18) {
            return -1;
        }
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
        }
        return Long.parseLong(digits);
    }

    /**
     * Normalizes {@code rawPath} and rejects segments that contain a reserved key suffix, so that
     * derived keys never collide ({@code /a.chunk0.__meta__} would start with the chunk prefix of
     * {@code /a}).
     *
     * @return the normalized path
     * @throws KvfsException INVALID_ARGUMENT
     */
    public static String requireValidPath(String rawPath) {
        String path = PathUtils.normalize(rawPath);
        for (String segment : path.split(PATH_SEPARATOR)) {
            if (segment.contains(METADATA_SUFFIX) || segment.contains(CHUNK_SUFFIX)) {
                throw KvfsException.invalidArgument("Path segment '" + segment + "' contains a reserved suffix ("
                        + METADATA_SUFFIX + ", " + CHUNK_SUFFIX + "): " + rawPath);
            }
        }
        return path;
    }
}
