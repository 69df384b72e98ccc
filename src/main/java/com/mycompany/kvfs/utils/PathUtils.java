package com.mycompany.kvfs.utils;

import com.mycompany.kvfs.exception.KvfsException;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayDeque;
import java.util.Deque;

import static com.mycompany.kvfs.constant.GlobalConstant.PATH_SEPARATOR;
import static com.mycompany.kvfs.constant.GlobalConstant.ROOT_PATH;

/**
 * Path handling for store keys. Pure string logic: store paths always use {@code /} whatever the
 * local operating system is, so {@link java.nio.file.Paths} is not used here.
 */
public final class PathUtils {

    private PathUtils() {
    }

    /**
     * Normalizes an absolute path: repeated separators and {@code .} segments are dropped,
     * {@code ..} is resolved, the trailing separator is removed (except for the root).
     *
     * @throws KvfsException INVALID_ARGUMENT for blank or relative paths, or a {@code ..} above the root
     */
    public static String normalize(String path) {
        if (StringUtils.isBlank(path)) {
            throw KvfsException.invalidArgument("Path parameter is required");
        }
        if (!path.startsWith(PATH_SEPARATOR)) {
            throw KvfsException.invalidArgument("Path must be absolute: " + path);
        }
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : StringUtils.split(path, PATH_SEPARATOR)) {
            if (".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (segments.isEmpty()) {
                    throw KvfsException.invalidArgument("Path escapes the root: " + path);
                }
                segments.removeLast();
                continue;
            }
            segments.addLast(segment);
        }
        return segments.isEmpty() ? ROOT_PATH : PATH_SEPARATOR + String.join(PATH_SEPARATOR, segments);
    }

    /**
     * Joins a directory and a relative path into one normalized absolute path.
     *
     * @param directory parent directory, null or empty means the root
     * @param name      file name or path relative to {@code directory}
     */
    public static String combine(String directory, String name) {
        if (name == null) {
            return normalize(directory);
        }
        if (StringUtils.isEmpty(directory)) {
            return normalize(PATH_SEPARATOR + name);
        }
        return normalize(directory + PATH_SEPARATOR + name);
    }

    public static boolean isRoot(String normalizedPath) {
        return ROOT_PATH.equals(normalizedPath);
    }

    /**
     * @return the parent of a normalized path, null for the root
     */
    public static String parent(String normalizedPath) {
        if (isRoot(normalizedPath)) {
            return null;
        }
        int idx = normalizedPath.lastIndexOf(PATH_SEPARATOR);
        return idx == 0 ? ROOT_PATH : normalizedPath.substring(0, idx);
    }

    /**
     * Key prefix shared by everything below a directory: {@code /} for the root, {@code path/} otherwise.
     */
    public static String directoryPrefix(String normalizedPath) {
        return isRoot(normalizedPath) ? ROOT_PATH : normalizedPath + PATH_SEPARATOR;
    }
}
