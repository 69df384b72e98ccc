package com.mycompany.kvfs.exception;

import com.mycompany.kvfs.enums.ErrorCode;
import lombok.Getter;

/**
 * Failure of a filesystem or store operation. The {@link ErrorCode} decides how callers (and the
 * HTTP adapter) report it; the message names the path or key involved.
 */
@Getter
public class KvfsException extends RuntimeException {

    private final ErrorCode errorCode;

    public KvfsException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public KvfsException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public static KvfsException invalidArgument(String message) {
        return new KvfsException(ErrorCode.INVALID_ARGUMENT, message);
    }

    public static KvfsException notFound(String path) {
        return new KvfsException(ErrorCode.NOT_FOUND, "No such file or directory: " + path);
    }

    public static KvfsException isADirectory(String path) {
        return new KvfsException(ErrorCode.IS_A_DIRECTORY, "Path is a directory: " + path);
    }

    public static KvfsException notADirectory(String path) {
        return new KvfsException(ErrorCode.NOT_A_DIRECTORY, "Path is not a directory: " + path);
    }

    public static KvfsException conflict(String message) {
        return new KvfsException(ErrorCode.CONFLICT, message);
    }

    public static KvfsException directoryNotEmpty(String path) {
        return new KvfsException(ErrorCode.DIRECTORY_NOT_EMPTY, "Directory not empty: " + path);
    }

    public static KvfsException corruptMetadata(String key, Throwable cause) {
        return new KvfsException(ErrorCode.CORRUPT_METADATA, "Failed to parse metadata record " + key, cause);
    }

    public static KvfsException storeError(String message, Throwable cause) {
        return new KvfsException(ErrorCode.STORE_ERROR, message, cause);
    }

    public static KvfsException unauthorized(String message) {
        return new KvfsException(ErrorCode.UNAUTHORIZED, message);
    }
}
