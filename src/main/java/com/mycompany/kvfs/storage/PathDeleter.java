package com.mycompany.kvfs.storage;

import com.mycompany.kvfs.POJO.Metadata;
import com.mycompany.kvfs.enums.ErrorCode;
import com.mycompany.kvfs.exception.KvfsException;
import com.mycompany.kvfs.store.ChunkStore;
import com.mycompany.kvfs.store.MetadataStore;
import com.mycompany.kvfs.store.PrefixScanner;
import com.mycompany.kvfs.utils.KeyCodec;
import com.mycompany.kvfs.utils.PathUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Removes a file with all of its chunks, or an empty directory.
 */
@Slf4j
public class PathDeleter {

    private final MetadataStore metadataStore;
    private final ChunkStore chunkStore;
    private final PrefixScanner scanner;
    private final ExecutorService executor;

    public PathDeleter(MetadataStore metadataStore, ChunkStore chunkStore, PrefixScanner scanner,
                       ExecutorService executor) {
        this.metadataStore = metadataStore;
        this.chunkStore = chunkStore;
        this.scanner = scanner;
        this.executor = executor;
    }

    /**
     * @throws KvfsException INVALID_ARGUMENT for the root, DIRECTORY_NOT_EMPTY, or the error code
     *                       of the first deletion that failed
     */
    public void delete(String rawPath) {
        String path = KeyCodec.requireValidPath(rawPath);
        if (PathUtils.isRoot(path)) {
            throw KvfsException.invalidArgument("Cannot delete root directory");
        }

        Optional<Metadata> metadata = metadataStore.get(path);
        if (!metadata.isPresent()) {
            log.warn("Metadata not found for {}, deleting chunk keys only", path);
        } else if (metadata.get().isDirectory()) {
            if (scanner.hasAnyKey(PathUtils.directoryPrefix(path))) {
                throw KvfsException.directoryNotEmpty(path);
            }
            metadataStore.delete(path);
            log.info("Deleted directory {}", path);
            return;
        }

        List<String> chunkKeys = chunkStore.listChunkKeys(path);
        AtomicReference<Throwable> firstFailure = new AtomicReference<>();
        List<CompletableFuture<Void>> deletions = new ArrayList<>(chunkKeys.size() + 1);
        deletions.add(submit(path, KeyCodec.metadataKey(path), () -> metadataStore.delete(path), firstFailure));
        for (String chunkKey : chunkKeys) {
            deletions.add(submit(path, chunkKey, () -> chunkStore.deleteKey(chunkKey), firstFailure));
        }
        CompletableFuture.allOf(deletions.toArray(new CompletableFuture[0])).exceptionally(e -> null).join();

        Throwable failure = firstFailure.get();
        if (failure != null) {
            ErrorCode errorCode = failure instanceof KvfsException
                    ? ((KvfsException) failure).getErrorCode()
                    : ErrorCode.STORE_ERROR;
            throw new KvfsException(errorCode, "Failed to delete " + path + ": " + failure.getMessage(), failure);
        }
        log.info("Deleted {} with {} chunk(s)", path, chunkKeys.size());
    }

    private CompletableFuture<Void> submit(String path, String key, Runnable deletion,
                                           AtomicReference<Throwable> firstFailure) {
        return CompletableFuture.runAsync(deletion, executor).whenComplete((v, e) -> {
            if (e == null) {
                return;
            }
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            if (!firstFailure.compareAndSet(null, cause)) {
                log.error("Another deletion of {} failed too, key {}", path, key, cause);
            }
        });
    }
}
