package com.mycompany.kvfs;

import com.mycompany.kvfs.POJO.DirectoryEntry;
import com.mycompany.kvfs.POJO.KvfsConfig;
import com.mycompany.kvfs.POJO.Metadata;
import com.mycompany.kvfs.POJO.Owner;
import com.mycompany.kvfs.POJO.ReadPlan;
import com.mycompany.kvfs.exception.KvfsException;
import com.mycompany.kvfs.kv.KvClient;
import com.mycompany.kvfs.storage.ChunkReadStream;
import com.mycompany.kvfs.storage.DirectoryLister;
import com.mycompany.kvfs.storage.PathDeleter;
import com.mycompany.kvfs.storage.RangeReader;
import com.mycompany.kvfs.storage.RangeWriter;
import com.mycompany.kvfs.store.ChunkStore;
import com.mycompany.kvfs.store.MetadataStore;
import com.mycompany.kvfs.store.PrefixScanner;
import com.mycompany.kvfs.utils.KeyCodec;
import com.mycompany.kvfs.utils.PathUtils;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.mycompany.kvfs.constant.GlobalConstant.PATH_SEPARATOR;

/**
 * File and directory operations over a {@link KvClient}. Every call blocks on store I/O.
 */
@Slf4j
public class KvFileSystem implements AutoCloseable {

    private final KvClient kvClient;
    private final Owner owner;
    private final Clock clock;
    private final ExecutorService deleteExecutor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final MetadataStore metadataStore;
    private final RangeWriter writer;
    private final RangeReader reader;
    private final DirectoryLister lister;
    private final PathDeleter deleter;

    public KvFileSystem(KvClient kvClient, KvfsConfig config) {
        this(kvClient, config, Clock.systemUTC());
    }

    public KvFileSystem(KvClient kvClient, KvfsConfig config, Clock clock) {
        this.kvClient = kvClient;
        this.owner = config.getOwner();
        this.clock = clock;
        this.metadataStore = new MetadataStore(kvClient);
        ChunkStore chunkStore = new ChunkStore(kvClient, config.getChunkEncoding());
        this.deleteExecutor = Executors.newFixedThreadPool(config.getDeleteParallelism(),
                new BasicThreadFactory.Builder().namingPattern("kvfs-delete-%d").daemon(true).build());
        PrefixScanner scanner = new PrefixScanner(kvClient);
        this.writer = new RangeWriter(metadataStore, chunkStore, owner, clock);
        this.reader = new RangeReader(metadataStore, chunkStore);
        this.lister = new DirectoryLister(metadataStore, scanner, config.isResolveEntryTypes());
        this.deleter = new PathDeleter(metadataStore, chunkStore, scanner, deleteExecutor);
        log.info("KVFS ready, {}", config);
    }

    /**
     * @throws KvfsException NOT_FOUND when the path has no metadata; the root always exists
     */
    public Metadata stat(String rawPath) {
        String path = KeyCodec.requireValidPath(rawPath);
        Optional<Metadata> metadata = metadataStore.get(path);
        if (metadata.isPresent()) {
            return metadata.get();
        }
        if (PathUtils.isRoot(path)) {
            Metadata root = Metadata.newDirectory(owner, 0);
            root.setNumChunks(0L);
            return root;
        }
        throw KvfsException.notFound(path);
    }

    /**
     * @return true when the directory was created, false when it already existed
     */
    public boolean mkdir(String rawPath) {
        if (rawPath == null || rawPath.isEmpty() || PATH_SEPARATOR.equals(rawPath)) {
            throw KvfsException.invalidArgument("Path parameter is required and cannot be root (/)");
        }
        if (rawPath.endsWith(PATH_SEPARATOR)) {
            throw KvfsException.invalidArgument("Directory path should not end with a slash: " + rawPath);
        }
        String path = KeyCodec.requireValidPath(rawPath);
        if (PathUtils.isRoot(path)) {
            throw KvfsException.invalidArgument("Cannot create root directory");
        }

        Optional<Metadata> existing = metadataStore.get(path);
        if (existing.isPresent()) {
            if (existing.get().isDirectory()) {
                log.debug("Directory {} already exists", path);
                return false;
            }
            throw KvfsException.conflict("Path exists but is not a directory: " + path);
        }
        String parent = PathUtils.parent(path);
        Optional<Metadata> parentMetadata = metadataStore.get(parent);
        if (parentMetadata.isPresent() && !parentMetadata.get().isDirectory()) {
            throw KvfsException.notADirectory(parent);
        }

        metadataStore.put(path, Metadata.newDirectory(owner, clock.instant().getEpochSecond()));
        log.info("Created directory {}", path);
        return true;
    }

    public int write(String path, long offset, byte[] data) {
        return writer.write(path, offset, data);
    }

    public byte[] read(String path, long offset, long size) {
        return reader.read(path, offset, size);
    }

    /**
     * Validates and plans the read immediately, chunks are fetched as the stream is consumed.
     */
    public ChunkReadStream openReadStream(Vertx vertx, String path, long offset, long size) {
        ReadPlan plan = reader.plan(path, offset, size);
        return new ChunkReadStream(vertx, reader, plan);
    }

    public List<DirectoryEntry> list(String path) {
        return lister.list(path);
    }

    public void delete(String path) {
        deleter.delete(path);
    }

    /**
     * Stops the delete pool and closes the store. Later calls do nothing.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        deleteExecutor.shutdown();
        try {
            if (!deleteExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                deleteExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            deleteExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        kvClient.close();
        log.info("KVFS closed");
    }
}
