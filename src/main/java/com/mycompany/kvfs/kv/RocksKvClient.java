package com.mycompany.kvfs.kv;

import com.mycompany.kvfs.exception.KvfsException;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Store backed by an embedded RocksDB instance in the default column family. Keys are stored as
 * UTF-8, so RocksDB's bytewise order is the code point order of the paths.
 */
public class RocksKvClient implements KvClient {
    private static final Logger logger = LoggerFactory.getLogger(RocksKvClient.class);

    static {
        RocksDB.loadLibrary();
    }

    private final Path dbPath;
    private final Options options;
    private final RocksDB rocksDB;
    private final int pageSize;
    private final int maxValueSize;

    private RocksKvClient(Path dbPath, Options options, RocksDB rocksDB, int pageSize, int maxValueSize) {
        this.dbPath = dbPath;
        this.options = options;
        this.rocksDB = rocksDB;
        this.pageSize = pageSize;
        this.maxValueSize = maxValueSize;
    }

    public static RocksKvClient open(Path dbPath, int pageSize, int maxValueSize) {
        try {
            Files.createDirectories(dbPath);
        } catch (IOException e) {
            throw KvfsException.storeError("Cannot create database directory: " + dbPath, e);
        }
        Options options = new Options().setCreateIfMissing(true);
        try {
            RocksDB db = RocksDB.open(options, dbPath.toString());
            logger.info("RocksDB opened at {} pageSize={} maxValueSize={}", dbPath, pageSize, maxValueSize);
            return new RocksKvClient(dbPath, options, db, pageSize, maxValueSize);
        } catch (RocksDBException e) {
            options.close();
            throw KvfsException.storeError("Failed to open RocksDB at " + dbPath, e);
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        try {
            return Optional.ofNullable(rocksDB.get(toBytes(key)));
        } catch (RocksDBException e) {
            throw KvfsException.storeError("Failed to get " + key, e);
        }
    }

    @Override
    public void put(String key, byte[] value) {
        if (value.length > maxValueSize) {
            throw KvfsException.storeError("Value of " + key + " is " + value.length
                    + " bytes, store limit is " + maxValueSize, null);
        }
        try {
            rocksDB.put(toBytes(key), value);
        } catch (RocksDBException e) {
            throw KvfsException.storeError("Failed to put " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            rocksDB.delete(toBytes(key));
        } catch (RocksDBException e) {
            throw KvfsException.storeError("Failed to delete " + key, e);
        }
    }

    @Override
    public ListPage list(String prefix, String delimiter, String marker) {
        String start = marker != null && marker.compareTo(prefix) > 0 ? marker : prefix;
        try (RocksIterator iterator = rocksDB.newIterator()) {
            iterator.seek(toBytes(start));
            ListPage page = ListPage.paginate(new KeyIterator(iterator), prefix, delimiter, marker, pageSize);
            iterator.status();
            return page;
        } catch (RocksDBException e) {
            throw KvfsException.storeError("Failed to list prefix " + prefix, e);
        }
    }

    @Override
    public int maxValueSize() {
        return maxValueSize;
    }

    @Override
    public void close() {
        // handles first, then the options they were opened with
        Exception closeException = null;
        try {
            rocksDB.close();
        } catch (Exception e) {
            closeException = e;
        }
        try {
            options.close();
        } catch (Exception e) {
            if (closeException == null) {
                closeException = e;
            } else {
                closeException.addSuppressed(e);
            }
        }
        if (closeException != null) {
            throw KvfsException.storeError("Failed to close RocksDB at " + dbPath, closeException);
        }
        logger.info("RocksDB closed at {}", dbPath);
    }

    private static byte[] toBytes(String key) {
        return key.getBytes(StandardCharsets.UTF_8);
    }

    private static final class KeyIterator implements Iterator<String> {
        private final RocksIterator iterator;

        KeyIterator(RocksIterator iterator) {
            this.iterator = iterator;
        }

        @Override
        public boolean hasNext() {
            return iterator.isValid();
        }

        @Override
        public String next() {
            if (!iterator.isValid()) {
                throw new NoSuchElementException();
            }
            String key = new String(iterator.key(), StandardCharsets.UTF_8);
            iterator.next();
            return key;
        }
    }
}
