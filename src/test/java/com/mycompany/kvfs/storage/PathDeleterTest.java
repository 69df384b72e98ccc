package com.mycompany.kvfs.storage;

import com.mycompany.kvfs.POJO.Metadata;
import com.mycompany.kvfs.POJO.Owner;
import com.mycompany.kvfs.enums.ChunkEncoding;
import com.mycompany.kvfs.enums.ErrorCode;
import com.mycompany.kvfs.exception.KvfsException;
import com.mycompany.kvfs.kv.FaultyKvClient;
import com.mycompany.kvfs.kv.InMemoryKvClient;
import com.mycompany.kvfs.store.ChunkStore;
import com.mycompany.kvfs.store.MetadataStore;
import com.mycompany.kvfs.store.PrefixScanner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.mycompany.kvfs.constant.GlobalConstant.MAX_CHUNK_SIZE;
import static org.junit.jupiter.api.Assertions.*;

class PathDeleterTest {

    private final InMemoryKvClient backing = new InMemoryKvClient(2, 3072);
    private final FaultyKvClient kv = new FaultyKvClient(backing);
    private final MetadataStore metadataStore = new MetadataStore(kv);
    private final ChunkStore chunkStore = new ChunkStore(kv, ChunkEncoding.RAW);
    private final RangeWriter writer = new RangeWriter(metadataStore, chunkStore, Owner.DEFAULT, Clock.systemUTC());
    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final PathDeleter deleter = new PathDeleter(metadataStore, chunkStore, new PrefixScanner(kv), executor);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void rootCannotBeDeleted() {
        KvfsException e = assertThrows(KvfsException.class, () -> deleter.delete("/"));
        assertEquals(ErrorCode.INVALID_ARGUMENT, e.getErrorCode());
    }

    @Test
    @DisplayName("A directory is only deleted once it is empty")
    void nonEmptyDirectory() {
        metadataStore.put("/d", Metadata.newDirectory(Owner.DEFAULT, 1L));
        writer.write("/d/f", 0, new byte[]{1});

        KvfsException e = assertThrows(KvfsException.class, () -> deleter.delete("/d"));
        assertEquals(ErrorCode.DIRECTORY_NOT_EMPTY, e.getErrorCode());
        assertTrue(metadataStore.exists("/d"));

        deleter.delete("/d/f");
        deleter.delete("/d");
        assertFalse(metadataStore.exists("/d"));
        assertEquals(0, backing.size());
    }

    @Test
    @DisplayName("Deleting a file removes its metadata and every chunk, nothing else")
    void cascade() {
        writer.write("/f", 0, new byte[4 * MAX_CHUNK_SIZE + 1]);
        writer.write("/f2", 0, new byte[]{1});
        writer.write("/f.txt", 0, new byte[]{1});

        deleter.delete("/f");

        assertFalse(metadataStore.exists("/f"));
        assertTrue(chunkStore.listChunkKeys("/f").isEmpty());
        assertEquals(6, kv.getDeletedKeys().size());
        assertTrue(backing.containsKey("/f2.chunk0"));
        assertTrue(backing.containsKey("/f.txt.chunk0"));
        assertTrue(metadataStore.exists("/f.txt"));
    }

    @Test
    void chunksWithoutMetadataAreStillDeleted() {
        chunkStore.put("/orphan", 0, new byte[]{1});
        chunkStore.put("/orphan", 3, new byte[]{1});

        deleter.delete("/orphan");

        assertEquals(0, backing.size());
    }

    @Test
    void missingPathIsNotAnError() {
        deleter.delete("/never-existed");
        assertEquals(0, backing.size());
    }

    @Test
    @DisplayName("The first failed deletion is reported after all deletions were attempted")
    void firstFailureWins() {
        writer.write("/f", 0, new byte[4 * MAX_CHUNK_SIZE]);
        kv.failDelete(key -> key.equals("/f.chunk1") || key.equals("/f.chunk2"));

        KvfsException e = assertThrows(KvfsException.class, () -> deleter.delete("/f"));

        assertEquals(ErrorCode.STORE_ERROR, e.getErrorCode());
        assertTrue(e.getMessage().startsWith("Failed to delete /f: injected delete failure on /f.chunk"));
        assertFalse(backing.containsKey("/f.__meta__"));
        assertFalse(backing.containsKey("/f.chunk0"));
        assertFalse(backing.containsKey("/f.chunk3"));
        assertTrue(backing.containsKey("/f.chunk1"));
        assertTrue(backing.containsKey("/f.chunk2"));
    }

    @Test
    @DisplayName("A failed deletion keeps the error code the store reported")
    void storeErrorCodeIsKept() {
        writer.write("/f", 0, new byte[2 * MAX_CHUNK_SIZE]);
        kv.failDelete(key -> key.equals("/f.chunk1"), key -> KvfsException.unauthorized("HPKV API Error (401): Invalid API key"));

        KvfsException e = assertThrows(KvfsException.class, () -> deleter.delete("/f"));

        assertEquals(ErrorCode.UNAUTHORIZED, e.getErrorCode());
        assertEquals(401, e.getErrorCode().getHttpStatus());
        assertEquals("Failed to delete /f: HPKV API Error (401): Invalid API key", e.getMessage());
        assertTrue(backing.containsKey("/f.chunk1"));
    }

    @Test
    void corruptMetadataIsReported() {
        backing.put("/bad.__meta__", "{".getBytes());
        KvfsException e = assertThrows(KvfsException.class, () -> deleter.delete("/bad"));
        assertEquals(ErrorCode.CORRUPT_METADATA, e.getErrorCode());
    }
}
