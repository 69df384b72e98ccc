package com.mycompany.kvfs;

import com.mycompany.kvfs.POJO.DirectoryEntry;
import com.mycompany.kvfs.POJO.KvfsConfig;
import com.mycompany.kvfs.POJO.Metadata;
import com.mycompany.kvfs.enums.ErrorCode;
import com.mycompany.kvfs.exception.KvfsException;
import com.mycompany.kvfs.kv.InMemoryKvClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.mycompany.kvfs.POJO.KvfsConfigKeys.*;
import static org.junit.jupiter.api.Assertions.*;

class KvFileSystemTest {

    private static final long NOW = 1_700_000_000L;

    private final InMemoryKvClient kv = new InMemoryKvClient();
    private final KvFileSystem fs = new KvFileSystem(kv, KvfsConfig.DEFAULT_CONFIG,
            Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC));

    @AfterEach
    void close() {
        fs.close();
    }

    private static ErrorCode codeOf(Runnable call) {
        return assertThrows(KvfsException.class, call::run).getErrorCode();
    }

    @Nested
    @DisplayName("stat")
    class Stat {

        @Test
        void rootWithoutRecordIsADefaultDirectory() {
            Metadata root = fs.stat("/");
            assertTrue(root.isDirectory());
            assertEquals(040755, root.getMode());
            assertEquals(0, root.getSize());
            assertEquals(0, kv.size());
        }

        @Test
        void storedRecordIsReturned() {
            fs.write("/f", 0, "hello".getBytes(StandardCharsets.UTF_8));
            Metadata metadata = fs.stat("/f");
            assertEquals(5, metadata.getSize());
            assertEquals(1L, metadata.getNumChunks());
            assertEquals(NOW, metadata.getMtime());
        }

        @Test
        void missingPath() {
            assertEquals(ErrorCode.NOT_FOUND, codeOf(() -> fs.stat("/nope")));
            assertEquals(ErrorCode.INVALID_ARGUMENT, codeOf(() -> fs.stat("nope")));
        }
    }

    @Nested
    @DisplayName("mkdir")
    class Mkdir {

        @Test
        @DisplayName("Creating an existing directory succeeds without touching it")
        void idempotent() {
            assertTrue(fs.mkdir("/docs"));
            byte[] before = kv.get("/docs.__meta__").get();

            assertFalse(fs.mkdir("/docs"));
            assertArrayEquals(before, kv.get("/docs.__meta__").get());

            Metadata metadata = fs.stat("/docs");
            assertEquals(040755, metadata.getMode());
            assertEquals(1000, metadata.getUid());
            assertEquals(NOW, metadata.getCtime());
            assertFalse(new String(before, StandardCharsets.UTF_8).contains("num_chunks"));
        }

        @Test
        void existingFileConflicts() {
            fs.write("/f", 0, new byte[]{1});
            assertEquals(ErrorCode.CONFLICT, codeOf(() -> fs.mkdir("/f")));
        }

        @Test
        void parentFileIsNotADirectory() {
            fs.write("/f", 0, new byte[]{1});
            assertEquals(ErrorCode.NOT_A_DIRECTORY, codeOf(() -> fs.mkdir("/f/sub")));
        }

        @Test
        void invalidPaths() {
            assertEquals(ErrorCode.INVALID_ARGUMENT, codeOf(() -> fs.mkdir("/")));
            assertEquals(ErrorCode.INVALID_ARGUMENT, codeOf(() -> fs.mkdir("/docs/")));
            assertEquals(ErrorCode.INVALID_ARGUMENT, codeOf(() -> fs.mkdir("")));
            assertEquals(ErrorCode.INVALID_ARGUMENT, codeOf(() -> fs.mkdir("/x.__meta__")));
            assertEquals(0, kv.size());
        }
    }

    @Test
    @DisplayName("A small tree can be built, read, listed and torn down")
    void lifecycle() {
        fs.mkdir("/docs");
        fs.mkdir("/docs/old");
        byte[] text = "the quick brown fox".getBytes(StandardCharsets.UTF_8);
        assertEquals(text.length, fs.write("/docs/fox.txt", 0, text));

        assertArrayEquals("quick".getBytes(StandardCharsets.UTF_8), fs.read("/docs/fox.txt", 4, 5));
        assertEquals(Arrays.asList(DirectoryEntry.file("fox.txt"), DirectoryEntry.directory("old")), fs.list("/docs"));
        assertEquals(Collections.singletonList(DirectoryEntry.directory("docs")), fs.list("/"));

        assertEquals(ErrorCode.DIRECTORY_NOT_EMPTY, codeOf(() -> fs.delete("/docs")));
        fs.delete("/docs/fox.txt");
        fs.delete("/docs/old");
        fs.delete("/docs");

        assertEquals(0, kv.size());
        assertTrue(fs.list("/").isEmpty());
    }

    @Test
    void configuredOwnerIsUsedForNewRecords() {
        Map<String, String> map = new HashMap<>();
        map.put(OWNER_UID_KEY, "0");
        map.put(OWNER_GID_KEY, "0");
        try (KvFileSystem rootOwned = new KvFileSystem(new InMemoryKvClient(), new KvfsConfig(map))) {
            rootOwned.mkdir("/etc");
            rootOwned.write("/etc/hosts", 0, new byte[]{1});
            assertEquals(0, rootOwned.stat("/etc").getUid());
            assertEquals(0, rootOwned.stat("/etc/hosts").getGid());
        }
    }

    @Test
    @DisplayName("Closing twice closes the store once")
    void closeIsIdempotent() {
        AtomicInteger closes = new AtomicInteger();
        KvFileSystem closing = new KvFileSystem(new InMemoryKvClient() {
            @Override
            public void close() {
                closes.incrementAndGet();
            }
        }, KvfsConfig.DEFAULT_CONFIG);

        closing.close();
        closing.close();

        assertEquals(1, closes.get());
    }

    @Test
    void base64EncodingNeedsALargerValueLimit() {
        Map<String, String> map = new HashMap<>();
        map.put(CHUNK_ENCODING_KEY, "BASE64");
        KvfsConfig config = new KvfsConfig(map);
        assertThrows(IllegalArgumentException.class, () -> new KvFileSystem(new InMemoryKvClient(), config));

        try (KvFileSystem fs64 = new KvFileSystem(new InMemoryKvClient(1000, 4000), config)) {
            byte[] data = new byte[5000];
            for (int i = 0; i < data.length; i++) {
                data[i] = (byte) i;
            }
            fs64.write("/b", 0, data);
            assertArrayEquals(data, fs64.read("/b", 0, data.length));
        }
    }
}
