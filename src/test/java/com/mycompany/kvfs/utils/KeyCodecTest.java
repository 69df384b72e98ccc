package com.mycompany.kvfs.utils;

import com.mycompany.kvfs.enums.ErrorCode;
import com.mycompany.kvfs.exception.KvfsException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class KeyCodecTest {

    @Test
    @DisplayName("Metadata keys append the suffix, the root uses its literal key")
    void metadataKeys() {
        assertEquals("/.__meta__", KeyCodec.metadataKey("/"));
        assertEquals("/docs.__meta__", KeyCodec.metadataKey("/docs"));
        assertEquals("/docs/a.txt.__meta__", KeyCodec.metadataKey("/docs/a.txt"));
    }

    @Test
    void chunkKeys() {
        assertEquals("/a.txt.chunk0", KeyCodec.chunkKey("/a.txt", 0));
        assertEquals("/a.txt.chunk12", KeyCodec.chunkKey("/a.txt", 12));
        assertEquals("/a.txt.chunk", KeyCodec.chunkKeyPrefix("/a.txt"));
        assertThrows(IllegalArgumentException.class, () -> KeyCodec.chunkKey("/a.txt", -1));
    }

    @Test
    void metadataKeyRoundTrip() {
        assertTrue(KeyCodec.isMetadataKey("/x/y.__meta__"));
        assertFalse(KeyCodec.isMetadataKey("/x/y.chunk0"));
        assertEquals("/x/y", KeyCodec.pathOfMetadataKey("/x/y.__meta__"));
        assertEquals("/", KeyCodec.pathOfMetadataKey("/.__meta__"));
        assertThrows(IllegalArgumentException.class, () -> KeyCodec.pathOfMetadataKey("/x/y"));
    }

    @Test
    @DisplayName("Only decimal indexes without leading zeros are chunk keys of a path")
    void chunkIndexParsing() {
        assertEquals(0, KeyCodec.chunkIndexOf("/a", "/a.chunk0"));
        assertEquals(1234, KeyCodec.chunkIndexOf("/a", "/a.chunk1234"));
        assertEquals(-1, KeyCodec.chunkIndexOf("/a", "/a.chunk"));
        assertEquals(-1, KeyCodec.chunkIndexOf("/a", "/a.chunk01"));
        assertEquals(-1, KeyCodec.chunkIndexOf("/a", "/a.chunk1x"));
        assertEquals(-1, KeyCodec.chunkIndexOf("/a", "/a.chunk1.__meta__"));
        assertEquals(-1, KeyCodec.chunkIndexOf("/a", "/ab.chunk1"));
        assertEquals(-1, KeyCodec.chunkIndexOf("/a", "/a.chunk1234567890123456789"));
        assertTrue(KeyCodec.isChunkKeyOf("/a", "/a.chunk7"));
        assertFalse(KeyCodec.isChunkKeyOf("/a", "/a.__meta__"));
    }

    @Test
    void validPathsAreNormalized() {
        assertEquals("/docs/a.txt", KeyCodec.requireValidPath("/docs//./a.txt/"));
        assertEquals("/", KeyCodec.requireValidPath("/"));
        assertEquals("/notes.chk/x.meta", KeyCodec.requireValidPath("/notes.chk/x.meta"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"/a.chunk0", "/dir.__meta__/x", "/a/b.chunk", "relative", ""})
    void reservedOrMalformedPathsAreRejected(String path) {
        KvfsException e = assertThrows(KvfsException.class, () -> KeyCodec.requireValidPath(path));
        assertEquals(ErrorCode.INVALID_ARGUMENT, e.getErrorCode());
    }
}
