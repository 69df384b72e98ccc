package com.mycompany.kvfs.storage;

import com.mycompany.kvfs.POJO.DirectoryEntry;
import com.mycompany.kvfs.POJO.Metadata;
import com.mycompany.kvfs.POJO.Owner;
import com.mycompany.kvfs.enums.ErrorCode;
import com.mycompany.kvfs.exception.KvfsException;
import com.mycompany.kvfs.kv.InMemoryKvClient;
import com.mycompany.kvfs.kv.ListPage;
import com.mycompany.kvfs.store.MetadataStore;
import com.mycompany.kvfs.store.PrefixScanner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DirectoryListerTest {

    private final InMemoryKvClient kv = new InMemoryKvClient(3, 3072);
    private final MetadataStore metadataStore = new MetadataStore(kv);

    private DirectoryLister lister(boolean resolveEntryTypes) {
        return new DirectoryLister(metadataStore, new PrefixScanner(kv), resolveEntryTypes);
    }

    private void file(String path) {
        metadataStore.put(path, Metadata.newFile(Owner.DEFAULT, 1L));
    }

    private void directory(String path) {
        metadataStore.put(path, Metadata.newDirectory(Owner.DEFAULT, 1L));
    }

    /**
     * Serves the metadata of the backing store but enumerates keys in a fixed, possibly unsorted order.
     */
    private static final class FixedOrderKvClient extends InMemoryKvClient {
        private final List<String> keys;

        FixedOrderKvClient(List<String> keys) {
            this.keys = keys;
        }

        @Override
        public ListPage list(String prefix, String delimiter, String marker) {
            List<String> matching = new ArrayList<>();
            for (String key : keys) {
                if (key.startsWith(prefix)) {
                    matching.add(key);
                }
            }
            return ListPage.of(matching, null);
        }
    }

    @ParameterizedTest
    @ValueSource(booleans = {true, false})
    @DisplayName("x is a file and y a directory whichever key is enumerated first")
    void classificationIsOrderIndependent(boolean resolveEntryTypes) {
        List<String> keys = Arrays.asList("/a/x.__meta__", "/a/y/z.__meta__");
        List<String> reversed = new ArrayList<>(keys);
        Collections.reverse(reversed);
        List<DirectoryEntry> expected = Arrays.asList(DirectoryEntry.file("x"), DirectoryEntry.directory("y"));

        for (List<String> order : Arrays.asList(keys, reversed)) {
            FixedOrderKvClient client = new FixedOrderKvClient(order);
            MetadataStore store = new MetadataStore(client);
            store.put("/a", Metadata.newDirectory(Owner.DEFAULT, 1L));
            store.put("/a/x", Metadata.newFile(Owner.DEFAULT, 1L));
            store.put("/a/y/z", Metadata.newFile(Owner.DEFAULT, 1L));

            DirectoryLister lister = new DirectoryLister(store, new PrefixScanner(client), resolveEntryTypes);
            assertEquals(expected, lister.list("/a"), "order " + order);
        }
    }

    @Test
    @DisplayName("A directory observed through its metadata and its children is listed once")
    void directoryIsNotDuplicated() {
        directory("/a");
        directory("/a/y");
        file("/a/y/z");
        file("/a/x");

        assertEquals(Arrays.asList(DirectoryEntry.file("x"), DirectoryEntry.directory("y")), lister(true).list("/a"));
        assertEquals(Arrays.asList(DirectoryEntry.file("x"), DirectoryEntry.directory("y")), lister(false).list("/a"));
    }

    @Test
    @DisplayName("An empty directory is only recognized from its metadata record")
    void emptyDirectory() {
        directory("/a");
        directory("/a/empty");

        assertEquals(Collections.singletonList(DirectoryEntry.directory("empty")), lister(true).list("/a"));
        assertEquals(Collections.singletonList(DirectoryEntry.file("empty")), lister(false).list("/a"));
    }

    @Test
    void chunkKeysAreNotEntries() {
        file("/a/f");
        kv.put("/a/f.chunk0", new byte[]{1});
        kv.put("/a/f.chunk1", new byte[]{1});

        assertEquals(Collections.singletonList(DirectoryEntry.file("f")), lister(true).list("/a"));
    }

    @Test
    void rootListing() {
        directory("/");
        directory("/docs");
        file("/docs/readme");
        file("/top");

        assertEquals(Arrays.asList(DirectoryEntry.directory("docs"), DirectoryEntry.file("top")),
                lister(true).list("/"));
    }

    @Test
    @DisplayName("Entries spread over many pages are all listed, sorted by name")
    void manyPages() {
        directory("/big");
        List<DirectoryEntry> expected = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            String name = String.format("f%02d", i);
            file("/big/" + name);
            kv.put("/big/" + name + ".chunk0", new byte[]{1});
            expected.add(DirectoryEntry.file(name));
        }

        assertEquals(expected, lister(true).list("/big"));
    }

    @Test
    void siblingWithSamePrefixIsNotAChild() {
        directory("/a");
        file("/ab");
        file("/a/x");

        assertEquals(Collections.singletonList(DirectoryEntry.file("x")), lister(true).list("/a"));
    }

    @Test
    void missingDirectoryIsEmpty() {
        assertTrue(lister(true).list("/nothing").isEmpty());
    }

    @Test
    void fileIsNotADirectory() {
        file("/f");
        KvfsException e = assertThrows(KvfsException.class, () -> lister(true).list("/f"));
        assertEquals(ErrorCode.NOT_A_DIRECTORY, e.getErrorCode());
    }
}
