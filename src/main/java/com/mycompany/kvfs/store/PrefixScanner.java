package com.mycompany.kvfs.store;

import com.mycompany.kvfs.exception.KvfsException;
import com.mycompany.kvfs.kv.KvClient;
import com.mycompany.kvfs.kv.ListPage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Walks every key under a prefix, following the store's markers until the last page.
 */
@Slf4j
public class PrefixScanner {

    private final KvClient kvClient;

    public PrefixScanner(KvClient kvClient) {
        this.kvClient = kvClient;
    }

    public void forEachKey(String prefix, Consumer<String> consumer) {
        String marker = null;
        int pages = 0;
        do {
            ListPage page = kvClient.list(prefix, null, marker);
            page.getKeys().forEach(consumer);
            pages++;
            if (page.hasMore() && Objects.equals(page.getNextMarker(), marker)) {
                throw KvfsException.storeError("Listing of prefix " + prefix + " did not advance past marker " + marker, null);
            }
            marker = page.getNextMarker();
        } while (marker != null);
        log.debug("Scanned prefix {} in {} page(s)", prefix, pages);
    }

    public List<String> scanAll(String prefix) {
        List<String> keys = new ArrayList<>();
        forEachKey(prefix, keys::add);
        return keys;
    }

    /**
     * Only reads the first page.
     */
    public boolean hasAnyKey(String prefix) {
        return !kvClient.list(prefix, null, null).getKeys().isEmpty();
    }
}
