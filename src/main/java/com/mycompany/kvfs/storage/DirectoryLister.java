package com.mycompany.kvfs.storage;

import com.mycompany.kvfs.POJO.DirectoryEntry;
import com.mycompany.kvfs.POJO.Metadata;
import com.mycompany.kvfs.exception.KvfsException;
import com.mycompany.kvfs.store.MetadataStore;
import com.mycompany.kvfs.store.PrefixScanner;
import com.mycompany.kvfs.utils.KeyCodec;
import com.mycompany.kvfs.utils.PathUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static com.mycompany.kvfs.constant.GlobalConstant.PATH_SEPARATOR;

/**
 * Lists the direct children of a directory from the keys under its prefix.
 * <p>
 * A key with a separator after the prefix proves its first segment is a directory. A metadata key
 * of a direct child only names the child; with {@code resolveEntryTypes} its record decides the
 * type, otherwise it is reported as a file unless some descendant key proves otherwise.
 */
@Slf4j
public class DirectoryLister {

    private final MetadataStore metadataStore;
    private final PrefixScanner scanner;
    private final boolean resolveEntryTypes;

    public DirectoryLister(MetadataStore metadataStore, PrefixScanner scanner, boolean resolveEntryTypes) {
        this.metadataStore = metadataStore;
        this.scanner = scanner;
        this.resolveEntryTypes = resolveEntryTypes;
    }

    /**
     * @return entries sorted by name, empty when nothing is stored under the path
     * @throws KvfsException NOT_A_DIRECTORY when the path is a regular file
     */
    public List<DirectoryEntry> list(String rawPath) {
        String path = KeyCodec.requireValidPath(rawPath);
        Optional<Metadata> own = metadataStore.get(path);
        if (own.isPresent() && own.get().isRegularFile()) {
            throw KvfsException.notADirectory(path);
        }

        String prefix = PathUtils.directoryPrefix(path);
        // name -> isDir
        Map<String, Boolean> entries = new TreeMap<>();
        scanner.forEachKey(prefix, key -> observe(entries, prefix, key));

        if (resolveEntryTypes) {
            for (Map.Entry<String, Boolean> entry : entries.entrySet()) {
                if (entry.getValue()) {
                    continue;
                }
                String childPath = PathUtils.combine(path, entry.getKey());
                metadataStore.get(childPath)
                        .filter(Metadata::isDirectory)
                        .ifPresent(metadata -> entry.setValue(true));
            }
        }

        List<DirectoryEntry> result = new ArrayList<>(entries.size());
        entries.forEach((name, dir) -> result.add(dir ? DirectoryEntry.directory(name) : DirectoryEntry.file(name)));
        log.debug("Listed {}: {} entries", path, result.size());
        return result;
    }

    private static void observe(Map<String, Boolean> entries, String prefix, String key) {
        String remainder = key.substring(prefix.length());
        int separator = remainder.indexOf(PATH_SEPARATOR);
        if (separator > 0) {
            entries.put(remainder.substring(0, separator), true);
            return;
        }
        if (separator == 0 || !KeyCodec.isMetadataKey(key)) {
            // chunk keys and malformed keys
            return;
        }
        String name = KeyCodec.pathOfMetadataKey(key).substring(prefix.length());
        if (!name.isEmpty()) {
            entries.putIfAbsent(name, false);
        }
    }
}
