package com.mycompany.kvfs.kv;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * One page of a prefix listing. {@code nextMarker} is null on the last page.
 */
@Value
public class ListPage {
    List<String> keys;
    String nextMarker;

    public static ListPage of(List<String> keys, String nextMarker) {
        return new ListPage(Collections.unmodifiableList(new ArrayList<>(keys)), nextMarker);
    }

    public boolean hasMore() {
        return nextMarker != null;
    }

    /**
     * Rolls a key up to {@code prefix + segment + delimiter} when the delimiter occurs after the
     * prefix, the way object stores group "sub directories".
     *
     * @return the key itself when it has no delimiter past the prefix
     */
    public static String rollUp(String key, String prefix, String delimiter) {
        if (delimiter == null || delimiter.isEmpty()) {
            return key;
        }
        int idx = key.indexOf(delimiter, prefix.length());
        return idx < 0 ? key : key.substring(0, idx + delimiter.length());
    }

    /**
     * Cuts one page out of an ascending key sequence that starts at or before the first key of
     * interest. Shared by the stores that iterate their own key space.
     *
     * @param sortedKeys ascending keys, positioned at {@code max(prefix, marker)}
     */
    public static ListPage paginate(Iterator<String> sortedKeys, String prefix, String delimiter,
                                    String marker, int pageSize) {
        List<String> page = new ArrayList<>();
        boolean skipRolledUp = marker != null && delimiter != null && !delimiter.isEmpty()
                && marker.endsWith(delimiter);
        while (sortedKeys.hasNext()) {
            String key = sortedKeys.next();
            if (!key.startsWith(prefix)) {
                if (key.compareTo(prefix) > 0) {
                    break;
                }
                continue;
            }
            if (marker != null && key.compareTo(marker) <= 0) {
                continue;
            }
            // rest of a group the previous page already returned
            if (skipRolledUp && key.startsWith(marker)) {
                continue;
            }
            String entry = rollUp(key, prefix, delimiter);
            if (!page.isEmpty() && page.get(page.size() - 1).equals(entry)) {
                continue;
            }
            if (page.size() == pageSize) {
                return of(page, page.get(page.size() - 1));
            }
            page.add(entry);
        }
        return of(page, null);
    }
}
