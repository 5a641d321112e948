package com.kotsin.challenge.state;

import java.util.List;
import java.util.Map;

/**
 * Durable key/value storage for engine snapshots. Values are opaque JSON strings.
 */
public interface SnapshotStore {

    /** All records whose key starts with {@code keyPrefix}. */
    Map<String, String> readAll(String keyPrefix);

    /**
     * Makes the records under {@code keyPrefix} exactly {@code records}: writes every entry and
     * deletes keys under the prefix that are no longer present.
     */
    void replaceAll(String keyPrefix, Map<String, String> records);

    void put(String key, String value);

    void delete(String key);

    void append(String listKey, String value);

    List<String> readList(String listKey);
}
