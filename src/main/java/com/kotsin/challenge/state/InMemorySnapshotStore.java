package com.kotsin.challenge.state;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store for paper runs and tests. State does not survive the JVM.
 */
public class InMemorySnapshotStore implements SnapshotStore {

    private final Map<String, String> values = new ConcurrentHashMap<>();
    private final Map<String, List<String>> lists = new ConcurrentHashMap<>();

    @Override
    public Map<String, String> readAll(String keyPrefix) {
        Map<String, String> out = new TreeMap<>();
        values.forEach((k, v) -> {
            if (k.startsWith(keyPrefix)) {
                out.put(k, v);
            }
        });
        return out;
    }

    @Override
    public synchronized void replaceAll(String keyPrefix, Map<String, String> records) {
        values.keySet().removeIf(k -> k.startsWith(keyPrefix) && !records.containsKey(k));
        values.putAll(records);
    }

    @Override
    public void put(String key, String value) {
        values.put(key, value);
    }

    @Override
    public void delete(String key) {
        values.remove(key);
    }

    @Override
    public void append(String listKey, String value) {
        lists.computeIfAbsent(listKey, k -> new ArrayList<>()).add(value);
    }

    @Override
    public List<String> readList(String listKey) {
        List<String> list = lists.get(listKey);
        return list == null ? List.of() : List.copyOf(list);
    }
}
