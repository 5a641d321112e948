package com.kotsin.challenge.state;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Redis-backed snapshot store: one JSON string per record key, closed trades in a list.
 */
@Slf4j
public class RedisSnapshotStore implements SnapshotStore {

    private final RedisTemplate<String, String> redis;

    public RedisSnapshotStore(RedisTemplate<String, String> redis) {
        this.redis = redis;
    }

    @Override
    public Map<String, String> readAll(String keyPrefix) {
        Map<String, String> out = new TreeMap<>();
        for (String key : scanKeys(keyPrefix)) {
            String raw = redis.opsForValue().get(key);
            if (raw != null) {
                out.put(key, raw);
            }
        }
        return out;
    }

    @Override
    public void replaceAll(String keyPrefix, Map<String, String> records) {
        if (!records.isEmpty()) {
            redis.opsForValue().multiSet(records);
        }
        Set<String> stale = new HashSet<>(scanKeys(keyPrefix));
        stale.removeAll(records.keySet());
        if (!stale.isEmpty()) {
            redis.delete(stale);
            log.debug("Deleted {} stale snapshot keys under {}", stale.size(), keyPrefix);
        }
    }

    @Override
    public void put(String key, String value) {
        redis.opsForValue().set(key, value);
    }

    @Override
    public void delete(String key) {
        redis.delete(key);
    }

    @Override
    public void append(String listKey, String value) {
        redis.opsForList().rightPush(listKey, value);
    }

    @Override
    public List<String> readList(String listKey) {
        List<String> values = redis.opsForList().range(listKey, 0, -1);
        return values == null ? List.of() : values;
    }

    private List<String> scanKeys(String keyPrefix) {
        List<String> keys = new ArrayList<>();
        ScanOptions options = ScanOptions.scanOptions().match(keyPrefix + "*").count(1000).build();
        try (Cursor<String> cursor = redis.scan(options)) {
            while (cursor.hasNext()) {
                keys.add(cursor.next());
            }
        }
        return keys;
    }
}
