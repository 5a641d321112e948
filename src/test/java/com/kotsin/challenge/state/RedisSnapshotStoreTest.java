package com.kotsin.challenge.state;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.ValueOperations;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("RedisSnapshotStore")
class RedisSnapshotStoreTest {

    private RedisTemplate<String, String> redis;
    private ValueOperations<String, String> values;
    private ListOperations<String, String> lists;
    private RedisSnapshotStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(RedisTemplate.class);
        values = mock(ValueOperations.class);
        lists = mock(ListOperations.class);
        when(redis.opsForValue()).thenReturn(values);
        when(redis.opsForList()).thenReturn(lists);
        store = new RedisSnapshotStore(redis);
    }

    @SuppressWarnings("unchecked")
    private void keysInRedis(String... keys) {
        Cursor<String> cursor = mock(Cursor.class);
        Boolean[] more = new Boolean[keys.length];
        for (int i = 0; i < keys.length; i++) {
            more[i] = i < keys.length - 1;
        }
        if (keys.length == 0) {
            when(cursor.hasNext()).thenReturn(false);
        } else {
            when(cursor.hasNext()).thenReturn(true, more);
            String[] rest = new String[keys.length - 1];
            System.arraycopy(keys, 1, rest, 0, rest.length);
            when(cursor.next()).thenReturn(keys[0], rest);
        }
        when(redis.scan(any(ScanOptions.class))).thenReturn(cursor);
    }

    @Test
    @DisplayName("readAll returns every scanned key that still has a value")
    void readAllSkipsVanishedKeys() {
        keysInRedis("snap:position:a", "snap:position:b");
        when(values.get("snap:position:a")).thenReturn("{\"id\":\"a\"}");
        when(values.get("snap:position:b")).thenReturn(null);

        Map<String, String> records = store.readAll("snap:position:");

        assertEquals(Map.of("snap:position:a", "{\"id\":\"a\"}"), records);
    }

    @Test
    @DisplayName("replaceAll writes the new records and deletes keys no longer present")
    void replaceAllDeletesStaleKeys() {
        keysInRedis("snap:entry:a", "snap:entry:b");
        Map<String, String> records = Map.of("snap:entry:a", "{}", "snap:entry:c", "{}");

        store.replaceAll("snap:entry:", records);

        verify(values).multiSet(records);
        verify(redis).delete(Set.of("snap:entry:b"));
    }

    @Test
    @DisplayName("replaceAll with nothing stale deletes nothing")
    void replaceAllWithoutStaleKeys() {
        keysInRedis("snap:entry:a");

        store.replaceAll("snap:entry:", Map.of("snap:entry:a", "{}"));

        verify(redis, never()).delete(anyCollection());
    }

    @Test
    @DisplayName("Closed trades are appended to the right of the list and read in order")
    void closedTradeList() {
        when(lists.range("trades", 0, -1)).thenReturn(List.of("t1", "t2"));

        store.append("trades", "t3");

        verify(lists).rightPush("trades", "t3");
        assertEquals(List.of("t1", "t2"), store.readList("trades"));
    }

    @Test
    @DisplayName("Missing list reads as empty")
    void missingListIsEmpty() {
        when(lists.range("trades", 0, -1)).thenReturn(null);

        assertTrue(store.readList("trades").isEmpty());
    }
}
