package com.phoenix.worker.runtime;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IdempotencyStoreTest {

    private final IdempotencyStore store = new IdempotencyStore(Duration.ofMinutes(5), 100);

    @Test
    @DisplayName("keys ignore map ordering of the input")
    void keysAreCanonical() {
        UUID instanceId = UUID.randomUUID();
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("query", "acme");
        first.put("page", 1);
        Map<String, Object> second = new TreeMap<>();
        second.put("page", 1);
        second.put("query", "acme");

        assertThat(store.key(instanceId, "search", first)).isEqualTo(store.key(instanceId, "search", second));
        assertThat(store.key(instanceId, "search", first)).isNotEqualTo(store.key(instanceId, "crawl", first));
        assertThat(store.key(instanceId, "search", first)).isNotEqualTo(store.key(UUID.randomUUID(), "search", first));
    }

    @Test
    @DisplayName("markIfAbsent admits a key only once until it is forgotten")
    void marksOnce() {
        String key = store.key(UUID.randomUUID(), "knowledge-deposit", "record");

        assertThat(store.markIfAbsent(key)).isTrue();
        assertThat(store.markIfAbsent(key)).isFalse();
        store.forget(key);
        assertThat(store.markIfAbsent(key)).isTrue();
    }
}
