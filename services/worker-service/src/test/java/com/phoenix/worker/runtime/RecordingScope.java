package com.phoenix.worker.runtime;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

class RecordingScope implements ActivityScope {

    private final UUID instanceId = UUID.randomUUID();
    private final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();

    @Override
    public UUID instanceId() {
        return instanceId;
    }

    @Override
    public void recordAttempt(String activity) {
        attempts.computeIfAbsent(activity, key -> new AtomicInteger()).incrementAndGet();
    }

    int attempts(String activity) {
        AtomicInteger count = attempts.get(activity);
        return count == null ? 0 : count.get();
    }
}
