package com.phoenix.worker.runtime;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Pending cancellation signals. A signal may arrive before its instance is dequeued.
 */
@Component
public class CancellationRegistry {

    private final Set<UUID> requested = ConcurrentHashMap.newKeySet();

    public void request(UUID instanceId) {
        requested.add(instanceId);
    }

    public boolean isRequested(UUID instanceId) {
        return requested.contains(instanceId);
    }

    public void clear(UUID instanceId) {
        requested.remove(instanceId);
    }
}
