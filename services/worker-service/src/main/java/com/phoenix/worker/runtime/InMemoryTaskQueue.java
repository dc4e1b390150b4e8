package com.phoenix.worker.runtime;

import com.phoenix.worker.domain.WorkItem;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

public class InMemoryTaskQueue implements TaskQueue {

    private final String name;
    private final LinkedBlockingQueue<WorkItem> items = new LinkedBlockingQueue<>();

    public InMemoryTaskQueue(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void enqueue(WorkItem item) {
        Objects.requireNonNull(item, "item");
        Objects.requireNonNull(item.instanceId(), "instanceId");
        items.add(item);
    }

    @Override
    public Optional<WorkItem> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(items.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public int depth() {
        return items.size();
    }
}
