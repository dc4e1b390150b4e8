package com.phoenix.worker.runtime;

import com.phoenix.worker.domain.WorkItem;
import java.time.Duration;
import java.util.Optional;

/**
 * The single named queue both workflow kinds are delivered through. Delivery is at-least-once.
 */
public interface TaskQueue {

    String name();

    void enqueue(WorkItem item);

    Optional<WorkItem> poll(Duration timeout) throws InterruptedException;

    int depth();
}
