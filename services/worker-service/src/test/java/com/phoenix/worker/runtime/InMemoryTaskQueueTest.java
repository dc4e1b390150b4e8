package com.phoenix.worker.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.phoenix.worker.domain.WorkItem;
import java.time.Duration;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryTaskQueueTest {

    @Test
    @DisplayName("items come out in the order they were queued")
    void fifo() throws InterruptedException {
        InMemoryTaskQueue queue = new InMemoryTaskQueue("phoenix-queue");
        WorkItem first = new WorkItem(UUID.randomUUID(), "COMPANY", "Acme Corp");
        WorkItem second = new WorkItem(UUID.randomUUID(), "ARTICLE", "Chip export rules");

        queue.enqueue(first);
        queue.enqueue(second);

        assertThat(queue.name()).isEqualTo("phoenix-queue");
        assertThat(queue.depth()).isEqualTo(2);
        assertThat(queue.poll(Duration.ofMillis(10))).contains(first);
        assertThat(queue.poll(Duration.ofMillis(10))).contains(second);
        assertThat(queue.poll(Duration.ofMillis(10))).isEmpty();
    }

    @Test
    @DisplayName("items without an instance id are rejected")
    void requiresInstanceId() {
        InMemoryTaskQueue queue = new InMemoryTaskQueue("phoenix-queue");

        assertThatThrownBy(() -> queue.enqueue(new WorkItem(null, "COMPANY", "Acme Corp")))
            .isInstanceOf(NullPointerException.class);
    }
}
