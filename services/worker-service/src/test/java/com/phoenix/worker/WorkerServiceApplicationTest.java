package com.phoenix.worker;

import static org.assertj.core.api.Assertions.assertThat;

import com.phoenix.worker.runtime.UnifiedWorker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class WorkerServiceApplicationTest {

    @Autowired
    private UnifiedWorker worker;

    @Test
    void contextLoads() {
        assertThat(worker.isRunning()).isTrue();
        assertThat(worker.queueName()).isEqualTo("phoenix-queue");
    }
}
