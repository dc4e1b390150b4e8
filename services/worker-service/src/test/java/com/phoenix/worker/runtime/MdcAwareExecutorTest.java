package com.phoenix.worker.runtime;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class MdcAwareExecutorTest {

    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        pool = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
        pool.shutdownNow();
    }

    @Test
    @DisplayName("tasks see the submitting thread's instance id and leave the pool thread clean")
    void carriesContextIntoTask() {
        // given
        MdcAwareExecutor executor = new MdcAwareExecutor(pool);
        MDC.put("instanceId", "4f1c");

        // when
        String inside = CompletableFuture.supplyAsync(() -> MDC.get("instanceId"), executor).join();
        MDC.clear();
        String afterwards = CompletableFuture.supplyAsync(() -> MDC.get("instanceId"), pool).join();

        // then
        assertThat(inside).isEqualTo("4f1c");
        assertThat(afterwards).isNull();
    }

    @Test
    @DisplayName("a task run on the submitting thread restores that thread's context")
    void restoresCallerContext() {
        // given
        MdcAwareExecutor executor = new MdcAwareExecutor(Runnable::run);
        MDC.put("instanceId", "caller");

        // when
        executor.execute(() -> MDC.put("instanceId", "changed-inside"));

        // then
        assertThat(MDC.get("instanceId")).isEqualTo("caller");
    }
}
