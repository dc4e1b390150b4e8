package com.phoenix.worker.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.phoenix.worker.config.WorkerProperties;
import com.phoenix.worker.domain.InstanceView;
import com.phoenix.worker.domain.WorkItem;
import com.phoenix.worker.repository.WorkflowRunRepository;
import com.phoenix.worker.workflow.ContentWorkflow;
import com.phoenix.worker.workflow.WorkflowInstance;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class UnifiedWorkerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private ExecutorService workflowExecutor;
    private InMemoryTaskQueue queue;
    private ContentWorkflow workflow;
    private WorkflowRunRepository runRepository;
    private InstanceRegistry registry;
    private WorkerProperties properties;

    private final CountDownLatch gate = new CountDownLatch(1);
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxRunning = new AtomicInteger();
    private final AtomicInteger finished = new AtomicInteger();

    @BeforeEach
    void setUp() {
        workflowExecutor = Executors.newFixedThreadPool(8);
        queue = new InMemoryTaskQueue("phoenix-queue");
        workflow = mock(ContentWorkflow.class);
        runRepository = mock(WorkflowRunRepository.class);
        registry = new InstanceRegistry(runRepository, clock);
        properties = new WorkerProperties();
        properties.setConcurrencyCeiling(2);
        properties.setPollTimeoutMs(20);

        when(workflow.newInstance(any())).thenAnswer(invocation ->
            new WorkflowInstance(invocation.getArgument(0), properties.getCostCeilingMicros(), clock));
        when(workflow.run(any())).thenAnswer(invocation -> {
            WorkflowInstance instance = invocation.getArgument(0);
            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                gate.await(5, TimeUnit.SECONDS);
            } finally {
                running.decrementAndGet();
                finished.incrementAndGet();
            }
            return instance.toView();
        });
    }

    @AfterEach
    void tearDown() {
        gate.countDown();
        workflowExecutor.shutdownNow();
    }

    @Test
    @DisplayName("never runs more instances at once than the concurrency ceiling")
    void enforcesCeiling() {
        // given
        UnifiedWorker worker = new UnifiedWorker(queue, workflow, registry, workflowExecutor, properties);
        for (int i = 0; i < 5; i++) {
            queue.enqueue(new WorkItem(UUID.randomUUID(), "COMPANY", "Company " + i));
        }

        // when
        worker.start();
        try {
            awaitTrue(() -> worker.inFlight() == 2 && running.get() == 2);
            sleepQuietly(100);

            // then
            assertThat(worker.inFlight()).isEqualTo(2);
            assertThat(worker.queueDepth()).isEqualTo(3);
            assertThat(registry.liveCount()).isEqualTo(2);

            gate.countDown();
            awaitTrue(() -> finished.get() == 5 && worker.inFlight() == 0);
        } finally {
            worker.stop();
        }

        assertThat(maxRunning.get()).isEqualTo(2);
        assertThat(worker.queueDepth()).isZero();
        verify(runRepository, times(5)).save(any());
    }

    @Test
    @DisplayName("a redelivered item whose instance is still running is dropped")
    void dropsDuplicateOfLiveInstance() {
        // given
        UnifiedWorker worker = new UnifiedWorker(queue, workflow, registry, workflowExecutor, properties);
        WorkItem item = new WorkItem(UUID.randomUUID(), "ARTICLE", "Chip export rules");
        CompletableFuture<InstanceView> first = worker.launch(item);
        awaitTrue(() -> running.get() == 1);

        // when
        InstanceView duplicate = worker.launch(item).join();

        // then
        assertThat(duplicate.instanceId()).isEqualTo(item.instanceId());
        assertThat(worker.inFlight()).isEqualTo(1);
        gate.countDown();
        first.join();
        verify(workflow, times(1)).run(any());
    }

    @Test
    @DisplayName("a redelivered item whose instance already finished is dropped")
    void dropsDuplicateOfFinishedInstance() {
        // given
        gate.countDown();
        UnifiedWorker worker = new UnifiedWorker(queue, workflow, registry, workflowExecutor, properties);
        WorkItem item = new WorkItem(UUID.randomUUID(), "COMPANY", "Acme Corp");
        worker.launch(item).join();

        // when
        InstanceView duplicate = worker.launch(item).join();

        // then
        assertThat(duplicate.instanceId()).isEqualTo(item.instanceId());
        verify(workflow, times(1)).run(any());
        verify(runRepository, times(1)).save(any());
        assertThat(worker.inFlight()).isZero();
    }

    private static void awaitTrue(BooleanSupplier condition) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            sleepQuietly(5);
        }
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AssertionError(ex);
        }
    }
}
