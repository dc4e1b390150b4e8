package com.phoenix.worker.runtime;

import com.phoenix.worker.config.WorkerProperties;
import com.phoenix.worker.domain.InstanceView;
import com.phoenix.worker.domain.WorkItem;
import com.phoenix.worker.workflow.ContentWorkflow;
import com.phoenix.worker.workflow.WorkflowInstance;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Single worker for every workflow kind. A poller thread takes a slot of the global concurrency
 * ceiling, dequeues one work item and runs its instance on the workflow executor; the slot is
 * returned once the instance is terminal.
 */
@Component
public class UnifiedWorker implements SmartLifecycle {

    private static final Logger LOGGER = LoggerFactory.getLogger(UnifiedWorker.class);

    private final TaskQueue queue;
    private final ContentWorkflow workflow;
    private final InstanceRegistry registry;
    private final ExecutorService workflowExecutor;
    private final int ceiling;
    private final Duration pollTimeout;
    private final Semaphore slots;
    private final AtomicInteger inFlight = new AtomicInteger();

    private volatile boolean running;
    private Thread poller;

    public UnifiedWorker(
        TaskQueue queue,
        ContentWorkflow workflow,
        InstanceRegistry registry,
        @Qualifier("workflowExecutor") ExecutorService workflowExecutor,
        WorkerProperties properties
    ) {
        this.queue = queue;
        this.workflow = workflow;
        this.registry = registry;
        this.workflowExecutor = workflowExecutor;
        this.ceiling = Math.max(1, properties.getConcurrencyCeiling());
        this.pollTimeout = Duration.ofMillis(Math.max(1, properties.getPollTimeoutMs()));
        this.slots = new Semaphore(ceiling, true);
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        poller = new Thread(this::pollLoop, "worker-poller-" + queue.name());
        poller.setDaemon(true);
        poller.start();
        LOGGER.info("Worker polling queue {} with concurrency ceiling {}", queue.name(), ceiling);
    }

    @Override
    public synchronized void stop() {
        running = false;
        if (poller != null) {
            poller.interrupt();
            try {
                poller.join(pollTimeout.toMillis() * 2);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            poller = null;
        }
        LOGGER.info("Worker stopped polling queue {} with {} instances in flight", queue.name(), inFlight.get());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int ceiling() {
        return ceiling;
    }

    public String queueName() {
        return queue.name();
    }

    public int queueDepth() {
        return queue.depth();
    }

    private void pollLoop() {
        while (running) {
            try {
                if (!slots.tryAcquire(pollTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    continue;
                }
                Optional<WorkItem> item;
                try {
                    item = queue.poll(pollTimeout);
                } catch (InterruptedException ex) {
                    slots.release();
                    throw ex;
                }
                if (item.isEmpty()) {
                    slots.release();
                    continue;
                }
                launch(item.get());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException ex) {
                LOGGER.error("Worker poll loop error on queue {}", queue.name(), ex);
            }
        }
    }

    /**
     * Runs one dequeued item. The caller must already hold a slot; it is released here.
     */
    CompletableFuture<InstanceView> launch(WorkItem item) {
        WorkflowInstance instance = workflow.newInstance(item);
        if (!registry.register(instance)) {
            LOGGER.warn("Dropping duplicate delivery of instance {}", item.instanceId());
            slots.release();
            return CompletableFuture.completedFuture(registry.find(item.instanceId()).orElse(instance.toView()));
        }

        inFlight.incrementAndGet();
        try {
            return CompletableFuture.supplyAsync(() -> workflow.run(instance), workflowExecutor)
                .whenComplete((view, error) -> {
                    if (error != null) {
                        LOGGER.error("Instance {} ended abnormally", item.instanceId(), error);
                    }
                    finish(instance);
                });
        } catch (RejectedExecutionException ex) {
            LOGGER.error("Workflow executor rejected instance {}", item.instanceId(), ex);
            finish(instance);
            return CompletableFuture.failedFuture(ex);
        }
    }

    private void finish(WorkflowInstance instance) {
        try {
            registry.archive(instance);
        } finally {
            inFlight.decrementAndGet();
            slots.release();
        }
    }
}
