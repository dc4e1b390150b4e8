package com.phoenix.worker.runtime;

import com.phoenix.worker.config.WorkerProperties;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Executors and shared runtime services of the worker.
 * <p>
 * Workflow steps run on a fixed pool sized to the concurrency ceiling. External calls run on a
 * separate activity pool with a direct hand-off, so a waiting instance never holds back another; a
 * saturated activity pool rejects instead of running the call untimed on the caller. Crawl fan-out
 * waits on activity calls from its own pool.
 */
@Configuration
public class WorkerExecutorConfig {

    @Bean
    @ConditionalOnMissingBean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "workflowExecutor")
    ExecutorService workflowExecutor(WorkerProperties properties) {
        int ceiling = Math.max(1, properties.getConcurrencyCeiling());
        return new ThreadPoolExecutor(
            ceiling,
            ceiling,
            60L,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(),
            namedThreads("workflow-"),
            new ThreadPoolExecutor.AbortPolicy()
        );
    }

    @Bean(name = "activityExecutor")
    ExecutorService activityExecutor() {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
            16,
            256,
            60L,
            TimeUnit.SECONDS,
            new SynchronousQueue<>(),
            namedThreads("activity-"),
            new ThreadPoolExecutor.AbortPolicy()
        );
        executor.allowCoreThreadTimeOut(false);
        return executor;
    }

    @Bean(name = "crawlExecutor")
    ExecutorService crawlExecutor(WorkerProperties properties) {
        int fanOut = Math.max(1, properties.getConcurrencyCeiling()) * Math.max(1, properties.getCrawlCandidateBudget());
        return new ThreadPoolExecutor(
            0,
            fanOut,
            60L,
            TimeUnit.SECONDS,
            new SynchronousQueue<>(),
            namedThreads("crawl-"),
            new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    @Bean
    IdempotencyStore idempotencyStore(WorkerProperties properties) {
        return new IdempotencyStore(
            Duration.ofMinutes(Math.max(1, properties.getIdempotencyTtlMinutes())),
            Math.max(1, properties.getIdempotencyMaxEntries())
        );
    }

    @Bean
    ActivityInvoker activityInvoker(
        ActivityPolicies policies,
        IdempotencyStore idempotencyStore,
        @Qualifier("activityExecutor") ExecutorService activityExecutor
    ) {
        return new ActivityInvoker(policies, idempotencyStore, activityExecutor);
    }

    @Bean
    @ConditionalOnMissingBean(TaskQueue.class)
    TaskQueue taskQueue(WorkerProperties properties) {
        return new InMemoryTaskQueue(properties.getTaskQueueName());
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger index = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + index.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
    }
}
