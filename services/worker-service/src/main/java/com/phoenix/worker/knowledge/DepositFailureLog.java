package com.phoenix.worker.knowledge;

import com.google.common.collect.EvictingQueue;
import com.phoenix.worker.config.WorkerProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Side channel for knowledge deposits that could not be written. Keeps the most recent failures only.
 */
@Component
public class DepositFailureLog {

    private static final Logger LOGGER = LoggerFactory.getLogger(DepositFailureLog.class);

    private final EvictingQueue<DepositFailure> failures;
    private final Clock clock;
    private long total;

    public DepositFailureLog(WorkerProperties properties, Clock clock) {
        this.failures = EvictingQueue.create(Math.max(1, properties.getDepositFailureLogSize()));
        this.clock = clock;
    }

    public synchronized void record(UUID instanceId, String subjectId, double coverage, Throwable error) {
        String message = error == null ? "unknown" : String.valueOf(error.getMessage());
        LOGGER.warn("Knowledge deposit failed for subject {} (instance {}, coverage {}): {}",
            subjectId, instanceId, coverage, message);
        failures.add(new DepositFailure(instanceId, subjectId, coverage, message, clock.instant()));
        total++;
    }

    public synchronized List<DepositFailure> recent() {
        return List.copyOf(failures);
    }

    public synchronized long total() {
        return total;
    }

    public record DepositFailure(UUID instanceId, String subjectId, double coverage, String message, Instant at) {
    }
}
