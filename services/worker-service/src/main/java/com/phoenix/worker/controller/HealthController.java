package com.phoenix.worker.controller;

import com.phoenix.worker.knowledge.DepositFailureLog;
import com.phoenix.worker.runtime.UnifiedWorker;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final UnifiedWorker worker;
    private final DepositFailureLog depositFailures;

    public HealthController(UnifiedWorker worker, DepositFailureLog depositFailures) {
        this.worker = worker;
        this.depositFailures = depositFailures;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of(
            "status", worker.isRunning() ? "ok" : "stopped",
            "service", "worker-service",
            "taskQueue", worker.queueName(),
            "queueDepth", worker.queueDepth(),
            "inFlight", worker.inFlight(),
            "concurrencyCeiling", worker.ceiling(),
            "failedDeposits", depositFailures.total()
        );
    }
}
