package com.phoenix.worker.domain;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record InstanceView(
    UUID instanceId,
    WorkflowKind kind,
    String subjectId,
    String subjectName,
    WorkflowState state,
    List<WorkflowState> history,
    int findingCount,
    long costMicros,
    Instant startedAt,
    Instant completedAt,
    FailureReason failure,
    WorkflowResult result
) {
}
