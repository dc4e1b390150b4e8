package com.phoenix.worker.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Archived outcome of a workflow instance that reached a terminal state.
 */
@Entity
@Table(name = "workflow_runs")
public class WorkflowRunEntity {

    @Id
    @Column(name = "instance_id", nullable = false, updatable = false)
    private UUID instanceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind")
    private WorkflowKind kind;

    @Column(name = "subject_id")
    private String subjectId;

    @Column(name = "subject_name")
    private String subjectName;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false)
    private WorkflowState state;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "finding_count", nullable = false)
    private int findingCount;

    @Column(name = "cost_micros", nullable = false)
    private long costMicros;

    @Column(name = "partial_coverage", nullable = false)
    private boolean partialCoverage;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_kind")
    private FailureKind failureKind;

    @Column(name = "error_summary")
    private String errorSummary;

    public static WorkflowRunEntity archive(InstanceView view) {
        WorkflowRunEntity run = new WorkflowRunEntity();
        run.instanceId = view.instanceId();
        run.kind = view.kind();
        run.subjectId = view.subjectId();
        run.subjectName = view.subjectName();
        run.state = view.state();
        run.startedAt = view.startedAt();
        run.completedAt = view.completedAt();
        run.findingCount = view.findingCount();
        run.costMicros = view.costMicros();
        run.partialCoverage = view.result() != null && view.result().partial();
        if (view.failure() != null) {
            run.failureKind = view.failure().kind();
            run.errorSummary = truncate(view.failure().describe(), 400);
        }
        return run;
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }

    public UUID getInstanceId() {
        return instanceId;
    }

    public WorkflowKind getKind() {
        return kind;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getSubjectName() {
        return subjectName;
    }

    public WorkflowState getState() {
        return state;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public int getFindingCount() {
        return findingCount;
    }

    public long getCostMicros() {
        return costMicros;
    }

    public boolean isPartialCoverage() {
        return partialCoverage;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public String getErrorSummary() {
        return errorSummary;
    }
}
