package com.phoenix.worker.workflow;

import com.phoenix.worker.domain.ContentDraft;
import com.phoenix.worker.domain.FailureReason;
import com.phoenix.worker.domain.InstanceView;
import com.phoenix.worker.domain.KnowledgeRecord;
import com.phoenix.worker.domain.MediaAsset;
import com.phoenix.worker.domain.ResearchFinding;
import com.phoenix.worker.domain.Subject;
import com.phoenix.worker.domain.WorkItem;
import com.phoenix.worker.domain.WorkflowKind;
import com.phoenix.worker.domain.WorkflowResult;
import com.phoenix.worker.domain.WorkflowState;
import com.phoenix.worker.research.CostLedger;
import com.phoenix.worker.research.FindingSink;
import com.phoenix.worker.runtime.ActivityScope;
import com.phoenix.worker.service.PersistRequest;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * State of one workflow execution. Only the engine driving the instance mutates it; views may be
 * taken from any thread.
 */
public class WorkflowInstance implements ActivityScope, FindingSink {

    private final UUID instanceId;
    private final WorkItem item;
    private final CostLedger ledger;
    private final Clock clock;
    private final Instant startedAt;

    private WorkflowState state = WorkflowState.CREATED;
    private final List<WorkflowState> history = new ArrayList<>(List.of(WorkflowState.CREATED));
    private final Map<String, ResearchFinding> findings = new LinkedHashMap<>();
    private final Map<String, Integer> attempts = new HashMap<>();

    private WorkflowKind kind;
    private Subject subject;
    private KnowledgeRecord knowledge;
    private double coverage;
    private boolean partial;
    private boolean degraded;
    private ContentDraft draft;
    private List<MediaAsset> mediaAssets = List.of();
    private WorkflowResult result;
    private FailureReason failure;
    private Instant completedAt;

    public WorkflowInstance(WorkItem item, long costCeilingMicros, Clock clock) {
        this.instanceId = item.instanceId();
        this.item = item;
        this.ledger = new CostLedger(costCeilingMicros);
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @Override
    public UUID instanceId() {
        return instanceId;
    }

    public WorkItem item() {
        return item;
    }

    public CostLedger ledger() {
        return ledger;
    }

    @Override
    public synchronized void recordAttempt(String activity) {
        attempts.merge(activity, 1, Integer::sum);
    }

    public synchronized int attempts(String activity) {
        return attempts.getOrDefault(activity, 0);
    }

    @Override
    public synchronized void publish(Collection<ResearchFinding> current) {
        findings.clear();
        current.forEach(finding -> findings.put(finding.sourceUrl(), finding));
    }

    public synchronized List<ResearchFinding> findings() {
        return List.copyOf(findings.values());
    }

    public synchronized WorkflowState state() {
        return state;
    }

    public synchronized List<WorkflowState> history() {
        return List.copyOf(history);
    }

    synchronized void transitionTo(WorkflowState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Instance " + instanceId + " already " + state);
        }
        state = next;
        history.add(next);
        if (next.isTerminal()) {
            completedAt = clock.instant();
        }
    }

    synchronized void fail(FailureReason reason) {
        failure = reason;
        transitionTo(WorkflowState.FAILED);
    }

    synchronized void cancel() {
        transitionTo(WorkflowState.CANCELLED);
    }

    synchronized void complete(WorkflowResult completed) {
        result = completed;
        transitionTo(WorkflowState.COMPLETED);
    }

    synchronized void bind(Subject bound) {
        subject = bound;
        kind = bound.kind();
    }

    public synchronized Subject subject() {
        return subject;
    }

    public synchronized KnowledgeRecord knowledge() {
        return knowledge;
    }

    synchronized void setKnowledge(KnowledgeRecord record) {
        knowledge = record;
        coverage = Math.max(coverage, record.coverage());
        degraded |= record.isDegraded();
    }

    public synchronized double coverage() {
        return coverage;
    }

    synchronized void recordResearch(double researchedCoverage, boolean researchPartial, boolean researchDegraded) {
        coverage = Math.max(coverage, researchedCoverage);
        partial |= researchPartial;
        degraded |= researchDegraded;
    }

    public synchronized boolean isPartial() {
        return partial;
    }

    public synchronized boolean isDegraded() {
        return degraded;
    }

    public synchronized ContentDraft draft() {
        return draft;
    }

    synchronized void setDraft(ContentDraft generated) {
        draft = generated;
    }

    public synchronized List<MediaAsset> mediaAssets() {
        return mediaAssets;
    }

    synchronized void setMediaAssets(List<MediaAsset> assets) {
        mediaAssets = List.copyOf(assets);
    }

    public synchronized FailureReason failure() {
        return failure;
    }

    public synchronized WorkflowResult result() {
        return result;
    }

    synchronized PersistRequest toPersistRequest(ContentDraft content, List<MediaAsset> assets) {
        return new PersistRequest(instanceId, subject, content, List.copyOf(findings.values()), assets, coverage, partial || degraded);
    }

    public synchronized InstanceView toView() {
        return new InstanceView(
            instanceId,
            kind,
            subject == null ? null : subject.id(),
            subject == null ? item.subjectName() : subject.displayName(),
            state,
            List.copyOf(history),
            findings.size(),
            ledger.spent(),
            startedAt,
            completedAt,
            failure,
            result
        );
    }
}
