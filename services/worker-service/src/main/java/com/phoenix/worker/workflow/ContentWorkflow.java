package com.phoenix.worker.workflow;

import com.phoenix.worker.client.GenerationContext;
import com.phoenix.worker.config.WorkerProperties;
import com.phoenix.worker.domain.ContentDraft;
import com.phoenix.worker.domain.FailureKind;
import com.phoenix.worker.domain.FailureReason;
import com.phoenix.worker.domain.GeneratedContentEntity;
import com.phoenix.worker.domain.InstanceView;
import com.phoenix.worker.domain.KnowledgeEntity;
import com.phoenix.worker.domain.KnowledgeRecord;
import com.phoenix.worker.domain.KnowledgeSource;
import com.phoenix.worker.domain.MediaAsset;
import com.phoenix.worker.domain.ResearchFinding;
import com.phoenix.worker.domain.Subject;
import com.phoenix.worker.domain.WorkItem;
import com.phoenix.worker.domain.WorkflowKind;
import com.phoenix.worker.domain.WorkflowResult;
import com.phoenix.worker.domain.WorkflowState;
import com.phoenix.worker.research.FunnelRequest;
import com.phoenix.worker.research.FunnelResult;
import com.phoenix.worker.runtime.ActivityFailedException;
import com.phoenix.worker.runtime.ActivityNames;
import com.phoenix.worker.runtime.CancellationRegistry;
import com.phoenix.worker.runtime.ValidationException;
import java.time.Clock;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Drives an instance through
 * {@code CREATED -> KNOWLEDGE_CHECK -> [RESEARCHING] -> SYNTHESIZING -> GENERATING -> PERSISTING -> COMPLETED}.
 * Research is skipped when the knowledge store already covers the subject.
 * <p>
 * Cancellation is checked before every step and after every external call; a result that arrives
 * after cancellation is not applied.
 */
@Component
public class ContentWorkflow {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContentWorkflow.class);

    private final Map<WorkflowKind, ContentStrategy> strategies = new EnumMap<>(WorkflowKind.class);
    private final ActivityPool pool;
    private final CancellationRegistry cancellations;
    private final WorkerProperties properties;
    private final Clock clock;

    public ContentWorkflow(
        List<ContentStrategy> strategies,
        ActivityPool pool,
        CancellationRegistry cancellations,
        WorkerProperties properties,
        Clock clock
    ) {
        strategies.forEach(strategy -> this.strategies.put(strategy.kind(), strategy));
        this.pool = pool;
        this.cancellations = cancellations;
        this.properties = properties;
        this.clock = clock;
    }

    public WorkflowInstance newInstance(WorkItem item) {
        return new WorkflowInstance(item, properties.getCostCeilingMicros(), clock);
    }

    public InstanceView run(WorkflowInstance instance) {
        MDC.put("instanceId", String.valueOf(instance.instanceId()));
        MDC.put("workflowKind", String.valueOf(instance.item().kind()));
        try {
            while (!instance.state().isTerminal()) {
                ensureNotCancelled(instance);
                step(instance);
            }
        } catch (InstanceCancelledException ex) {
            instance.cancel();
            LOGGER.info("Instance {} cancelled", instance.instanceId());
        } catch (ActivityFailedException ex) {
            instance.fail(ex.getReason());
            LOGGER.error("Instance {} failed: {}", instance.instanceId(), ex.getReason().describe());
        } catch (ValidationException | IllegalArgumentException ex) {
            instance.fail(new FailureReason(FailureKind.VALIDATION, stepName(instance), ex.getMessage()));
            LOGGER.error("Instance {} rejected: {}", instance.instanceId(), ex.getMessage());
        } catch (RuntimeException ex) {
            instance.fail(new FailureReason(FailureKind.TRANSIENT, stepName(instance), String.valueOf(ex.getMessage())));
            LOGGER.error("Instance {} failed unexpectedly in {}", instance.instanceId(), instance.state(), ex);
        } finally {
            cancellations.clear(instance.instanceId());
            MDC.remove("instanceId");
            MDC.remove("workflowKind");
        }
        return instance.toView();
    }

    private void step(WorkflowInstance instance) {
        switch (instance.state()) {
            case CREATED -> start(instance);
            case KNOWLEDGE_CHECK -> checkKnowledge(instance);
            case RESEARCHING -> research(instance);
            case SYNTHESIZING -> synthesize(instance);
            case GENERATING -> generate(instance);
            case PERSISTING -> persist(instance);
            default -> throw new IllegalStateException("No step for state " + instance.state());
        }
    }

    private void start(WorkflowInstance instance) {
        WorkflowKind kind = WorkflowKind.parse(instance.item().kind());
        if (!strategies.containsKey(kind)) {
            throw new ValidationException("No workflow registered for kind " + kind);
        }
        instance.bind(Subject.of(instance.item().subjectName(), kind, clock.instant()));
        move(instance, WorkflowState.KNOWLEDGE_CHECK);
    }

    private void checkKnowledge(WorkflowInstance instance) {
        Subject subject = instance.subject();
        KnowledgeRecord record;
        try {
            record = pool.invoker().invoke(instance, ActivityNames.KNOWLEDGE_LOOKUP, subject.id(),
                () -> pool.knowledge().lookup(subject));
        } catch (ActivityFailedException ex) {
            LOGGER.warn("Knowledge lookup for {} gave up, continuing without it: {}", subject.id(), ex.getMessage());
            record = KnowledgeRecord.empty(subject, KnowledgeSource.UNAVAILABLE);
        }
        ensureNotCancelled(instance);
        instance.setKnowledge(record);

        if (record.coverage() >= properties.getCoverageThreshold()) {
            LOGGER.info("Knowledge for {} already at coverage {}, skipping research", subject.id(), record.coverage());
            move(instance, WorkflowState.SYNTHESIZING);
        } else {
            move(instance, WorkflowState.RESEARCHING);
        }
    }

    private void research(WorkflowInstance instance) {
        Subject subject = instance.subject();
        FunnelResult result = pool.funnel().run(new FunnelRequest(
            instance,
            subject,
            strategyFor(instance).searchQueries(subject),
            instance.knowledge(),
            instance.ledger(),
            instance
        ));
        ensureNotCancelled(instance);
        instance.publish(result.findings());
        instance.recordResearch(result.coverage(), result.partial(), result.degraded());
        LOGGER.info("Research for {} finished with {} findings ({} usable), coverage {}, cost {} micros{}",
            subject.id(), result.findings().size(), result.usableCount(), result.coverage(), result.costMicros(),
            result.partial() ? ", partial" : "");
        move(instance, WorkflowState.SYNTHESIZING);
    }

    private void synthesize(WorkflowInstance instance) {
        KnowledgeRecord enriched = pool.knowledge().enrich(instance.knowledge(), instance.findings());
        instance.setKnowledge(enriched);
        pool.knowledge().deposit(instance.instanceId(), enriched);
        move(instance, WorkflowState.GENERATING);
    }

    private void generate(WorkflowInstance instance) {
        GenerationContext context = contextFor(instance);
        ContentDraft draft = strategyFor(instance).generateDraft(instance, context, pool);
        ensureNotCancelled(instance);
        if (draft == null) {
            throw new ValidationException("Content generation returned no draft");
        }
        instance.setDraft(draft);
        move(instance, WorkflowState.PERSISTING);
    }

    private void persist(WorkflowInstance instance) {
        ContentStrategy strategy = strategyFor(instance);
        List<MediaAsset> media = strategy.generateMedia(instance, instance.draft(), pool);
        ensureNotCancelled(instance);
        instance.setMediaAssets(media);

        GeneratedContentEntity content = strategy.persist(instance, instance.draft(), pool);
        instance.complete(new WorkflowResult(
            content.getInstanceId(),
            content.getSlug(),
            instance.coverage(),
            instance.isPartial(),
            instance.isDegraded(),
            instance.ledger().spent(),
            instance.findings().size(),
            instance.mediaAssets()
        ));
        LOGGER.info("Instance {} completed {} content {}", instance.instanceId(), instance.subject().kind(), content.getSlug());
    }

    private GenerationContext contextFor(WorkflowInstance instance) {
        KnowledgeRecord knowledge = instance.knowledge();
        Map<String, String> facts = new LinkedHashMap<>();
        knowledge.entities().values().stream()
            .sorted(Comparator.comparing(KnowledgeEntity::name))
            .forEach(entity -> facts.put(entity.name(), entity.value()));
        List<GenerationContext.SourceRef> sources = instance.findings().stream()
            .filter(ResearchFinding::isUsable)
            .sorted(Comparator.comparingDouble(ResearchFinding::relevance).reversed()
                .thenComparing(ResearchFinding::sourceUrl))
            .map(finding -> new GenerationContext.SourceRef(
                finding.sourceUrl(), finding.tier().name(), finding.relevance(), finding.excerpt()))
            .toList();
        Subject subject = instance.subject();
        return new GenerationContext(
            subject.id(),
            subject.displayName(),
            subject.kind(),
            knowledge.narrative(),
            facts,
            sources,
            instance.coverage(),
            instance.isPartial() || instance.isDegraded()
        );
    }

    private ContentStrategy strategyFor(WorkflowInstance instance) {
        return strategies.get(instance.subject().kind());
    }

    private void move(WorkflowInstance instance, WorkflowState next) {
        LOGGER.info("Instance {} {} -> {}", instance.instanceId(), instance.state(), next);
        instance.transitionTo(next);
    }

    private void ensureNotCancelled(WorkflowInstance instance) {
        if (cancellations.isRequested(instance.instanceId())) {
            throw new InstanceCancelledException(instance.instanceId());
        }
    }

    private static String stepName(WorkflowInstance instance) {
        return instance.state().name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
