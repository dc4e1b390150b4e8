package com.phoenix.worker.runtime;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.phoenix.worker.domain.InstanceView;
import com.phoenix.worker.domain.WorkItem;
import com.phoenix.worker.domain.WorkflowRunEntity;
import com.phoenix.worker.domain.WorkflowState;
import com.phoenix.worker.repository.WorkflowRunRepository;
import com.phoenix.worker.workflow.WorkflowInstance;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Instances known to this worker: accepted but not yet dequeued, running, and recently finished.
 * Finished instances are also archived to {@code workflow_runs}.
 */
@Component
public class InstanceRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(InstanceRegistry.class);

    private final Map<UUID, InstanceView> accepted = new ConcurrentHashMap<>();
    private final Map<UUID, WorkflowInstance> live = new ConcurrentHashMap<>();
    private final Cache<UUID, InstanceView> finished = CacheBuilder.newBuilder().maximumSize(10_000).build();
    private final WorkflowRunRepository runRepository;
    private final Clock clock;

    public InstanceRegistry(WorkflowRunRepository runRepository, Clock clock) {
        this.runRepository = runRepository;
        this.clock = clock;
    }

    public void accept(WorkItem item) {
        accepted.putIfAbsent(item.instanceId(), new InstanceView(
            item.instanceId(), null, null, item.subjectName(), WorkflowState.CREATED,
            List.of(WorkflowState.CREATED), 0, 0L, clock.instant(), null, null, null));
    }

    /**
     * @return false when the instance id is already running or finished, i.e. a duplicate delivery
     */
    public boolean register(WorkflowInstance instance) {
        UUID id = instance.instanceId();
        if (finished.getIfPresent(id) != null) {
            return false;
        }
        if (live.putIfAbsent(id, instance) != null) {
            return false;
        }
        accepted.remove(id);
        return true;
    }

    public void archive(WorkflowInstance instance) {
        InstanceView view = instance.toView();
        finished.put(view.instanceId(), view);
        live.remove(view.instanceId());
        try {
            runRepository.save(WorkflowRunEntity.archive(view));
        } catch (DataAccessException ex) {
            LOGGER.warn("Could not archive instance {}: {}", view.instanceId(), ex.getMessage());
        }
    }

    public Optional<InstanceView> find(UUID instanceId) {
        WorkflowInstance running = live.get(instanceId);
        if (running != null) {
            return Optional.of(running.toView());
        }
        InstanceView done = finished.getIfPresent(instanceId);
        if (done != null) {
            return Optional.of(done);
        }
        return Optional.ofNullable(accepted.get(instanceId));
    }

    public boolean isActive(UUID instanceId) {
        return live.containsKey(instanceId) || accepted.containsKey(instanceId);
    }

    public int liveCount() {
        return live.size();
    }
}
