package com.phoenix.worker.service;

import com.phoenix.worker.domain.InstanceView;
import com.phoenix.worker.domain.WorkItem;
import com.phoenix.worker.domain.WorkflowKind;
import com.phoenix.worker.domain.WorkflowStartRequest;
import com.phoenix.worker.runtime.CancellationRegistry;
import com.phoenix.worker.runtime.InstanceRegistry;
import com.phoenix.worker.runtime.TaskQueue;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class WorkflowSubmissionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkflowSubmissionService.class);

    private final TaskQueue queue;
    private final InstanceRegistry registry;
    private final CancellationRegistry cancellations;

    public WorkflowSubmissionService(TaskQueue queue, InstanceRegistry registry, CancellationRegistry cancellations) {
        this.queue = queue;
        this.registry = registry;
        this.cancellations = cancellations;
    }

    public UUID submit(WorkflowStartRequest request) {
        WorkflowKind kind = WorkflowKind.parse(request.kind());
        WorkItem item = new WorkItem(UUID.randomUUID(), kind.name(), request.subject().trim());
        registry.accept(item);
        queue.enqueue(item);
        LOGGER.info("Queued {} instance {} for '{}' on {}", kind, item.instanceId(), item.subjectName(), queue.name());
        return item.instanceId();
    }

    public InstanceView get(UUID instanceId) {
        return registry.find(instanceId).orElseThrow(() -> new InstanceNotFoundException(instanceId));
    }

    /**
     * Signals cancellation; the instance stops at its next state boundary. A request that loses the race
     * with the instance finishing is withdrawn so it cannot linger in the cancellation registry.
     */
    public InstanceView cancel(UUID instanceId) {
        InstanceView view = get(instanceId);
        if (!view.state().isTerminal() && registry.isActive(instanceId)) {
            cancellations.request(instanceId);
            if (!registry.isActive(instanceId)) {
                cancellations.clear(instanceId);
                LOGGER.debug("Instance {} finished before its cancellation was seen", instanceId);
                return get(instanceId);
            }
            LOGGER.info("Cancellation requested for instance {}", instanceId);
        }
        return view;
    }
}
