package com.phoenix.worker.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.phoenix.worker.domain.WorkItem;
import com.phoenix.worker.domain.WorkflowRunEntity;
import com.phoenix.worker.domain.WorkflowState;
import com.phoenix.worker.repository.WorkflowRunRepository;
import com.phoenix.worker.workflow.WorkflowInstance;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

class InstanceRegistryTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private final WorkflowRunRepository runRepository = mock(WorkflowRunRepository.class);
    private final InstanceRegistry registry = new InstanceRegistry(runRepository, clock);

    @Test
    @DisplayName("an accepted item is visible as CREATED until the worker picks it up")
    void acceptedThenLive() {
        WorkItem item = new WorkItem(UUID.randomUUID(), "COMPANY", "Acme Corp");

        registry.accept(item);

        assertThat(registry.find(item.instanceId())).hasValueSatisfying(view -> {
            assertThat(view.state()).isEqualTo(WorkflowState.CREATED);
            assertThat(view.subjectName()).isEqualTo("Acme Corp");
        });
        assertThat(registry.isActive(item.instanceId())).isTrue();

        assertThat(registry.register(new WorkflowInstance(item, 1_000, clock))).isTrue();
        assertThat(registry.liveCount()).isEqualTo(1);
        assertThat(registry.register(new WorkflowInstance(item, 1_000, clock))).isFalse();
    }

    @Test
    @DisplayName("archiving keeps the view queryable and writes the run row")
    void archive() {
        // given
        WorkItem item = new WorkItem(UUID.randomUUID(), "ARTICLE", "Chip export rules");
        WorkflowInstance instance = new WorkflowInstance(item, 1_000, clock);
        registry.register(instance);

        // when
        registry.archive(instance);

        // then
        assertThat(registry.isActive(item.instanceId())).isFalse();
        assertThat(registry.find(item.instanceId())).isPresent();
        assertThat(registry.register(new WorkflowInstance(item, 1_000, clock))).isFalse();
        ArgumentCaptor<WorkflowRunEntity> saved = ArgumentCaptor.forClass(WorkflowRunEntity.class);
        verify(runRepository).save(saved.capture());
        assertThat(saved.getValue().getInstanceId()).isEqualTo(item.instanceId());
        assertThat(saved.getValue().getSubjectName()).isEqualTo("Chip export rules");
    }

    @Test
    @DisplayName("a database outage while archiving does not lose the finished view")
    void archiveSurvivesDatabaseOutage() {
        WorkItem item = new WorkItem(UUID.randomUUID(), "COMPANY", "Acme Corp");
        WorkflowInstance instance = new WorkflowInstance(item, 1_000, clock);
        registry.register(instance);
        when(runRepository.save(any())).thenThrow(new DataAccessResourceFailureException("db down"));

        registry.archive(instance);

        assertThat(registry.find(item.instanceId())).isPresent();
        assertThat(registry.liveCount()).isZero();
    }

    @Test
    @DisplayName("unknown ids are not found")
    void unknown() {
        assertThat(registry.find(UUID.randomUUID())).isEmpty();
    }
}
