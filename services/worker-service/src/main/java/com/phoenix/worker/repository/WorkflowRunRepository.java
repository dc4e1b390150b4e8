package com.phoenix.worker.repository;

import com.phoenix.worker.domain.WorkflowRunEntity;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface WorkflowRunRepository extends JpaRepository<WorkflowRunEntity, UUID> {
}
