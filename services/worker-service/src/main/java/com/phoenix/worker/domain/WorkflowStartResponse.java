package com.phoenix.worker.domain;

import java.util.UUID;

public record WorkflowStartResponse(UUID instanceId, WorkflowState state) {
}
