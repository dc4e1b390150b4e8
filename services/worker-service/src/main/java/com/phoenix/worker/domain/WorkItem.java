package com.phoenix.worker.domain;

import java.util.UUID;

public record WorkItem(
    UUID instanceId,
    String kind,
    String subjectName
) {
}
