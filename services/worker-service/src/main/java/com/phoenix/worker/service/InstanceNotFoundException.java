package com.phoenix.worker.service;

import java.util.UUID;

public class InstanceNotFoundException extends RuntimeException {

    public InstanceNotFoundException(UUID instanceId) {
        super("Workflow instance not found: " + instanceId);
    }
}
