package com.phoenix.worker.workflow;

import java.util.UUID;

public class InstanceCancelledException extends RuntimeException {

    public InstanceCancelledException(UUID instanceId) {
        super("Instance " + instanceId + " was cancelled");
    }
}
