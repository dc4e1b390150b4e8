package com.phoenix.worker.controller;

import com.phoenix.worker.domain.InstanceView;
import com.phoenix.worker.domain.WorkflowStartRequest;
import com.phoenix.worker.domain.WorkflowStartResponse;
import com.phoenix.worker.domain.WorkflowState;
import com.phoenix.worker.service.WorkflowSubmissionService;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/workflows")
public class WorkflowController {

    private final WorkflowSubmissionService submissionService;

    public WorkflowController(WorkflowSubmissionService submissionService) {
        this.submissionService = submissionService;
    }

    @PostMapping
    public ResponseEntity<WorkflowStartResponse> start(@Valid @RequestBody WorkflowStartRequest request) {
        UUID instanceId = submissionService.submit(request);
        return ResponseEntity.accepted().body(new WorkflowStartResponse(instanceId, WorkflowState.CREATED));
    }

    @GetMapping("/{instanceId}")
    public InstanceView get(@PathVariable UUID instanceId) {
        return submissionService.get(instanceId);
    }

    @PostMapping("/{instanceId}/cancel")
    public ResponseEntity<InstanceView> cancel(@PathVariable UUID instanceId) {
        return ResponseEntity.accepted().body(submissionService.cancel(instanceId));
    }
}
