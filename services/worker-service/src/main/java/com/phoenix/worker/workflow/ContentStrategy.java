package com.phoenix.worker.workflow;

import com.phoenix.worker.client.GenerationContext;
import com.phoenix.worker.domain.ContentDraft;
import com.phoenix.worker.domain.GeneratedContentEntity;
import com.phoenix.worker.domain.MediaAsset;
import com.phoenix.worker.domain.Subject;
import com.phoenix.worker.domain.WorkflowKind;
import java.util.List;

/**
 * The parts of a workflow that differ by kind. Knowledge check, research and synthesis are shared.
 */
public interface ContentStrategy {

    WorkflowKind kind();

    List<String> searchQueries(Subject subject);

    ContentDraft generateDraft(WorkflowInstance instance, GenerationContext context, ActivityPool pool);

    /**
     * Assets to attach before the content is persisted. None by default.
     */
    default List<MediaAsset> generateMedia(WorkflowInstance instance, ContentDraft draft, ActivityPool pool) {
        return List.of();
    }

    GeneratedContentEntity persist(WorkflowInstance instance, ContentDraft draft, ActivityPool pool);
}
