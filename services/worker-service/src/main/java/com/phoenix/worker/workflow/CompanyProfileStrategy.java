package com.phoenix.worker.workflow;

import com.phoenix.worker.client.GenerationContext;
import com.phoenix.worker.domain.ContentDraft;
import com.phoenix.worker.domain.GeneratedContentEntity;
import com.phoenix.worker.domain.Subject;
import com.phoenix.worker.domain.WorkflowKind;
import com.phoenix.worker.runtime.ActivityNames;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class CompanyProfileStrategy implements ContentStrategy {

    @Override
    public WorkflowKind kind() {
        return WorkflowKind.COMPANY;
    }

    @Override
    public List<String> searchQueries(Subject subject) {
        return List.of("\"" + subject.displayName() + "\" company");
    }

    @Override
    public ContentDraft generateDraft(WorkflowInstance instance, GenerationContext context, ActivityPool pool) {
        return pool.invoker().invoke(instance, ActivityNames.GENERATE_DRAFT, context,
            () -> pool.generator().generateCompanyProfile(context));
    }

    @Override
    public GeneratedContentEntity persist(WorkflowInstance instance, ContentDraft draft, ActivityPool pool) {
        return pool.invoker().invoke(instance, ActivityNames.PERSIST, instance.instanceId(),
            () -> pool.persistence().persist(instance.toPersistRequest(draft, List.of())));
    }
}
