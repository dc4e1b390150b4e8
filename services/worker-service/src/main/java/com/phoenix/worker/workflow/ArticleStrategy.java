package com.phoenix.worker.workflow;

import com.phoenix.worker.client.GenerationContext;
import com.phoenix.worker.config.WorkerProperties;
import com.phoenix.worker.domain.ContentDraft;
import com.phoenix.worker.domain.GeneratedContentEntity;
import com.phoenix.worker.domain.MediaAsset;
import com.phoenix.worker.domain.Subject;
import com.phoenix.worker.domain.WorkflowKind;
import com.phoenix.worker.runtime.ActivityNames;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Articles are written about a topic and carry generated media, one asset per configured role.
 */
@Component
public class ArticleStrategy implements ContentStrategy {

    private final List<String> mediaRoles;

    public ArticleStrategy(WorkerProperties properties) {
        this.mediaRoles = List.copyOf(properties.getArticleMediaRoles());
    }

    @Override
    public WorkflowKind kind() {
        return WorkflowKind.ARTICLE;
    }

    @Override
    public List<String> searchQueries(Subject subject) {
        return List.of(subject.displayName());
    }

    @Override
    public ContentDraft generateDraft(WorkflowInstance instance, GenerationContext context, ActivityPool pool) {
        return pool.invoker().invoke(instance, ActivityNames.GENERATE_DRAFT, context,
            () -> pool.generator().generateArticle(context));
    }

    @Override
    public List<MediaAsset> generateMedia(WorkflowInstance instance, ContentDraft draft, ActivityPool pool) {
        List<MediaAsset> assets = new ArrayList<>();
        String prompt = mediaPrompt(instance.subject(), draft);
        for (String role : mediaRoles) {
            assets.add(pool.invoker().invoke(instance, ActivityNames.GENERATE_MEDIA, List.of(role, prompt),
                () -> pool.media().generateAsset(instance.subject().id(), role, prompt)));
        }
        return assets;
    }

    @Override
    public GeneratedContentEntity persist(WorkflowInstance instance, ContentDraft draft, ActivityPool pool) {
        return pool.invoker().invoke(instance, ActivityNames.PERSIST, instance.instanceId(),
            () -> pool.persistence().persist(instance.toPersistRequest(draft, instance.mediaAssets())));
    }

    private static String mediaPrompt(Subject subject, ContentDraft draft) {
        String title = draft.title() == null || draft.title().isBlank() ? subject.displayName() : draft.title();
        if (draft.summary() == null || draft.summary().isBlank()) {
            return title;
        }
        return title + ": " + draft.summary();
    }
}
