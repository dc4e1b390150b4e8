package com.phoenix.worker.workflow;

import com.phoenix.worker.client.ContentGenerator;
import com.phoenix.worker.client.MediaGenerator;
import com.phoenix.worker.knowledge.KnowledgeCacheGateway;
import com.phoenix.worker.research.ResearchFunnel;
import com.phoenix.worker.runtime.ActivityInvoker;
import com.phoenix.worker.service.ContentPersistenceService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WorkflowConfig {

    @Bean
    ActivityPool activityPool(
        KnowledgeCacheGateway knowledge,
        ResearchFunnel funnel,
        ContentGenerator generator,
        MediaGenerator media,
        ContentPersistenceService persistence,
        ActivityInvoker invoker
    ) {
        return new ActivityPool(knowledge, funnel, generator, media, persistence, invoker);
    }
}
