package com.phoenix.worker.workflow;

import com.phoenix.worker.client.ContentGenerator;
import com.phoenix.worker.client.MediaGenerator;
import com.phoenix.worker.knowledge.KnowledgeCacheGateway;
import com.phoenix.worker.research.ResearchFunnel;
import com.phoenix.worker.runtime.ActivityInvoker;
import com.phoenix.worker.service.ContentPersistenceService;

/**
 * Shared clients handed to every instance. Built once at startup and safe for concurrent use.
 */
public record ActivityPool(
    KnowledgeCacheGateway knowledge,
    ResearchFunnel funnel,
    ContentGenerator generator,
    MediaGenerator media,
    ContentPersistenceService persistence,
    ActivityInvoker invoker
) {
}
