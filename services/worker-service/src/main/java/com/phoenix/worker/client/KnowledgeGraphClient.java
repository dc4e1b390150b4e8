package com.phoenix.worker.client;

import java.util.Optional;

public interface KnowledgeGraphClient {

    /**
     * @return the stored knowledge, or empty on a miss; throws when the service is unavailable
     */
    Optional<StoredKnowledge> lookup(String subjectId);

    void write(String subjectId, StoredKnowledge knowledge);
}
