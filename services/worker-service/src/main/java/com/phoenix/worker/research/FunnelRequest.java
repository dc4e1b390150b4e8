package com.phoenix.worker.research;

import com.phoenix.worker.domain.KnowledgeRecord;
import com.phoenix.worker.domain.Subject;
import com.phoenix.worker.runtime.ActivityScope;
import java.util.List;

public record FunnelRequest(
    ActivityScope scope,
    Subject subject,
    List<String> queries,
    KnowledgeRecord prior,
    CostLedger ledger,
    FindingSink sink
) {

    public FunnelRequest {
        queries = queries == null ? List.of() : List.copyOf(queries);
        sink = sink == null ? findings -> { } : sink;
    }
}
