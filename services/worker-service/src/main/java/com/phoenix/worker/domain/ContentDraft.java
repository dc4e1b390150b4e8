package com.phoenix.worker.domain;

import java.util.List;
import java.util.Map;

public record ContentDraft(
    String title,
    String slug,
    String summary,
    String body,
    Map<String, String> fields,
    List<String> tags,
    List<String> sources
) {

    public ContentDraft {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
        tags = tags == null ? List.of() : List.copyOf(tags);
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
