package com.phoenix.worker.domain;

import java.text.Normalizer;
import java.time.Instant;
import java.util.Locale;

/**
 * The entity a workflow instance researches and writes about: a company or an article topic.
 */
public record Subject(
    String id,
    String displayName,
    WorkflowKind kind,
    Instant createdAt
) {

    public static Subject of(String displayName, WorkflowKind kind, Instant createdAt) {
        if (kind == null) {
            throw new IllegalArgumentException("Subject kind must not be null");
        }
        String name = displayName == null ? "" : displayName.trim();
        if (name.isBlank()) {
            throw new IllegalArgumentException("Subject name must not be blank");
        }
        String id = slugify(name);
        if (id.isBlank()) {
            throw new IllegalArgumentException("Subject name has no usable characters: " + displayName);
        }
        return new Subject(id, name, kind, createdAt);
    }

    static String slugify(String value) {
        String ascii = Normalizer.normalize(value, Normalizer.Form.NFKD).replaceAll("\\p{M}", "");
        return ascii.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "-")
            .replaceAll("(^-+|-+$)", "");
    }
}
