package com.phoenix.worker.knowledge;

import com.phoenix.worker.config.WorkerProperties;
import com.phoenix.worker.domain.WorkflowKind;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Coverage is the share of a kind's required fields for which at least one fact is known.
 */
@Component
public class CoverageCalculator {

    private final Set<String> companyFields;
    private final Set<String> articleFields;

    public CoverageCalculator(WorkerProperties properties) {
        this.companyFields = normalizeAll(properties.getCompanyRequiredFields());
        this.articleFields = normalizeAll(properties.getArticleRequiredFields());
    }

    public Set<String> requiredFields(WorkflowKind kind) {
        return kind == WorkflowKind.ARTICLE ? articleFields : companyFields;
    }

    public double coverage(WorkflowKind kind, Collection<String> knownNames) {
        Set<String> required = requiredFields(kind);
        if (required.isEmpty()) {
            return 1.0;
        }
        Set<String> known = normalizeAll(knownNames);
        long covered = required.stream().filter(known::contains).count();
        return (double) covered / required.size();
    }

    /**
     * @return required fields with no known fact, in name order
     */
    public Set<String> missingFields(WorkflowKind kind, Collection<String> knownNames) {
        Set<String> known = normalizeAll(knownNames);
        Set<String> missing = new TreeSet<>(requiredFields(kind));
        missing.removeAll(known);
        return missing;
    }

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
    }

    private static Set<String> normalizeAll(Collection<String> names) {
        Set<String> normalized = new LinkedHashSet<>();
        if (names == null) {
            return normalized;
        }
        for (String name : names) {
            String value = normalize(name);
            if (!value.isEmpty()) {
                normalized.add(value);
            }
        }
        return normalized;
    }
}
