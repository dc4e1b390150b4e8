package com.phoenix.worker.research;

import com.phoenix.worker.config.WorkerProperties;
import com.phoenix.worker.domain.ResearchFinding;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Picks the snippets worth crawling: excluded domains and low scores are dropped, the rest are
 * ordered by score with rank and URL breaking ties, and cut to the candidate budget.
 */
@Component
public class CandidateFilter {

    static final Comparator<ResearchFinding> PROMOTION_ORDER = Comparator
        .comparingDouble(ResearchFinding::relevance).reversed()
        .thenComparingInt(ResearchFinding::rank)
        .thenComparing(ResearchFinding::sourceUrl);

    private final List<String> excludedDomains;
    private final double relevanceThreshold;
    private final int candidateBudget;

    public CandidateFilter(WorkerProperties properties) {
        this.excludedDomains = properties.getExcludedDomains().stream()
            .map(domain -> domain.trim().toLowerCase(Locale.ROOT))
            .filter(domain -> !domain.isEmpty())
            .toList();
        this.relevanceThreshold = properties.getRelevanceThreshold();
        this.candidateBudget = Math.max(0, properties.getCrawlCandidateBudget());
    }

    public List<ResearchFinding> promote(Collection<ResearchFinding> snippets) {
        return snippets.stream()
            .filter(finding -> !isExcluded(finding.sourceUrl()))
            .filter(finding -> finding.relevance() >= relevanceThreshold)
            .sorted(PROMOTION_ORDER)
            .limit(candidateBudget)
            .toList();
    }

    public boolean isExcluded(String url) {
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException | NullPointerException ex) {
            return true;
        }
        if (uri.getHost() == null) {
            return true;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        String hostAndPath = host + path;
        for (String excluded : excludedDomains) {
            if (excluded.contains("/")) {
                if (hostAndPath.startsWith(excluded) || hostAndPath.contains("." + excluded)) {
                    return true;
                }
            } else if (host.equals(excluded) || host.endsWith("." + excluded)) {
                return true;
            }
        }
        return false;
    }
}
