package com.phoenix.worker.research;

import com.phoenix.worker.client.SearchHit;
import com.phoenix.worker.config.WorkerProperties;
import com.phoenix.worker.domain.Subject;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Scores a search snippet by its rank, discounted when neither title nor snippet names the subject.
 */
@Component
public class RelevanceScorer {

    private final double rankDecay;
    private final double unmatchedSnippetFactor;

    public RelevanceScorer(WorkerProperties properties) {
        this.rankDecay = properties.getRankDecay();
        this.unmatchedSnippetFactor = properties.getUnmatchedSnippetFactor();
    }

    public double score(Subject subject, SearchHit hit) {
        int rank = Math.max(1, hit.rank());
        double byRank = Math.pow(rankDecay, rank - 1);
        return byRank * (mentions(subject, hit) ? 1.0 : unmatchedSnippetFactor);
    }

    private static boolean mentions(Subject subject, SearchHit hit) {
        String name = subject.displayName().toLowerCase(Locale.ROOT);
        return contains(hit.title(), name) || contains(hit.snippet(), name);
    }

    private static boolean contains(String text, String name) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(name);
    }
}
