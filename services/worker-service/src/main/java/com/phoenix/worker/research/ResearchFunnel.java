package com.phoenix.worker.research;

import com.phoenix.worker.client.CrawlPage;
import com.phoenix.worker.client.CrawlService;
import com.phoenix.worker.client.EscalationProvider;
import com.phoenix.worker.client.SearchHit;
import com.phoenix.worker.client.SearchProvider;
import com.phoenix.worker.config.WorkerProperties;
import com.phoenix.worker.domain.FailureKind;
import com.phoenix.worker.domain.FailureReason;
import com.phoenix.worker.domain.KnowledgeRecord;
import com.phoenix.worker.domain.ResearchFinding;
import com.phoenix.worker.domain.SourceTier;
import com.phoenix.worker.domain.Subject;
import com.phoenix.worker.knowledge.CoverageCalculator;
import com.phoenix.worker.runtime.ActivityFailedException;
import com.phoenix.worker.runtime.ActivityInvoker;
import com.phoenix.worker.runtime.ActivityNames;
import com.phoenix.worker.runtime.CostCeilingReachedException;
import com.phoenix.worker.runtime.MdcAwareExecutor;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Staged research for one subject: cheap search snippets first, then full-page crawls of the
 * best candidates, then an optional escalation for whatever required fields are still missing.
 * <p>
 * Every paid call is charged to the instance's {@link CostLedger} once, before its first attempt;
 * retries of the same call are not charged again. Research stops as soon as coverage reaches the
 * threshold or the ledger refuses a charge.
 */
@Service
public class ResearchFunnel {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResearchFunnel.class);
    private static final int EXCERPT_LIMIT = 600;

    private final SearchProvider searchProvider;
    private final CrawlService crawlService;
    private final Optional<EscalationProvider> escalationProvider;
    private final CoverageCalculator coverageCalculator;
    private final RelevanceScorer relevanceScorer;
    private final CandidateFilter candidateFilter;
    private final ActivityInvoker invoker;
    private final Executor crawlExecutor;
    private final WorkerProperties properties;
    private final Clock clock;

    public ResearchFunnel(
        SearchProvider searchProvider,
        CrawlService crawlService,
        Optional<EscalationProvider> escalationProvider,
        CoverageCalculator coverageCalculator,
        RelevanceScorer relevanceScorer,
        CandidateFilter candidateFilter,
        ActivityInvoker invoker,
        @Qualifier("crawlExecutor") Executor crawlExecutor,
        WorkerProperties properties,
        Clock clock
    ) {
        this.searchProvider = searchProvider;
        this.crawlService = crawlService;
        this.escalationProvider = escalationProvider;
        this.coverageCalculator = coverageCalculator;
        this.relevanceScorer = relevanceScorer;
        this.candidateFilter = candidateFilter;
        this.invoker = invoker;
        this.crawlExecutor = new MdcAwareExecutor(crawlExecutor);
        this.properties = properties;
        this.clock = clock;
    }

    public FunnelResult run(FunnelRequest request) {
        Subject subject = request.subject();
        CostLedger ledger = request.ledger();
        long startingCost = ledger.spent();
        boolean ceilingHit = false;
        boolean degraded = false;

        SearchOutcome search = search(request);
        ceilingHit |= search.ceilingHit();
        Map<String, ResearchFinding> findings = new LinkedHashMap<>();
        for (ResearchFinding candidate : candidateFilter.promote(search.snippets().values())) {
            findings.put(candidate.sourceUrl(), candidate);
        }
        request.sink().publish(findings.values());
        double coverage = coverageOf(request.prior(), findings);
        LOGGER.info("Search stage for {}: {} snippets, {} promoted, coverage {}",
            subject.id(), search.snippets().size(), findings.size(), coverage);

        int crawledWords = 0;
        if (!ceilingHit && coverage < properties.getCoverageThreshold() && !findings.isEmpty()) {
            CrawlOutcome crawl = crawl(request, List.copyOf(findings.values()));
            ceilingHit |= crawl.ceilingHit();
            crawledWords = crawl.wordCount();
            crawl.findings().forEach(finding -> findings.put(finding.sourceUrl(), finding));
            request.sink().publish(findings.values());
            coverage = coverageOf(request.prior(), findings);
            LOGGER.info("Crawl stage for {}: {} crawled, {} failed, {} words, coverage {}",
                subject.id(), crawl.succeeded(), crawl.failed(), crawledWords, coverage);
        }

        if (!ceilingHit && coverage < properties.getCoverageThreshold() && escalationProvider.isPresent()) {
            try {
                for (ResearchFinding finding : escalate(request, escalationProvider.get(), findings)) {
                    findings.merge(finding.sourceUrl(), finding, ResearchFunnel::higherScore);
                }
                request.sink().publish(findings.values());
                coverage = coverageOf(request.prior(), findings);
            } catch (CostCeilingReachedException ex) {
                ceilingHit = true;
            } catch (ActivityFailedException ex) {
                degraded = true;
                LOGGER.warn("Escalation unavailable for {}, keeping cheaper findings: {}", subject.id(), ex.getMessage());
            }
        }

        boolean partial = ceilingHit && coverage < properties.getCoverageThreshold();
        if (partial) {
            LOGGER.warn("Cost ceiling of {} micros reached for {} at coverage {}", ledger.ceiling(), subject.id(), coverage);
        }
        return new FunnelResult(
            List.copyOf(findings.values()),
            coverage,
            partial,
            degraded,
            ledger.spent() - startingCost,
            crawledWords
        );
    }

    private SearchOutcome search(FunnelRequest request) {
        Subject subject = request.subject();
        int perPage = properties.getSearchResultsPerPage();
        Map<String, ResearchFinding> snippets = new LinkedHashMap<>();
        boolean charged = false;

        for (String query : request.queries()) {
            for (int page = 1; page <= properties.getSearchPageBudget(); page++) {
                int currentPage = page;
                List<SearchHit> hits;
                try {
                    hits = invoker.invoke(request.scope(), ActivityNames.SEARCH, new SearchInput(query, currentPage, perPage),
                        () -> request.ledger().charge(properties.getSearchCostMicros()),
                        () -> searchProvider.search(query, currentPage, perPage));
                } catch (CostCeilingReachedException ex) {
                    if (!charged && request.prior().coverage() <= 0.0) {
                        throw new ActivityFailedException(new FailureReason(
                            FailureKind.VALIDATION, ActivityNames.SEARCH,
                            "cost ceiling breached before any useful result"), ex);
                    }
                    return new SearchOutcome(snippets, true);
                }
                charged = true;
                if (hits == null || hits.isEmpty()) {
                    break;
                }
                for (SearchHit hit : hits) {
                    ResearchFinding snippet = new ResearchFinding(
                        hit.url(),
                        SourceTier.SEARCH_SNIPPET,
                        hit.rank(),
                        relevanceScorer.score(subject, hit),
                        Map.of(),
                        snippetText(hit),
                        0L,
                        clock.instant()
                    );
                    snippets.merge(snippet.sourceUrl(), snippet, ResearchFunnel::higherScore);
                }
            }
        }
        return new SearchOutcome(snippets, false);
    }

    private CrawlOutcome crawl(FunnelRequest request, List<ResearchFinding> candidates) {
        AtomicBoolean ceilingHit = new AtomicBoolean();
        List<CompletableFuture<CrawlAttempt>> futures = new ArrayList<>();
        for (ResearchFinding candidate : candidates) {
            futures.add(CompletableFuture.supplyAsync(() -> crawlOne(request, candidate, ceilingHit), crawlExecutor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();

        List<ResearchFinding> results = new ArrayList<>();
        int succeeded = 0;
        int failed = 0;
        int words = 0;
        for (CompletableFuture<CrawlAttempt> future : futures) {
            CrawlAttempt attempt = future.join();
            results.add(attempt.finding());
            words += attempt.wordCount();
            if (attempt.finding().tier() == SourceTier.CRAWLED_FULL) {
                succeeded++;
            } else if (!attempt.finding().isUsable()) {
                failed++;
            }
        }
        return new CrawlOutcome(results, ceilingHit.get(), succeeded, failed, words);
    }

    private CrawlAttempt crawlOne(FunnelRequest request, ResearchFinding candidate, AtomicBoolean ceilingHit) {
        String url = candidate.sourceUrl();
        long crawlCost = properties.getCrawlCostMicros();
        try {
            CrawlPage page = invoker.invoke(request.scope(), ActivityNames.CRAWL, url,
                () -> request.ledger().charge(crawlCost),
                () -> crawlService.fetch(url));
            Map<String, String> facts = normalizeFacts(page.facts());
            double contentScore = coverageCalculator.coverage(request.subject().kind(), facts.keySet());
            ResearchFinding crawled = new ResearchFinding(
                url,
                SourceTier.CRAWLED_FULL,
                candidate.rank(),
                Math.max(candidate.relevance(), contentScore),
                facts,
                abbreviate(page.text()),
                crawlCost,
                clock.instant()
            );
            return new CrawlAttempt(crawled, page.wordCount());
        } catch (CostCeilingReachedException ex) {
            ceilingHit.set(true);
            return new CrawlAttempt(candidate, 0);
        } catch (ActivityFailedException ex) {
            LOGGER.warn("Crawl of {} abandoned: {}", url, ex.getReason().message());
            return new CrawlAttempt(candidate.crawlFailed(ex.getReason().message(), crawlCost, clock.instant()), 0);
        }
    }

    private List<ResearchFinding> escalate(FunnelRequest request, EscalationProvider provider, Map<String, ResearchFinding> findings) {
        Subject subject = request.subject();
        Set<String> missing = coverageCalculator.missingFields(subject.kind(), knownNames(request.prior(), findings));
        Set<String> covered = new TreeSet<>(findings.keySet());
        EscalationProvider.EscalationRequest escalation =
            new EscalationProvider.EscalationRequest(subject.displayName(), subject.kind(), missing, covered);

        List<EscalationProvider.EscalationHit> hits = invoker.invoke(request.scope(), ActivityNames.ESCALATION, escalation,
            () -> request.ledger().charge(properties.getEscalationCostMicros()),
            () -> provider.research(escalation));

        List<ResearchFinding> escalated = new ArrayList<>();
        int rank = 1;
        for (EscalationProvider.EscalationHit hit : hits == null ? List.<EscalationProvider.EscalationHit>of() : hits) {
            if (covered.contains(hit.url())) {
                continue;
            }
            escalated.add(new ResearchFinding(
                hit.url(),
                SourceTier.ESCALATED,
                rank++,
                Math.min(1.0, Math.max(0.0, hit.score())),
                normalizeFacts(hit.facts()),
                abbreviate(hit.text()),
                0L,
                clock.instant()
            ));
        }
        LOGGER.info("Escalation for {} asked for {} and returned {} new findings", subject.id(), missing, escalated.size());
        return escalated;
    }

    private double coverageOf(KnowledgeRecord prior, Map<String, ResearchFinding> findings) {
        double computed = coverageCalculator.coverage(prior.kind(), knownNames(prior, findings));
        return Math.max(prior.coverage(), computed);
    }

    private static Set<String> knownNames(KnowledgeRecord prior, Map<String, ResearchFinding> findings) {
        Set<String> names = new LinkedHashSet<>(prior.entities().keySet());
        findings.values().stream()
            .filter(ResearchFinding::isUsable)
            .forEach(finding -> names.addAll(finding.facts().keySet()));
        return names;
    }

    private static Map<String, String> normalizeFacts(Map<String, String> facts) {
        Map<String, String> normalized = new LinkedHashMap<>();
        if (facts == null) {
            return normalized;
        }
        facts.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(fact -> {
                String name = CoverageCalculator.normalize(fact.getKey());
                if (!name.isEmpty() && !ResearchFinding.CRAWL_FAILED.equals(name)
                    && fact.getValue() != null && !fact.getValue().isBlank()) {
                    normalized.putIfAbsent(name, fact.getValue().trim());
                }
            });
        return normalized;
    }

    static ResearchFinding higherScore(ResearchFinding current, ResearchFinding candidate) {
        return Comparator.comparingDouble(ResearchFinding::relevance)
            .thenComparing(Comparator.comparingInt(ResearchFinding::rank).reversed())
            .compare(candidate, current) > 0 ? candidate : current;
    }

    private static String snippetText(SearchHit hit) {
        if (hit.title() == null || hit.title().isBlank()) {
            return hit.snippet();
        }
        if (hit.snippet() == null || hit.snippet().isBlank()) {
            return hit.title();
        }
        return hit.title() + ". " + hit.snippet();
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim().replaceAll("\\s+", " ");
        if (trimmed.length() <= EXCERPT_LIMIT) {
            return trimmed;
        }
        int cut = trimmed.lastIndexOf(' ', EXCERPT_LIMIT);
        return trimmed.substring(0, cut > 0 ? cut : EXCERPT_LIMIT) + "...";
    }

    record SearchInput(String query, int page, int resultsPerPage) {
    }

    private record SearchOutcome(Map<String, ResearchFinding> snippets, boolean ceilingHit) {
    }

    private record CrawlOutcome(List<ResearchFinding> findings, boolean ceilingHit, int succeeded, int failed, int wordCount) {
    }

    private record CrawlAttempt(ResearchFinding finding, int wordCount) {
    }
}
