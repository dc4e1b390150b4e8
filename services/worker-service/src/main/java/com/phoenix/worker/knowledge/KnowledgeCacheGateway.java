package com.phoenix.worker.knowledge;

import com.google.common.util.concurrent.Striped;
import com.phoenix.worker.client.KnowledgeGraphClient;
import com.phoenix.worker.client.StoredKnowledge;
import com.phoenix.worker.domain.KnowledgeEntity;
import com.phoenix.worker.domain.KnowledgeRecord;
import com.phoenix.worker.domain.KnowledgeSource;
import com.phoenix.worker.domain.ResearchFinding;
import com.phoenix.worker.domain.Subject;
import com.phoenix.worker.domain.WorkflowKind;
import com.phoenix.worker.runtime.ActivityNames;
import com.phoenix.worker.runtime.IdempotencyStore;
import com.phoenix.worker.runtime.MdcAwareExecutor;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.Lock;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Read-through, write-behind access to the knowledge store.
 * <p>
 * Lookups never fail: an unreachable store yields an empty record marked {@link KnowledgeSource#UNAVAILABLE}.
 * Deposits run in the background and never fail the caller; for a given subject they only ever
 * raise the stored coverage.
 */
@Service
public class KnowledgeCacheGateway {

    private static final Logger LOGGER = LoggerFactory.getLogger(KnowledgeCacheGateway.class);
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");

    private final KnowledgeGraphClient client;
    private final CoverageCalculator coverageCalculator;
    private final IdempotencyStore idempotencyStore;
    private final Executor activityExecutor;
    private final DepositFailureLog failureLog;
    private final Striped<Lock> subjectLocks = Striped.lock(64);
    private final ConcurrentMap<String, Double> depositedCoverage = new ConcurrentHashMap<>();

    public KnowledgeCacheGateway(
        KnowledgeGraphClient client,
        CoverageCalculator coverageCalculator,
        IdempotencyStore idempotencyStore,
        @Qualifier("activityExecutor") Executor activityExecutor,
        DepositFailureLog failureLog
    ) {
        this.client = client;
        this.coverageCalculator = coverageCalculator;
        this.idempotencyStore = idempotencyStore;
        this.activityExecutor = new MdcAwareExecutor(activityExecutor);
        this.failureLog = failureLog;
    }

    public KnowledgeRecord lookup(Subject subject) {
        Optional<StoredKnowledge> stored;
        try {
            stored = client.lookup(subject.id());
        } catch (RuntimeException ex) {
            LOGGER.warn("Knowledge store unavailable for subject {}, continuing without it: {}",
                subject.id(), ex.getMessage());
            return KnowledgeRecord.empty(subject, KnowledgeSource.UNAVAILABLE);
        }
        if (stored.isEmpty()) {
            LOGGER.info("Knowledge miss for subject {}", subject.id());
            return KnowledgeRecord.empty(subject, KnowledgeSource.MISS);
        }
        KnowledgeRecord record = fromStored(subject, stored.get());
        LOGGER.info("Knowledge hit for subject {} with coverage {}", subject.id(), record.coverage());
        return record;
    }

    /**
     * Folds usable findings into the record. Applying the same findings twice gives the same record.
     */
    public KnowledgeRecord enrich(KnowledgeRecord record, Collection<ResearchFinding> findings) {
        List<ResearchFinding> usable = findings == null ? List.of() : findings.stream()
            .filter(ResearchFinding::isUsable)
            .sorted(Comparator.comparing(ResearchFinding::sourceUrl)
                .thenComparing(Comparator.comparingDouble(ResearchFinding::relevance).reversed())
                .thenComparing(f -> f.tier().name()))
            .toList();

        StringBuilder narrative = new StringBuilder();
        Set<String> knownSentences = new LinkedHashSet<>();
        for (String sentence : sentences(record.narrative())) {
            appendSentence(narrative, knownSentences, sentence);
        }
        Map<String, KnowledgeEntity> entities = new LinkedHashMap<>(record.entities());
        Instant lastUpdated = record.lastUpdated();

        for (ResearchFinding finding : usable) {
            for (String sentence : sentences(finding.excerpt())) {
                appendSentence(narrative, knownSentences, sentence);
            }
            finding.facts().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(fact -> mergeEntity(entities, fact.getKey(), fact.getValue(), finding));
            if (finding.retrievedAt() != null && (lastUpdated == null || finding.retrievedAt().isAfter(lastUpdated))) {
                lastUpdated = finding.retrievedAt();
            }
        }

        double computed = coverageCalculator.coverage(record.kind(), entities.keySet());
        return new KnowledgeRecord(
            record.subjectId(),
            record.kind(),
            Math.max(record.coverage(), computed),
            narrative.toString(),
            entities,
            lastUpdated,
            record.source()
        );
    }

    /**
     * Writes the record in the background. The returned future always completes normally;
     * failures are recorded in the {@link DepositFailureLog}.
     */
    public CompletableFuture<Void> deposit(UUID instanceId, KnowledgeRecord record) {
        String key = idempotencyStore.key(instanceId, ActivityNames.KNOWLEDGE_DEPOSIT, record);
        if (!idempotencyStore.markIfAbsent(key)) {
            LOGGER.debug("Deposit for subject {} already issued by instance {}", record.subjectId(), instanceId);
            return CompletableFuture.completedFuture(null);
        }
        try {
            return CompletableFuture.runAsync(() -> write(record), activityExecutor)
                .exceptionally(ex -> {
                    idempotencyStore.forget(key);
                    failureLog.record(instanceId, record.subjectId(), record.coverage(), unwrap(ex));
                    return null;
                });
        } catch (RuntimeException ex) {
            idempotencyStore.forget(key);
            failureLog.record(instanceId, record.subjectId(), record.coverage(), ex);
            return CompletableFuture.completedFuture(null);
        }
    }

    private void write(KnowledgeRecord record) {
        Lock lock = subjectLocks.get(record.subjectId());
        lock.lock();
        try {
            Double highWater = depositedCoverage.get(record.subjectId());
            if (highWater != null && record.coverage() < highWater) {
                LOGGER.info("Skipping deposit for subject {}: coverage {} is below deposited {}",
                    record.subjectId(), record.coverage(), highWater);
                return;
            }
            client.write(record.subjectId(), toStored(record));
            depositedCoverage.merge(record.subjectId(), record.coverage(), Math::max);
            LOGGER.info("Deposited knowledge for subject {} with coverage {}", record.subjectId(), record.coverage());
        } finally {
            lock.unlock();
        }
    }

    private KnowledgeRecord fromStored(Subject subject, StoredKnowledge stored) {
        Map<String, KnowledgeEntity> entities = new LinkedHashMap<>();
        if (stored.entities() != null) {
            for (StoredKnowledge.StoredEntity entity : stored.entities()) {
                String name = CoverageCalculator.normalize(entity.name());
                if (name.isEmpty()) {
                    continue;
                }
                KnowledgeEntity candidate = new KnowledgeEntity(name, entity.value(), entity.sourceUrl(), entity.relevance());
                entities.merge(name, candidate, (current, next) -> next.relevance() > current.relevance() ? next : current);
            }
        }
        WorkflowKind kind = subject.kind();
        double computed = coverageCalculator.coverage(kind, entities.keySet());
        double storedCoverage = Math.min(1.0, Math.max(0.0, stored.coverage()));
        return new KnowledgeRecord(
            subject.id(),
            kind,
            Math.max(storedCoverage, computed),
            stored.narrative(),
            entities,
            stored.lastUpdated(),
            KnowledgeSource.STORE
        );
    }

    private static StoredKnowledge toStored(KnowledgeRecord record) {
        List<StoredKnowledge.StoredEntity> entities = new ArrayList<>();
        record.entities().values().forEach(entity -> entities.add(
            new StoredKnowledge.StoredEntity(entity.name(), entity.value(), entity.sourceUrl(), entity.relevance())));
        return new StoredKnowledge(
            record.subjectId(),
            record.kind() == null ? null : record.kind().name().toLowerCase(Locale.ROOT),
            record.coverage(),
            record.narrative(),
            entities,
            record.lastUpdated()
        );
    }

    private static void mergeEntity(Map<String, KnowledgeEntity> entities, String rawName, String value, ResearchFinding finding) {
        String name = CoverageCalculator.normalize(rawName);
        if (name.isEmpty() || value == null || value.isBlank()) {
            return;
        }
        KnowledgeEntity candidate = new KnowledgeEntity(name, value, finding.sourceUrl(), finding.relevance());
        KnowledgeEntity current = entities.get(name);
        if (current == null || candidate.relevance() > current.relevance()) {
            entities.put(name, candidate);
        }
    }

    private static void appendSentence(StringBuilder narrative, Set<String> knownSentences, String sentence) {
        String terminated = terminate(sentence);
        if (knownSentences.add(normalizeSentence(terminated))) {
            if (narrative.length() > 0) {
                narrative.append(' ');
            }
            narrative.append(terminated);
        }
    }

    private static List<String> sentences(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (String part : SENTENCE_BREAK.split(text.trim())) {
            String sentence = part.trim();
            if (!sentence.isEmpty()) {
                result.add(sentence);
            }
        }
        return result;
    }

    private static String terminate(String sentence) {
        char last = sentence.charAt(sentence.length() - 1);
        return last == '.' || last == '!' || last == '?' ? sentence : sentence + ".";
    }

    private static String normalizeSentence(String sentence) {
        return sentence.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    private static Throwable unwrap(Throwable ex) {
        return ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    }
}
