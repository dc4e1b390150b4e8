package com.phoenix.worker.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "worker")
public class WorkerProperties {

    private String taskQueueName = "phoenix-queue";
    private int concurrencyCeiling = 8;
    private long pollTimeoutMs = 500;

    private long costCeilingMicros = 100_000;
    private double coverageThreshold = 0.8;
    private int searchPageBudget = 2;
    private int searchResultsPerPage = 10;
    private int crawlCandidateBudget = 10;
    private double relevanceThreshold = 0.2;
    private double rankDecay = 0.9;
    private double unmatchedSnippetFactor = 0.85;
    private long searchCostMicros = 1_000;
    private long crawlCostMicros = 500;
    private long escalationCostMicros = 10_000;
    private int crawlMaxAttempts = 2;
    private List<String> excludedDomains = new ArrayList<>(List.of(
        "wsj.com", "ft.com", "economist.com", "bloomberg.com/professional", "barrons.com",
        "nytimes.com", "washingtonpost.com", "hbr.org", "seekingalpha.com",
        "twitter.com", "x.com", "linkedin.com", "facebook.com", "instagram.com",
        "reddit.com", "youtube.com", "tiktok.com", "pinterest.com"
    ));

    private List<String> companyRequiredFields = new ArrayList<>(List.of(
        "overview", "headquarters", "founded_year", "services", "key_people", "recent_deals"
    ));
    private List<String> articleRequiredFields = new ArrayList<>(List.of(
        "summary", "background", "key_facts", "stakeholders", "timeline"
    ));
    private List<String> articleMediaRoles = new ArrayList<>(List.of("featured"));

    private long activityTimeoutMs = 30_000;
    private int activityMaxAttempts = 3;
    private long initialBackoffMs = 500;
    private double backoffMultiplier = 2.0;
    private long maxBackoffMs = 10_000;
    private Map<String, ActivityOverride> activities = new HashMap<>();

    private long idempotencyTtlMinutes = 60;
    private long idempotencyMaxEntries = 10_000;
    private int depositFailureLogSize = 100;

    public String getTaskQueueName() {
        return taskQueueName;
    }

    public void setTaskQueueName(String taskQueueName) {
        this.taskQueueName = taskQueueName;
    }

    public int getConcurrencyCeiling() {
        return concurrencyCeiling;
    }

    public void setConcurrencyCeiling(int concurrencyCeiling) {
        this.concurrencyCeiling = concurrencyCeiling;
    }

    public long getPollTimeoutMs() {
        return pollTimeoutMs;
    }

    public void setPollTimeoutMs(long pollTimeoutMs) {
        this.pollTimeoutMs = pollTimeoutMs;
    }

    public long getCostCeilingMicros() {
        return costCeilingMicros;
    }

    public void setCostCeilingMicros(long costCeilingMicros) {
        this.costCeilingMicros = costCeilingMicros;
    }

    public double getCoverageThreshold() {
        return coverageThreshold;
    }

    public void setCoverageThreshold(double coverageThreshold) {
        this.coverageThreshold = coverageThreshold;
    }

    public int getSearchPageBudget() {
        return searchPageBudget;
    }

    public void setSearchPageBudget(int searchPageBudget) {
        this.searchPageBudget = searchPageBudget;
    }

    public int getSearchResultsPerPage() {
        return searchResultsPerPage;
    }

    public void setSearchResultsPerPage(int searchResultsPerPage) {
        this.searchResultsPerPage = searchResultsPerPage;
    }

    public int getCrawlCandidateBudget() {
        return crawlCandidateBudget;
    }

    public void setCrawlCandidateBudget(int crawlCandidateBudget) {
        this.crawlCandidateBudget = crawlCandidateBudget;
    }

    public double getRelevanceThreshold() {
        return relevanceThreshold;
    }

    public void setRelevanceThreshold(double relevanceThreshold) {
        this.relevanceThreshold = relevanceThreshold;
    }

    public double getRankDecay() {
        return rankDecay;
    }

    public void setRankDecay(double rankDecay) {
        this.rankDecay = rankDecay;
    }

    public double getUnmatchedSnippetFactor() {
        return unmatchedSnippetFactor;
    }

    public void setUnmatchedSnippetFactor(double unmatchedSnippetFactor) {
        this.unmatchedSnippetFactor = unmatchedSnippetFactor;
    }

    public long getSearchCostMicros() {
        return searchCostMicros;
    }

    public void setSearchCostMicros(long searchCostMicros) {
        this.searchCostMicros = searchCostMicros;
    }

    public long getCrawlCostMicros() {
        return crawlCostMicros;
    }

    public void setCrawlCostMicros(long crawlCostMicros) {
        this.crawlCostMicros = crawlCostMicros;
    }

    public long getEscalationCostMicros() {
        return escalationCostMicros;
    }

    public void setEscalationCostMicros(long escalationCostMicros) {
        this.escalationCostMicros = escalationCostMicros;
    }

    public int getCrawlMaxAttempts() {
        return crawlMaxAttempts;
    }

    public void setCrawlMaxAttempts(int crawlMaxAttempts) {
        this.crawlMaxAttempts = crawlMaxAttempts;
    }

    public List<String> getExcludedDomains() {
        return excludedDomains;
    }

    public void setExcludedDomains(List<String> excludedDomains) {
        this.excludedDomains = excludedDomains;
    }

    public List<String> getCompanyRequiredFields() {
        return companyRequiredFields;
    }

    public void setCompanyRequiredFields(List<String> companyRequiredFields) {
        this.companyRequiredFields = companyRequiredFields;
    }

    public List<String> getArticleRequiredFields() {
        return articleRequiredFields;
    }

    public void setArticleRequiredFields(List<String> articleRequiredFields) {
        this.articleRequiredFields = articleRequiredFields;
    }

    public List<String> getArticleMediaRoles() {
        return articleMediaRoles;
    }

    public void setArticleMediaRoles(List<String> articleMediaRoles) {
        this.articleMediaRoles = articleMediaRoles;
    }

    public long getActivityTimeoutMs() {
        return activityTimeoutMs;
    }

    public void setActivityTimeoutMs(long activityTimeoutMs) {
        this.activityTimeoutMs = activityTimeoutMs;
    }

    public int getActivityMaxAttempts() {
        return activityMaxAttempts;
    }

    public void setActivityMaxAttempts(int activityMaxAttempts) {
        this.activityMaxAttempts = activityMaxAttempts;
    }

    public long getInitialBackoffMs() {
        return initialBackoffMs;
    }

    public void setInitialBackoffMs(long initialBackoffMs) {
        this.initialBackoffMs = initialBackoffMs;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public long getMaxBackoffMs() {
        return maxBackoffMs;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
        this.maxBackoffMs = maxBackoffMs;
    }

    public Map<String, ActivityOverride> getActivities() {
        return activities;
    }

    public void setActivities(Map<String, ActivityOverride> activities) {
        this.activities = activities;
    }

    public long getIdempotencyTtlMinutes() {
        return idempotencyTtlMinutes;
    }

    public void setIdempotencyTtlMinutes(long idempotencyTtlMinutes) {
        this.idempotencyTtlMinutes = idempotencyTtlMinutes;
    }

    public long getIdempotencyMaxEntries() {
        return idempotencyMaxEntries;
    }

    public void setIdempotencyMaxEntries(long idempotencyMaxEntries) {
        this.idempotencyMaxEntries = idempotencyMaxEntries;
    }

    public int getDepositFailureLogSize() {
        return depositFailureLogSize;
    }

    public void setDepositFailureLogSize(int depositFailureLogSize) {
        this.depositFailureLogSize = depositFailureLogSize;
    }

    /**
     * Per-activity timeout and attempt limits; unset values fall back to the worker defaults.
     */
    public static class ActivityOverride {

        private Long timeoutMs;
        private Integer maxAttempts;

        public Long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(Long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public Integer getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(Integer maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }
}
