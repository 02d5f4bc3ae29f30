package com.ifip.exhibits.controller;

import com.ifip.exhibits.domain.RunStatus;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record CrawlRunResponse(
    UUID runId,
    RunStatus status,
    Instant startedAt,
    Instant completedAt,
    int startYear,
    int endYear,
    int indicesAcquired,
    int filingsMatched,
    int pagesProcessed,
    int pagesSkipped,
    int exhibitsFound,
    int failedCount,
    String errorSummary,
    ProgressItem progress,
    List<FailureItem> recentFailures
) {
    public record ProgressItem(String stage, int retryPass, int pendingRetries, Instant updatedAt) {
    }

    public record FailureItem(String indexHtmlUrl, String code, String reason, Instant createdAt) {
    }
}
